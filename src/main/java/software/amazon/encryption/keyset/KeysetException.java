// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.keyset;

import software.amazon.awssdk.core.exception.SdkClientException;

/**
 * Base exception class for all keyset library exceptions.
 * This exception is thrown when errors occur while registering key managers, managing keysets,
 * instantiating primitives, or reading and writing keysets.
 */
public class KeysetException extends SdkClientException {

    private KeysetException(Builder b) {
        super(b);
    }

    /**
     * Constructs a new KeysetException with the specified error message.
     * @param message a description of the error
     */
    public KeysetException(String message) {
        super(KeysetException.builder()
                .message(message));
    }

    /**
     * Constructs a new KeysetException with the specified error message and cause.
     * @param message a description of the error
     * @param cause the underlying cause of this exception
     */
    public KeysetException(String message, Throwable cause) {
        super(KeysetException.builder()
                .message(message)
                .cause(cause));
    }

    @Override
    public Builder toBuilder() {
        return new BuilderImpl(this);
    }

    /**
     * Creates a new builder for constructing KeysetException instances.
     * @return a new Builder instance
     */
    public static Builder builder() {
        return new BuilderImpl();
    }

    /**
     * Builder interface for constructing KeysetException instances.
     */
    public interface Builder extends SdkClientException.Builder {
        @Override
        Builder message(String message);

        @Override
        Builder cause(Throwable cause);

        @Override
        KeysetException build();
    }

    protected static final class BuilderImpl extends SdkClientException.BuilderImpl implements Builder {

        protected BuilderImpl() {
        }

        protected BuilderImpl(KeysetException ex) {
            super(ex);
        }

        @Override
        public Builder message(String message) {
            this.message = message;
            return this;
        }

        @Override
        public Builder cause(Throwable cause) {
            this.cause = cause;
            return this;
        }

        @Override
        public KeysetException build() {
            return new KeysetException(this);
        }
    }
}
