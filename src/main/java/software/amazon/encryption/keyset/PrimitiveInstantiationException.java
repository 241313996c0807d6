// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.keyset;

/**
 * Thrown when one or more keys of a keyset cannot be turned into primitives, or when a remote key
 * cannot be resolved through a registered KMS client.
 */
public class PrimitiveInstantiationException extends KeysetException {

    public PrimitiveInstantiationException(String message) {
        super(message);
    }

    public PrimitiveInstantiationException(String message, Throwable cause) {
        super(message, cause);
    }
}
