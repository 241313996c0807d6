// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.keyset;

/**
 * Thrown when a keyset, or an operation on a {@link KeysetManager}, would violate a keyset invariant:
 * an empty keyset, a missing or non-enabled primary, duplicate key ids, or a forbidden status transition.
 */
public class InvalidKeysetStateException extends KeysetException {

    public InvalidKeysetStateException(String message) {
        super(message);
    }

    public InvalidKeysetStateException(String message, Throwable cause) {
        super(message, cause);
    }
}
