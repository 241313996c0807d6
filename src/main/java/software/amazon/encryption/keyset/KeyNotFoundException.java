// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.keyset;

/**
 * Thrown when an operation references a type id, key id, primitive wrapper or KMS client that does not exist.
 */
public class KeyNotFoundException extends KeysetException {

    public KeyNotFoundException(String message) {
        super(message);
    }

    public KeyNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
