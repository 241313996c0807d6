// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.keyset;

/**
 * Thrown when serialized key material, a key format or a persisted keyset is malformed or uses
 * unsupported parameters. These errors happen on administrative paths, so the message may carry
 * diagnostic detail; it never carries key bytes.
 */
public class InvalidKeyMaterialException extends KeysetException {

    public InvalidKeyMaterialException(String message) {
        super(message);
    }

    public InvalidKeyMaterialException(String message, Throwable cause) {
        super(message, cause);
    }
}
