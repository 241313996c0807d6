// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.keyset;

/**
 * Thrown when a key manager is registered for a type id that is already bound to a key manager
 * with different behavior (implementation, material class or primitive class).
 */
public class RegistryConflictException extends KeysetException {

    public RegistryConflictException(String message) {
        super(message);
    }

    public RegistryConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
