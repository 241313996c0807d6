// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.keyset;

/**
 * The single error of the decrypt and verify paths, raised when no candidate key of a keyset
 * accepts a ciphertext, MAC or signature. It always carries the same message and never a cause.
 */
public class AuthenticationFailureException extends KeysetException {

    private static final String MESSAGE = "Authentication failed";

    public AuthenticationFailureException() {
        super(MESSAGE);
    }
}
