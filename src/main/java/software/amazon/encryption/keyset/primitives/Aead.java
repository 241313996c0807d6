// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.keyset.primitives;

import java.security.GeneralSecurityException;

/**
 * Authenticated encryption with associated data.
 * The associated data is authenticated but not encrypted; decryption must be given the same
 * associated data that was used for encryption.
 */
public interface Aead {

    byte[] encrypt(byte[] plaintext, byte[] associatedData) throws GeneralSecurityException;

    byte[] decrypt(byte[] ciphertext, byte[] associatedData) throws GeneralSecurityException;
}
