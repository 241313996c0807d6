// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.keyset.algorithms;

import java.security.GeneralSecurityException;
import java.security.Provider;
import java.security.SecureRandom;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;

import software.amazon.encryption.keyset.internal.CryptoFactory;
import software.amazon.encryption.keyset.primitives.Aead;

/**
 * AES-GCM with a random 12-byte IV and a 16-byte tag.
 * The ciphertext is the IV followed by the GCM output (encrypted data, then tag).
 */
public final class AesGcmAead implements Aead {

    private static final String CIPHER_ALGORITHM = "AES/GCM/NoPadding";
    static final int IV_LENGTH_BYTES = 12;
    static final int TAG_LENGTH_BYTES = 16;
    private static final int TAG_LENGTH_BITS = TAG_LENGTH_BYTES * 8;

    private final SecretKey _key;
    private final Provider _cryptoProvider;
    private final SecureRandom _secureRandom;

    AesGcmAead(SecretKey key, Provider cryptoProvider, SecureRandom secureRandom) {
        _key = key;
        _cryptoProvider = cryptoProvider;
        _secureRandom = secureRandom;
    }

    @Override
    public byte[] encrypt(byte[] plaintext, byte[] associatedData) throws GeneralSecurityException {
        byte[] iv = new byte[IV_LENGTH_BYTES];
        _secureRandom.nextBytes(iv);
        GCMParameterSpec gcmParameterSpec = new GCMParameterSpec(TAG_LENGTH_BITS, iv);

        final Cipher cipher = CryptoFactory.createCipher(CIPHER_ALGORITHM, _cryptoProvider);
        cipher.init(Cipher.ENCRYPT_MODE, _key, gcmParameterSpec, _secureRandom);
        if (associatedData != null) {
            cipher.updateAAD(associatedData);
        }
        byte[] ciphertext = cipher.doFinal(plaintext);

        // The ciphertext is the iv prepended to the GCM output
        byte[] encodedBytes = new byte[iv.length + ciphertext.length];
        System.arraycopy(iv, 0, encodedBytes, 0, iv.length);
        System.arraycopy(ciphertext, 0, encodedBytes, iv.length, ciphertext.length);
        return encodedBytes;
    }

    @Override
    public byte[] decrypt(byte[] ciphertext, byte[] associatedData) throws GeneralSecurityException {
        if (ciphertext.length < IV_LENGTH_BYTES + TAG_LENGTH_BYTES) {
            throw new AEADBadTagException("Ciphertext too short");
        }
        GCMParameterSpec gcmParameterSpec = new GCMParameterSpec(TAG_LENGTH_BITS, ciphertext, 0, IV_LENGTH_BYTES);
        final Cipher cipher = CryptoFactory.createCipher(CIPHER_ALGORITHM, _cryptoProvider);
        cipher.init(Cipher.DECRYPT_MODE, _key, gcmParameterSpec);
        if (associatedData != null) {
            cipher.updateAAD(associatedData);
        }
        return cipher.doFinal(ciphertext, IV_LENGTH_BYTES, ciphertext.length - IV_LENGTH_BYTES);
    }
}
