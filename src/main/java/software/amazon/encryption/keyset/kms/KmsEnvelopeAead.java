// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.keyset.kms;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.security.GeneralSecurityException;
import java.util.Arrays;

import software.amazon.encryption.keyset.KeysetException;
import software.amazon.encryption.keyset.model.KeyTemplate;
import software.amazon.encryption.keyset.primitives.Aead;
import software.amazon.encryption.keyset.registry.Registry;

/**
 * Envelope encryption: every message gets a fresh data encryption key (DEK) generated from a key
 * template, which is encrypted by a remote key encryption key (KEK).
 * <p>
 * Ciphertext: {@code len(encryptedDek) (4 bytes, big-endian) || encryptedDek || dekCiphertext}.
 */
public final class KmsEnvelopeAead implements Aead {

    private static final byte[] EMPTY_ASSOCIATED_DATA = new byte[0];
    private static final int LENGTH_PREFIX_BYTES = 4;

    private final KeyTemplate _dekTemplate;
    private final Aead _remote;

    KmsEnvelopeAead(KeyTemplate dekTemplate, Aead remote) {
        _dekTemplate = dekTemplate;
        _remote = remote;
    }

    @Override
    public byte[] encrypt(byte[] plaintext, byte[] associatedData) throws GeneralSecurityException {
        byte[] dek = newDek();
        try {
            byte[] encryptedDek = _remote.encrypt(dek, EMPTY_ASSOCIATED_DATA);
            byte[] payload = dekAead(dek).encrypt(plaintext, associatedData);
            return ByteBuffer.allocate(LENGTH_PREFIX_BYTES + encryptedDek.length + payload.length)
                    .putInt(encryptedDek.length)
                    .put(encryptedDek)
                    .put(payload)
                    .array();
        } finally {
            Arrays.fill(dek, (byte) 0);
        }
    }

    @Override
    public byte[] decrypt(byte[] ciphertext, byte[] associatedData) throws GeneralSecurityException {
        byte[] encryptedDek;
        byte[] payload;
        try {
            ByteBuffer buffer = ByteBuffer.wrap(ciphertext);
            int encryptedDekLength = buffer.getInt();
            if (encryptedDekLength <= 0 || encryptedDekLength > buffer.remaining()) {
                throw new GeneralSecurityException("Invalid envelope ciphertext");
            }
            encryptedDek = new byte[encryptedDekLength];
            buffer.get(encryptedDek);
            payload = new byte[buffer.remaining()];
            buffer.get(payload);
        } catch (BufferUnderflowException e) {
            throw new GeneralSecurityException("Envelope ciphertext too short", e);
        }

        byte[] dek = _remote.decrypt(encryptedDek, EMPTY_ASSOCIATED_DATA);
        try {
            return dekAead(dek).decrypt(payload, associatedData);
        } finally {
            Arrays.fill(dek, (byte) 0);
        }
    }

    private byte[] newDek() throws GeneralSecurityException {
        try {
            return Registry.generateNewKey(_dekTemplate.typeId(), _dekTemplate.serializedFormat());
        } catch (KeysetException e) {
            throw new GeneralSecurityException("Cannot generate data encryption key", e);
        }
    }

    private Aead dekAead(byte[] dek) throws GeneralSecurityException {
        try {
            return Registry.instantiate(_dekTemplate.typeId(), dek, Aead.class);
        } catch (KeysetException e) {
            throw new GeneralSecurityException("Invalid data encryption key", e);
        }
    }
}
