// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.keyset;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.security.GeneralSecurityException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

import software.amazon.encryption.keyset.internal.PrimitiveSet;
import software.amazon.encryption.keyset.io.JsonKeysetReader;
import software.amazon.encryption.keyset.io.JsonKeysetWriter;
import software.amazon.encryption.keyset.io.KeysetReader;
import software.amazon.encryption.keyset.io.KeysetWriter;
import software.amazon.encryption.keyset.model.EncryptedKeyset;
import software.amazon.encryption.keyset.model.KeyEntry;
import software.amazon.encryption.keyset.model.KeyMaterialClass;
import software.amazon.encryption.keyset.model.KeyStatus;
import software.amazon.encryption.keyset.model.KeyTemplate;
import software.amazon.encryption.keyset.model.Keyset;
import software.amazon.encryption.keyset.model.KeysetInfo;
import software.amazon.encryption.keyset.primitives.Aead;
import software.amazon.encryption.keyset.registry.PrivateKeyManager;
import software.amazon.encryption.keyset.registry.Registry;

/**
 * Caller-facing owner of a validated keyset. A handle never exposes key material: primitives are
 * obtained with {@link #getPrimitive(Class)}, and the keyset is persisted either encrypted under a
 * master key or, for keysets without secrets, in cleartext.
 * Raw access to the keyset goes through {@link CleartextKeysetHandle}.
 */
public final class KeysetHandle {

    private static final Log LOG = LogFactory.getLog(KeysetHandle.class);
    private static final byte[] EMPTY_ASSOCIATED_DATA = new byte[0];

    private final Keyset _keyset;

    KeysetHandle(Keyset keyset) {
        if (keyset == null) {
            throw new KeysetException("Keyset cannot be null!");
        }
        _keyset = keyset;
    }

    /**
     * @return a handle of a new keyset holding one key generated from the template, as primary
     */
    public static KeysetHandle generateNew(KeyTemplate template) {
        KeysetManager manager = KeysetManager.withEmptyKeyset();
        manager.rotate(template);
        return manager.keysetHandle();
    }

    Keyset keyset() {
        return _keyset;
    }

    public KeysetInfo keysetInfo() {
        return KeysetInfo.of(_keyset);
    }

    /**
     * Builds the primitive set of the enabled keys and wraps it with the wrapper registered for
     * {@code primitiveClass}.
     *
     * @throws KeyNotFoundException if a key type or the wrapper is not registered
     * @throws PrimitiveInstantiationException if any enabled key cannot be instantiated
     */
    public <P> P getPrimitive(Class<P> primitiveClass) {
        return Registry.wrap(PrimitiveSet.fromKeyset(_keyset, primitiveClass));
    }

    /**
     * Derives the public keyset: every key is replaced by its public key, keeping its id, status
     * and output prefix kind.
     *
     * @throws InvalidKeyMaterialException if the keyset holds anything other than private keys
     */
    public KeysetHandle getPublicKeysetHandle() {
        List<KeyEntry> publicKeys = new ArrayList<>(_keyset.size());
        for (KeyEntry key : _keyset.keys()) {
            if (key.materialClass() != KeyMaterialClass.ASYMMETRIC_PRIVATE) {
                throw new InvalidKeyMaterialException("Key " + Integer.toUnsignedString(key.keyId())
                        + " is not an asymmetric private key");
            }
            PrivateKeyManager<?> keyManager = Registry.privateKeyManager(key.typeId());
            KeyEntry.Builder publicKey = key.toBuilder()
                    .typeId(keyManager.publicKeyTypeId())
                    .materialClass(KeyMaterialClass.ASYMMETRIC_PUBLIC);
            if (key.status() == KeyStatus.DESTROYED) {
                publicKey.serializedKey(null);
            } else {
                byte[] privateKey = key.serializedKey();
                try {
                    publicKey.serializedKey(Registry.publicKey(key.typeId(), privateKey));
                } finally {
                    Arrays.fill(privateKey, (byte) 0);
                }
            }
            publicKeys.add(publicKey.build());
        }
        return new KeysetHandle(Keyset.builder()
                .primaryKeyId(_keyset.primaryKeyId())
                .keys(publicKeys)
                .build());
    }

    /**
     * Encrypts the keyset with {@code masterAead} and writes it, with its {@link KeysetInfo} beside it.
     */
    public void write(KeysetWriter writer, Aead masterAead) throws IOException {
        if (writer == null || masterAead == null) {
            throw new KeysetException("Keyset writer and master key cannot be null!");
        }
        byte[] serialized = serialize(_keyset);
        try {
            byte[] ciphertext = masterAead.encrypt(serialized, EMPTY_ASSOCIATED_DATA);
            writer.write(new EncryptedKeyset(ciphertext, keysetInfo()));
        } catch (GeneralSecurityException e) {
            throw new KeysetException("Cannot encrypt keyset", e);
        } finally {
            Arrays.fill(serialized, (byte) 0);
        }
    }

    /**
     * Reads and decrypts a keyset written by {@link #write(KeysetWriter, Aead)}.
     *
     * @throws InvalidKeyMaterialException if {@code masterAead} cannot decrypt the keyset
     */
    public static KeysetHandle read(KeysetReader reader, Aead masterAead) throws IOException {
        if (reader == null || masterAead == null) {
            throw new KeysetException("Keyset reader and master key cannot be null!");
        }
        EncryptedKeyset encryptedKeyset = reader.readEncrypted();
        byte[] serialized;
        try {
            serialized = masterAead.decrypt(encryptedKeyset.encryptedKeyset(), EMPTY_ASSOCIATED_DATA);
        } catch (GeneralSecurityException | AuthenticationFailureException e) {
            throw new InvalidKeyMaterialException("Cannot decrypt keyset with the given master key", e);
        }
        try {
            Keyset keyset = JsonKeysetReader.withBytes(serialized).read();
            if (encryptedKeyset.keysetInfo() != null && !encryptedKeyset.keysetInfo().equals(KeysetInfo.of(keyset))) {
                LOG.warn("Keyset info stored beside the encrypted keyset does not match the decrypted keyset");
            }
            return new KeysetHandle(keyset);
        } finally {
            Arrays.fill(serialized, (byte) 0);
        }
    }

    /**
     * Writes a keyset without secret key material in cleartext.
     *
     * @throws InvalidKeyMaterialException if the keyset contains secret key material
     */
    public void writeNoSecret(KeysetWriter writer) throws IOException {
        assertNoSecretKeyMaterial(_keyset);
        writer.write(_keyset);
    }

    /**
     * @throws InvalidKeyMaterialException if the keyset read contains secret key material
     */
    public static KeysetHandle readNoSecret(KeysetReader reader) throws IOException {
        Keyset keyset = reader.read();
        assertNoSecretKeyMaterial(keyset);
        return new KeysetHandle(keyset);
    }

    static byte[] serialize(Keyset keyset) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        JsonKeysetWriter.withOutputStream(out).write(keyset);
        return out.toByteArray();
    }

    private static void assertNoSecretKeyMaterial(Keyset keyset) {
        for (KeyEntry key : keyset.keys()) {
            if (key.materialClass().isSecret()) {
                throw new InvalidKeyMaterialException("Keyset contains secret key material, key "
                        + Integer.toUnsignedString(key.keyId()) + " is " + key.materialClass());
            }
        }
    }

    /**
     * Prints the keyset info only, never key material.
     */
    @Override
    public String toString() {
        return keysetInfo().toString();
    }
}
