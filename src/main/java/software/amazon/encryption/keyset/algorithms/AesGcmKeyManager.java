// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.keyset.algorithms;

import java.security.GeneralSecurityException;
import java.security.InvalidKeyException;
import java.security.Provider;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Map;

import javax.crypto.KeyGenerator;
import javax.crypto.spec.SecretKeySpec;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import software.amazon.awssdk.protocols.jsoncore.JsonNode;
import software.amazon.encryption.keyset.internal.CryptoFactory;
import software.amazon.encryption.keyset.internal.SerializedKeys;
import software.amazon.encryption.keyset.model.KeyMaterialClass;
import software.amazon.encryption.keyset.primitives.Aead;
import software.amazon.encryption.keyset.registry.KeyManager;

/**
 * Key manager for AES-GCM keys of 128 or 256 bits.
 * <p>
 * Key format: {@code {"keySize": 16|32}}. Key: {@code {"version": 0, "keyValue": base64}}.
 */
public class AesGcmKeyManager implements KeyManager<Aead> {

    public static final String TYPE_ID = "aws.keyset.AesGcmKey";
    private static final String KEY_ALGORITHM = "AES";
    private static final int VERSION = 0;

    private final Provider _cryptoProvider;
    private final SecureRandom _secureRandom;

    public AesGcmKeyManager() {
        this(null);
    }

    /**
     * @param cryptoProvider the JCE provider for AES-GCM, or null for the default provider chain
     */
    public AesGcmKeyManager(Provider cryptoProvider) {
        this(cryptoProvider, new SecureRandom());
    }

    /**
     * Note that this does NOT create a defensive copy of the SecureRandom object.
     */
    @SuppressFBWarnings(value = "EI_EXPOSE_REP2", justification = "Pass mutability into key generation")
    public AesGcmKeyManager(Provider cryptoProvider, SecureRandom secureRandom) {
        _cryptoProvider = cryptoProvider;
        _secureRandom = secureRandom;
    }

    public static byte[] keyFormat(int keySizeBytes) {
        return SerializedKeys.write(writer -> writer.writeFieldName("keySize").writeValue(keySizeBytes));
    }

    @Override
    public String typeId() {
        return TYPE_ID;
    }

    @Override
    public Class<Aead> primitiveClass() {
        return Aead.class;
    }

    @Override
    public KeyMaterialClass materialClass() {
        return KeyMaterialClass.SYMMETRIC;
    }

    @Override
    public Aead primitive(byte[] serializedKey) throws GeneralSecurityException {
        Map<String, JsonNode> fields = SerializedKeys.read(serializedKey, "AES-GCM key");
        SerializedKeys.validateVersion(fields, VERSION);
        byte[] keyValue = SerializedKeys.bytes(fields, "keyValue");
        try {
            validateKeySize(keyValue.length);
            return new AesGcmAead(new SecretKeySpec(keyValue, KEY_ALGORITHM), _cryptoProvider, _secureRandom);
        } finally {
            Arrays.fill(keyValue, (byte) 0);
        }
    }

    @Override
    public byte[] newKey(byte[] serializedKeyFormat) throws GeneralSecurityException {
        Map<String, JsonNode> fields = SerializedKeys.read(serializedKeyFormat, "AES-GCM key format");
        int keySize = SerializedKeys.integer(fields, "keySize");
        validateKeySize(keySize);

        KeyGenerator generator = CryptoFactory.createKeyGenerator(KEY_ALGORITHM, _cryptoProvider);
        generator.init(keySize * 8, _secureRandom);
        byte[] keyValue = generator.generateKey().getEncoded();
        try {
            return SerializedKeys.write(writer -> {
                writer.writeFieldName("version").writeValue(VERSION);
                writer.writeFieldName("keyValue").writeValue(SerializedKeys.encodeBytes(keyValue));
            });
        } finally {
            Arrays.fill(keyValue, (byte) 0);
        }
    }

    private static void validateKeySize(int keySizeBytes) throws InvalidKeyException {
        if (keySizeBytes != 16 && keySizeBytes != 32) {
            throw new InvalidKeyException("Invalid AES key size: " + keySizeBytes + " bytes, expecting 16 or 32");
        }
    }
}
