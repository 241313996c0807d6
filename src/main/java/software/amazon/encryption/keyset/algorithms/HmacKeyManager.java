// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.keyset.algorithms;

import java.security.GeneralSecurityException;
import java.security.InvalidAlgorithmParameterException;
import java.security.InvalidKeyException;
import java.security.Provider;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Map;

import javax.crypto.spec.SecretKeySpec;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import software.amazon.awssdk.protocols.jsoncore.JsonNode;
import software.amazon.encryption.keyset.internal.SerializedKeys;
import software.amazon.encryption.keyset.model.KeyMaterialClass;
import software.amazon.encryption.keyset.primitives.AuthenticationCode;
import software.amazon.encryption.keyset.registry.KeyManager;

/**
 * Key manager for HMAC keys.
 * <p>
 * Key format: {@code {"keySize": n, "hash": "SHA256", "tagSize": t}}.
 * Key: {@code {"version": 0, "hash": "SHA256", "tagSize": t, "keyValue": base64}}.
 * Keys are 16 to 64 bytes; tags are at least 10 bytes and at most the digest length.
 */
public class HmacKeyManager implements KeyManager<AuthenticationCode> {

    public static final String TYPE_ID = "aws.keyset.HmacKey";
    static final int MIN_KEY_SIZE_BYTES = 16;
    static final int MAX_KEY_SIZE_BYTES = 64;
    static final int MIN_TAG_SIZE_BYTES = 10;
    private static final int VERSION = 0;

    private final Provider _cryptoProvider;
    private final SecureRandom _secureRandom;

    public HmacKeyManager() {
        this(null);
    }

    public HmacKeyManager(Provider cryptoProvider) {
        this(cryptoProvider, new SecureRandom());
    }

    @SuppressFBWarnings(value = "EI_EXPOSE_REP2", justification = "Pass mutability into key generation")
    public HmacKeyManager(Provider cryptoProvider, SecureRandom secureRandom) {
        _cryptoProvider = cryptoProvider;
        _secureRandom = secureRandom;
    }

    public static byte[] keyFormat(int keySizeBytes, HashType hashType, int tagSizeBytes) {
        return SerializedKeys.write(writer -> {
            writer.writeFieldName("keySize").writeValue(keySizeBytes);
            writer.writeFieldName("hash").writeValue(hashType.name());
            writer.writeFieldName("tagSize").writeValue(tagSizeBytes);
        });
    }

    @Override
    public String typeId() {
        return TYPE_ID;
    }

    @Override
    public Class<AuthenticationCode> primitiveClass() {
        return AuthenticationCode.class;
    }

    @Override
    public KeyMaterialClass materialClass() {
        return KeyMaterialClass.SYMMETRIC;
    }

    @Override
    public AuthenticationCode primitive(byte[] serializedKey) throws GeneralSecurityException {
        Map<String, JsonNode> fields = SerializedKeys.read(serializedKey, "HMAC key");
        SerializedKeys.validateVersion(fields, VERSION);
        HashType hashType = HashType.fromName(SerializedKeys.string(fields, "hash"));
        int tagSize = SerializedKeys.integer(fields, "tagSize");
        byte[] keyValue = SerializedKeys.bytes(fields, "keyValue");
        try {
            validateParameters(keyValue.length, hashType, tagSize);
            return new HmacAuthenticationCode(new SecretKeySpec(keyValue, hashType.macAlgorithm()),
                    hashType, tagSize, _cryptoProvider);
        } finally {
            Arrays.fill(keyValue, (byte) 0);
        }
    }

    @Override
    public byte[] newKey(byte[] serializedKeyFormat) throws GeneralSecurityException {
        Map<String, JsonNode> fields = SerializedKeys.read(serializedKeyFormat, "HMAC key format");
        int keySize = SerializedKeys.integer(fields, "keySize");
        HashType hashType = HashType.fromName(SerializedKeys.string(fields, "hash"));
        int tagSize = SerializedKeys.integer(fields, "tagSize");
        validateParameters(keySize, hashType, tagSize);

        byte[] keyValue = new byte[keySize];
        _secureRandom.nextBytes(keyValue);
        try {
            return SerializedKeys.write(writer -> {
                writer.writeFieldName("version").writeValue(VERSION);
                writer.writeFieldName("hash").writeValue(hashType.name());
                writer.writeFieldName("tagSize").writeValue(tagSize);
                writer.writeFieldName("keyValue").writeValue(SerializedKeys.encodeBytes(keyValue));
            });
        } finally {
            Arrays.fill(keyValue, (byte) 0);
        }
    }

    private static void validateParameters(int keySizeBytes, HashType hashType, int tagSizeBytes)
            throws GeneralSecurityException {
        if (keySizeBytes < MIN_KEY_SIZE_BYTES) {
            throw new InvalidKeyException("HMAC key must be at least " + MIN_KEY_SIZE_BYTES + " bytes");
        }
        if (keySizeBytes > MAX_KEY_SIZE_BYTES) {
            throw new InvalidKeyException("HMAC key must be at most " + MAX_KEY_SIZE_BYTES + " bytes");
        }
        if (tagSizeBytes < MIN_TAG_SIZE_BYTES || tagSizeBytes > hashType.digestLengthBytes()) {
            throw new InvalidAlgorithmParameterException("Invalid tag size " + tagSizeBytes + " for " + hashType
                    + ", expecting between " + MIN_TAG_SIZE_BYTES + " and " + hashType.digestLengthBytes());
        }
    }
}
