// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.keyset.io;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import software.amazon.encryption.keyset.InvalidKeyMaterialException;
import software.amazon.encryption.keyset.InvalidKeysetStateException;
import software.amazon.encryption.keyset.algorithms.KeyTemplates;
import software.amazon.encryption.keyset.model.EncryptedKeyset;
import software.amazon.encryption.keyset.model.KeyEntry;
import software.amazon.encryption.keyset.model.KeyStatus;
import software.amazon.encryption.keyset.model.Keyset;
import software.amazon.encryption.keyset.model.KeysetInfo;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static software.amazon.encryption.keyset.KeysetTestResources.generateKey;
import static software.amazon.encryption.keyset.KeysetTestResources.keyset;
import static software.amazon.encryption.keyset.KeysetTestResources.resetRegistry;

public class JsonKeysetReaderWriterTest {

    private static final int LARGE_KEY_ID = 0xFFFFFFF0;

    @BeforeEach
    public void setUp() {
        resetRegistry();
    }

    private static byte[] write(Keyset keyset) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        JsonKeysetWriter.withOutputStream(out).write(keyset);
        return out.toByteArray();
    }

    private static String keysetJson(String keyFields) {
        return "{\"primaryKeyId\":7,\"key\":[{" + keyFields + "}]}";
    }

    private static String validKeyFields() {
        return "\"keyData\":{\"typeUrl\":\"aws.keyset.AesGcmKey\",\"value\":\"AAEC\",\"keyMaterialType\":\"SYMMETRIC\"},"
                + "\"status\":\"ENABLED\",\"keyId\":7,\"outputPrefixType\":\"TINK\"";
    }

    @Test
    public void keysetSurvivesWriteAndRead() throws IOException {
        Keyset keyset = keyset(LARGE_KEY_ID,
                generateKey(KeyTemplates.AES128_GCM, LARGE_KEY_ID),
                generateKey(KeyTemplates.HMAC_SHA256_128BITTAG, 5, KeyStatus.DISABLED),
                generateKey(KeyTemplates.ECDSA_P256_RAW, 6));

        Keyset read = JsonKeysetReader.withBytes(write(keyset)).read();

        assertEquals(keyset.primaryKeyId(), read.primaryKeyId());
        assertEquals(keyset.size(), read.size());
        for (KeyEntry expected : keyset.keys()) {
            KeyEntry actual = read.key(expected.keyId());
            assertEquals(expected.typeId(), actual.typeId());
            assertArrayEquals(expected.serializedKey(), actual.serializedKey());
            assertEquals(expected.materialClass(), actual.materialClass());
            assertEquals(expected.status(), actual.status());
            assertEquals(expected.outputPrefixKind(), actual.outputPrefixKind());
        }
        assertEquals(KeysetInfo.of(keyset), KeysetInfo.of(read));
    }

    @Test
    public void keyIdsAreWrittenUnsigned() throws IOException {
        Keyset keyset = keyset(LARGE_KEY_ID, generateKey(KeyTemplates.AES128_GCM, LARGE_KEY_ID));

        String json = new String(write(keyset), StandardCharsets.UTF_8);

        assertTrue(json.contains("4294967280"));
        assertFalse(json.contains("-16"));
    }

    @Test
    public void destroyedKeysHaveEmptyValues() throws IOException {
        KeyEntry destroyed = generateKey(KeyTemplates.AES128_GCM, 2).toBuilder()
                .status(KeyStatus.DESTROYED)
                .serializedKey(null)
                .build();
        Keyset keyset = keyset(1, generateKey(KeyTemplates.AES128_GCM, 1), destroyed);

        Keyset read = JsonKeysetReader.withInputStream(new ByteArrayInputStream(write(keyset))).read();

        assertEquals(KeyStatus.DESTROYED, read.key(2).status());
        assertFalse(read.key(2).hasKeyMaterial());
    }

    @Test
    public void readsHandWrittenJson() throws IOException {
        Keyset keyset = JsonKeysetReader.withString(keysetJson(validKeyFields())).read();

        assertEquals(7, keyset.primaryKeyId());
        assertArrayEquals(new byte[]{0, 1, 2}, keyset.primaryKey().serializedKey());
    }

    @Test
    public void rejectsInvalidJson() {
        InvalidKeyMaterialException e = assertThrows(InvalidKeyMaterialException.class,
                () -> JsonKeysetReader.withString("{\"primaryKeyId\": 7, \"key\": [").read());
        assertFalse(e.getMessage().contains("primaryKeyId"));
        assertThrows(InvalidKeyMaterialException.class, () -> JsonKeysetReader.withString("[]").read());
    }

    @Test
    public void rejectsMissingAndMistypedFields() {
        assertThrows(InvalidKeyMaterialException.class,
                () -> JsonKeysetReader.withString("{\"key\":[]}").read());
        assertThrows(InvalidKeyMaterialException.class,
                () -> JsonKeysetReader.withString(keysetJson(validKeyFields().replace("\"status\":\"ENABLED\",", ""))).read());
        assertThrows(InvalidKeyMaterialException.class,
                () -> JsonKeysetReader.withString(keysetJson(validKeyFields().replace("\"keyId\":7", "\"keyId\":\"7\""))).read());
        assertThrows(InvalidKeyMaterialException.class,
                () -> JsonKeysetReader.withString(keysetJson(validKeyFields().replace("AAEC", "not base64!"))).read());
    }

    @Test
    public void rejectsUnknownEnumNames() {
        assertThrows(InvalidKeyMaterialException.class,
                () -> JsonKeysetReader.withString(keysetJson(validKeyFields().replace("TINK", "SHORT"))).read());
        assertThrows(InvalidKeyMaterialException.class,
                () -> JsonKeysetReader.withString(keysetJson(validKeyFields().replace("ENABLED", "UNKNOWN_STATUS"))).read());
    }

    @Test
    public void rejectsKeyIdsOutsideUnsigned32BitRange() {
        assertThrows(InvalidKeyMaterialException.class,
                () -> JsonKeysetReader.withString(keysetJson(validKeyFields().replace("\"keyId\":7", "\"keyId\":4294967296"))).read());
        assertThrows(InvalidKeyMaterialException.class,
                () -> JsonKeysetReader.withString(keysetJson(validKeyFields().replace("\"keyId\":7", "\"keyId\":-1"))).read());
    }

    @Test
    public void wellFormedButInvalidKeysetFailsValidation() {
        String json = "{\"primaryKeyId\":8,\"key\":[{" + validKeyFields() + "}]}";
        assertThrows(InvalidKeysetStateException.class, () -> JsonKeysetReader.withString(json).read());
    }

    @Test
    public void encryptedKeysetWithInfo() throws IOException {
        Keyset keyset = keyset(LARGE_KEY_ID, generateKey(KeyTemplates.AES128_GCM, LARGE_KEY_ID));
        EncryptedKeyset encrypted = new EncryptedKeyset(new byte[]{9, 8, 7}, KeysetInfo.of(keyset));
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        JsonKeysetWriter.withOutputStream(out).write(encrypted);

        EncryptedKeyset read = JsonKeysetReader.withBytes(out.toByteArray()).readEncrypted();

        assertArrayEquals(new byte[]{9, 8, 7}, read.encryptedKeyset());
        assertEquals(KeysetInfo.of(keyset), read.keysetInfo());
    }

    @Test
    public void encryptedKeysetWithoutInfo() throws IOException {
        String json = "{\"encryptedKeyset\":\"" + Base64.getEncoder().encodeToString(new byte[]{1, 2}) + "\"}";

        EncryptedKeyset read = JsonKeysetReader.withString(json).readEncrypted();

        assertArrayEquals(new byte[]{1, 2}, read.encryptedKeyset());
        assertNull(read.keysetInfo());
        assertThrows(InvalidKeyMaterialException.class, () -> JsonKeysetReader.withString("{}").readEncrypted());
    }
}
