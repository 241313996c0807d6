// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.keyset.io;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Map;

import software.amazon.awssdk.protocols.jsoncore.JsonNode;
import software.amazon.awssdk.protocols.jsoncore.JsonNodeParser;
import software.amazon.awssdk.utils.IoUtils;
import software.amazon.encryption.keyset.InvalidKeyMaterialException;
import software.amazon.encryption.keyset.KeysetException;
import software.amazon.encryption.keyset.model.EncryptedKeyset;
import software.amazon.encryption.keyset.model.KeyEntry;
import software.amazon.encryption.keyset.model.KeyMaterialClass;
import software.amazon.encryption.keyset.model.KeyStatus;
import software.amazon.encryption.keyset.model.Keyset;
import software.amazon.encryption.keyset.model.KeysetInfo;
import software.amazon.encryption.keyset.model.OutputPrefixKind;

/**
 * Reads keysets written by {@link JsonKeysetWriter}. Malformed documents fail with
 * {@link InvalidKeyMaterialException}; a well-formed document describing an invalid keyset fails
 * the usual keyset validation.
 */
public final class JsonKeysetReader implements KeysetReader {

    private static final long MAX_KEY_ID = 0xFFFFFFFFL;

    private final InputStream _inputStream;
    private final byte[] _bytes;

    private JsonKeysetReader(InputStream inputStream, byte[] bytes) {
        _inputStream = inputStream;
        _bytes = bytes;
    }

    /**
     * The stream is read to its end but not closed.
     */
    public static KeysetReader withInputStream(InputStream inputStream) {
        if (inputStream == null) {
            throw new KeysetException("Input stream cannot be null!");
        }
        return new JsonKeysetReader(inputStream, null);
    }

    public static KeysetReader withBytes(byte[] bytes) {
        if (bytes == null) {
            throw new KeysetException("Keyset bytes cannot be null!");
        }
        return new JsonKeysetReader(null, bytes.clone());
    }

    public static KeysetReader withString(String json) {
        if (json == null) {
            throw new KeysetException("Keyset JSON cannot be null!");
        }
        return new JsonKeysetReader(null, json.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public Keyset read() throws IOException {
        Map<String, JsonNode> fields = parse();
        Keyset.Builder builder = Keyset.builder()
                .primaryKeyId(keyId(fields, JsonKeysetFields.PRIMARY_KEY_ID));
        for (JsonNode keyNode : array(fields, JsonKeysetFields.KEY)) {
            builder.addKey(keyEntry(object(keyNode, JsonKeysetFields.KEY)));
        }
        return builder.build();
    }

    @Override
    public EncryptedKeyset readEncrypted() throws IOException {
        Map<String, JsonNode> fields = parse();
        byte[] encryptedKeyset = base64(fields, JsonKeysetFields.ENCRYPTED_KEYSET);
        KeysetInfo keysetInfo = null;
        JsonNode infoNode = fields.get(JsonKeysetFields.KEYSET_INFO);
        if (infoNode != null && !infoNode.isNull()) {
            keysetInfo = keysetInfo(object(infoNode, JsonKeysetFields.KEYSET_INFO));
        }
        return new EncryptedKeyset(encryptedKeyset, keysetInfo);
    }

    private Map<String, JsonNode> parse() throws IOException {
        byte[] bytes = _bytes != null ? _bytes : IoUtils.toByteArray(_inputStream);
        JsonNode root;
        try {
            root = JsonNodeParser.create().parse(bytes);
        } catch (RuntimeException e) {
            // the parser message may quote key material
            throw new InvalidKeyMaterialException("Keyset is not valid JSON");
        }
        return object(root, "keyset");
    }

    private static KeyEntry keyEntry(Map<String, JsonNode> fields) {
        Map<String, JsonNode> keyData = object(fields.get(JsonKeysetFields.KEY_DATA), JsonKeysetFields.KEY_DATA);
        return KeyEntry.builder()
                .keyId(keyId(fields, JsonKeysetFields.KEY_ID))
                .typeId(string(keyData, JsonKeysetFields.TYPE_URL))
                .serializedKey(base64(keyData, JsonKeysetFields.VALUE))
                .materialClass(enumValue(KeyMaterialClass.class, keyData, JsonKeysetFields.KEY_MATERIAL_TYPE))
                .status(enumValue(KeyStatus.class, fields, JsonKeysetFields.STATUS))
                .outputPrefixKind(enumValue(OutputPrefixKind.class, fields, JsonKeysetFields.OUTPUT_PREFIX_TYPE))
                .build();
    }

    private static KeysetInfo keysetInfo(Map<String, JsonNode> fields) {
        List<KeysetInfo.KeyInfo> keyInfos = new ArrayList<>();
        for (JsonNode node : array(fields, JsonKeysetFields.KEY_INFO)) {
            Map<String, JsonNode> keyFields = object(node, JsonKeysetFields.KEY_INFO);
            keyInfos.add(new KeysetInfo.KeyInfo(
                    string(keyFields, JsonKeysetFields.TYPE_URL),
                    enumValue(KeyStatus.class, keyFields, JsonKeysetFields.STATUS),
                    keyId(keyFields, JsonKeysetFields.KEY_ID),
                    enumValue(OutputPrefixKind.class, keyFields, JsonKeysetFields.OUTPUT_PREFIX_TYPE)));
        }
        return new KeysetInfo(keyId(fields, JsonKeysetFields.PRIMARY_KEY_ID), keyInfos);
    }

    private static Map<String, JsonNode> object(JsonNode node, String name) {
        if (node == null || !node.isObject()) {
            throw new InvalidKeyMaterialException("Expected " + name + " to be a JSON object");
        }
        return node.asObject();
    }

    private static List<JsonNode> array(Map<String, JsonNode> fields, String name) {
        JsonNode node = fields.get(name);
        if (node == null || !node.isArray()) {
            throw new InvalidKeyMaterialException("Missing or invalid field " + name);
        }
        return node.asArray();
    }

    private static String string(Map<String, JsonNode> fields, String name) {
        JsonNode node = fields.get(name);
        if (node == null || !node.isString()) {
            throw new InvalidKeyMaterialException("Missing or invalid field " + name);
        }
        return node.asString();
    }

    private static byte[] base64(Map<String, JsonNode> fields, String name) {
        try {
            return Base64.getDecoder().decode(string(fields, name));
        } catch (IllegalArgumentException e) {
            throw new InvalidKeyMaterialException("Field " + name + " is not valid base64");
        }
    }

    private static int keyId(Map<String, JsonNode> fields, String name) {
        JsonNode node = fields.get(name);
        if (node == null || !node.isNumber()) {
            throw new InvalidKeyMaterialException("Missing or invalid field " + name);
        }
        long value;
        try {
            value = Long.parseLong(node.asNumber());
        } catch (NumberFormatException e) {
            throw new InvalidKeyMaterialException("Field " + name + " is not an integer", e);
        }
        if (value < 0 || value > MAX_KEY_ID) {
            throw new InvalidKeyMaterialException("Field " + name + " is not an unsigned 32-bit key id");
        }
        return (int) value;
    }

    private static <E extends Enum<E>> E enumValue(Class<E> enumClass, Map<String, JsonNode> fields, String name) {
        String value = string(fields, name);
        try {
            return Enum.valueOf(enumClass, value);
        } catch (IllegalArgumentException e) {
            throw new InvalidKeyMaterialException("Unknown " + enumClass.getSimpleName() + " " + value + " in field " + name);
        }
    }
}
