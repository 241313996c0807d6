// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.keyset.internal;

import java.io.ByteArrayInputStream;
import java.security.GeneralSecurityException;
import java.security.spec.InvalidKeySpecException;
import java.util.Base64;
import java.util.Map;
import java.util.function.Consumer;

import software.amazon.awssdk.protocols.jsoncore.JsonNode;
import software.amazon.awssdk.protocols.jsoncore.JsonNodeParser;
import software.amazon.awssdk.protocols.jsoncore.JsonWriter;
import software.amazon.awssdk.protocols.jsoncore.JsonWriter.JsonGenerationException;
import software.amazon.encryption.keyset.KeysetException;

/**
 * JSON encoding shared by the built-in key managers for their serialized keys and key formats.
 * Parse errors are reported without the parser's message, since that message may quote key bytes.
 */
public final class SerializedKeys {

    private static final Base64.Encoder ENCODER = Base64.getEncoder();
    private static final Base64.Decoder DECODER = Base64.getDecoder();

    private SerializedKeys() {
    }

    public static byte[] write(Consumer<JsonWriter> fields) {
        try (JsonWriter jsonWriter = JsonWriter.create()) {
            jsonWriter.writeStartObject();
            fields.accept(jsonWriter);
            jsonWriter.writeEndObject();
            return jsonWriter.getBytes();
        } catch (JsonGenerationException e) {
            throw new KeysetException("Cannot serialize key to JSON.", e);
        }
    }

    public static String encodeBytes(byte[] bytes) {
        return ENCODER.encodeToString(bytes);
    }

    public static Map<String, JsonNode> read(byte[] serialized, String description) throws GeneralSecurityException {
        if (serialized == null || serialized.length == 0) {
            throw new InvalidKeySpecException(description + " is empty");
        }
        JsonNode node;
        try {
            node = JsonNodeParser.create().parse(new ByteArrayInputStream(serialized));
        } catch (RuntimeException e) {
            throw new InvalidKeySpecException(description + " is not valid JSON");
        }
        if (node == null || !node.isObject()) {
            throw new InvalidKeySpecException(description + " is not a JSON object");
        }
        return node.asObject();
    }

    public static String string(Map<String, JsonNode> fields, String name) throws GeneralSecurityException {
        JsonNode node = fields.get(name);
        if (node == null || !node.isString()) {
            throw new InvalidKeySpecException("Missing or invalid field " + name);
        }
        return node.asString();
    }

    public static int integer(Map<String, JsonNode> fields, String name) throws GeneralSecurityException {
        JsonNode node = fields.get(name);
        if (node == null || !node.isNumber()) {
            throw new InvalidKeySpecException("Missing or invalid field " + name);
        }
        try {
            return Integer.parseInt(node.asNumber());
        } catch (NumberFormatException e) {
            throw new InvalidKeySpecException("Field " + name + " is not an integer");
        }
    }

    public static byte[] bytes(Map<String, JsonNode> fields, String name) throws GeneralSecurityException {
        String encoded = string(fields, name);
        try {
            return DECODER.decode(encoded);
        } catch (IllegalArgumentException e) {
            throw new InvalidKeySpecException("Field " + name + " is not valid base64");
        }
    }

    /**
     * Checks the {@code version} field of a serialized key.
     */
    public static void validateVersion(Map<String, JsonNode> fields, int maxVersion) throws GeneralSecurityException {
        int version = integer(fields, "version");
        if (version < 0 || version > maxVersion) {
            throw new InvalidKeySpecException("Key version " + version + " is not supported, expecting at most " + maxVersion);
        }
    }
}
