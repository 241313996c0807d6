// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.keyset.io;

import java.io.IOException;
import java.io.OutputStream;
import java.util.Base64;

import software.amazon.awssdk.protocols.jsoncore.JsonWriter;
import software.amazon.awssdk.protocols.jsoncore.JsonWriter.JsonGenerationException;
import software.amazon.encryption.keyset.KeysetException;
import software.amazon.encryption.keyset.model.EncryptedKeyset;
import software.amazon.encryption.keyset.model.KeyEntry;
import software.amazon.encryption.keyset.model.Keyset;
import software.amazon.encryption.keyset.model.KeysetInfo;

/**
 * Writes keysets as JSON. Key ids are written as unsigned numbers and key material as base64.
 * The stream is flushed but not closed.
 */
public final class JsonKeysetWriter implements KeysetWriter {

    private static final Base64.Encoder ENCODER = Base64.getEncoder();

    private final OutputStream _outputStream;

    private JsonKeysetWriter(OutputStream outputStream) {
        _outputStream = outputStream;
    }

    public static KeysetWriter withOutputStream(OutputStream outputStream) {
        if (outputStream == null) {
            throw new KeysetException("Output stream cannot be null!");
        }
        return new JsonKeysetWriter(outputStream);
    }

    @Override
    public void write(Keyset keyset) throws IOException {
        _outputStream.write(toJson(keyset));
        _outputStream.flush();
    }

    @Override
    public void write(EncryptedKeyset encryptedKeyset) throws IOException {
        _outputStream.write(toJson(encryptedKeyset));
        _outputStream.flush();
    }

    static byte[] toJson(Keyset keyset) {
        try (JsonWriter jsonWriter = JsonWriter.create()) {
            jsonWriter.writeStartObject();
            jsonWriter.writeFieldName(JsonKeysetFields.PRIMARY_KEY_ID).writeValue(Integer.toUnsignedLong(keyset.primaryKeyId()));
            jsonWriter.writeFieldName(JsonKeysetFields.KEY).writeStartArray();
            for (KeyEntry key : keyset.keys()) {
                jsonWriter.writeStartObject();
                jsonWriter.writeFieldName(JsonKeysetFields.KEY_DATA).writeStartObject();
                jsonWriter.writeFieldName(JsonKeysetFields.TYPE_URL).writeValue(key.typeId());
                jsonWriter.writeFieldName(JsonKeysetFields.VALUE).writeValue(ENCODER.encodeToString(key.serializedKey()));
                jsonWriter.writeFieldName(JsonKeysetFields.KEY_MATERIAL_TYPE).writeValue(key.materialClass().name());
                jsonWriter.writeEndObject();
                jsonWriter.writeFieldName(JsonKeysetFields.STATUS).writeValue(key.status().name());
                jsonWriter.writeFieldName(JsonKeysetFields.KEY_ID).writeValue(Integer.toUnsignedLong(key.keyId()));
                jsonWriter.writeFieldName(JsonKeysetFields.OUTPUT_PREFIX_TYPE).writeValue(key.outputPrefixKind().name());
                jsonWriter.writeEndObject();
            }
            jsonWriter.writeEndArray();
            jsonWriter.writeEndObject();
            return jsonWriter.getBytes();
        } catch (JsonGenerationException e) {
            throw new KeysetException("Cannot serialize keyset to JSON.", e);
        }
    }

    static byte[] toJson(EncryptedKeyset encryptedKeyset) {
        try (JsonWriter jsonWriter = JsonWriter.create()) {
            jsonWriter.writeStartObject();
            jsonWriter.writeFieldName(JsonKeysetFields.ENCRYPTED_KEYSET)
                    .writeValue(ENCODER.encodeToString(encryptedKeyset.encryptedKeyset()));
            KeysetInfo info = encryptedKeyset.keysetInfo();
            if (info != null) {
                jsonWriter.writeFieldName(JsonKeysetFields.KEYSET_INFO).writeStartObject();
                jsonWriter.writeFieldName(JsonKeysetFields.PRIMARY_KEY_ID).writeValue(Integer.toUnsignedLong(info.primaryKeyId()));
                jsonWriter.writeFieldName(JsonKeysetFields.KEY_INFO).writeStartArray();
                for (KeysetInfo.KeyInfo keyInfo : info.keyInfos()) {
                    jsonWriter.writeStartObject();
                    jsonWriter.writeFieldName(JsonKeysetFields.TYPE_URL).writeValue(keyInfo.typeId());
                    jsonWriter.writeFieldName(JsonKeysetFields.STATUS).writeValue(keyInfo.status().name());
                    jsonWriter.writeFieldName(JsonKeysetFields.KEY_ID).writeValue(Integer.toUnsignedLong(keyInfo.keyId()));
                    jsonWriter.writeFieldName(JsonKeysetFields.OUTPUT_PREFIX_TYPE).writeValue(keyInfo.outputPrefixKind().name());
                    jsonWriter.writeEndObject();
                }
                jsonWriter.writeEndArray();
                jsonWriter.writeEndObject();
            }
            jsonWriter.writeEndObject();
            return jsonWriter.getBytes();
        } catch (JsonGenerationException e) {
            throw new KeysetException("Cannot serialize encrypted keyset to JSON.", e);
        }
    }
}
