// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.keyset.kms;

import java.security.GeneralSecurityException;
import java.security.InvalidAlgorithmParameterException;
import java.util.Map;

import software.amazon.awssdk.protocols.jsoncore.JsonNode;
import software.amazon.encryption.keyset.KeysetException;
import software.amazon.encryption.keyset.internal.SerializedKeys;
import software.amazon.encryption.keyset.model.KeyMaterialClass;
import software.amazon.encryption.keyset.model.KeyTemplate;
import software.amazon.encryption.keyset.model.OutputPrefixKind;
import software.amazon.encryption.keyset.primitives.Aead;
import software.amazon.encryption.keyset.registry.KeyManager;
import software.amazon.encryption.keyset.registry.Registry;

/**
 * Key manager for envelope encryption keys: a remote KEK URI plus the template of the local DEKs.
 * <p>
 * Key format: {@code {"kekUri": uri, "dekTypeId": id, "dekFormat": base64}}.
 * Key: the key format plus {@code "version": 0}.
 */
public class KmsEnvelopeAeadKeyManager implements KeyManager<Aead> {

    public static final String TYPE_ID = "aws.keyset.KmsEnvelopeAeadKey";
    private static final int VERSION = 0;

    public static KeyTemplate createKeyTemplate(String kekUri, KeyTemplate dekTemplate) {
        byte[] format = SerializedKeys.write(writer -> {
            writer.writeFieldName("kekUri").writeValue(kekUri);
            writer.writeFieldName("dekTypeId").writeValue(dekTemplate.typeId());
            writer.writeFieldName("dekFormat").writeValue(SerializedKeys.encodeBytes(dekTemplate.serializedFormat()));
        });
        return KeyTemplate.create(TYPE_ID, format, OutputPrefixKind.RAW);
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
        return KeyMaterialClass.REMOTE;
    }

    @Override
    public Aead primitive(byte[] serializedKey) throws GeneralSecurityException {
        Map<String, JsonNode> fields = SerializedKeys.read(serializedKey, "KMS envelope key");
        SerializedKeys.validateVersion(fields, VERSION);
        String kekUri = SerializedKeys.string(fields, "kekUri");
        KeyTemplate dekTemplate = dekTemplate(fields);
        return new KmsEnvelopeAead(dekTemplate, KmsAeadKeyManager.remoteAead(kekUri));
    }

    @Override
    public byte[] newKey(byte[] serializedKeyFormat) throws GeneralSecurityException {
        Map<String, JsonNode> fields = SerializedKeys.read(serializedKeyFormat, "KMS envelope key format");
        String kekUri = SerializedKeys.string(fields, "kekUri");
        KeyTemplate dekTemplate = dekTemplate(fields);
        return SerializedKeys.write(writer -> {
            writer.writeFieldName("version").writeValue(VERSION);
            writer.writeFieldName("kekUri").writeValue(kekUri);
            writer.writeFieldName("dekTypeId").writeValue(dekTemplate.typeId());
            writer.writeFieldName("dekFormat").writeValue(SerializedKeys.encodeBytes(dekTemplate.serializedFormat()));
        });
    }

    private static KeyTemplate dekTemplate(Map<String, JsonNode> fields) throws GeneralSecurityException {
        String dekTypeId = SerializedKeys.string(fields, "dekTypeId");
        byte[] dekFormat = SerializedKeys.bytes(fields, "dekFormat");
        try {
            KeyManager<?> dekManager = Registry.lookup(dekTypeId, Aead.class);
            if (dekManager.materialClass() != KeyMaterialClass.SYMMETRIC) {
                throw new InvalidAlgorithmParameterException("Data encryption keys must be symmetric, not " + dekTypeId);
            }
        } catch (KeysetException e) {
            throw new InvalidAlgorithmParameterException("Unsupported data encryption key type " + dekTypeId, e);
        }
        return KeyTemplate.create(dekTypeId, dekFormat, OutputPrefixKind.RAW);
    }
}
