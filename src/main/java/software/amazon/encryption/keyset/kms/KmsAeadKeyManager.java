// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.keyset.kms;

import java.security.GeneralSecurityException;
import java.util.Map;

import software.amazon.awssdk.protocols.jsoncore.JsonNode;
import software.amazon.encryption.keyset.KeyNotFoundException;
import software.amazon.encryption.keyset.PrimitiveInstantiationException;
import software.amazon.encryption.keyset.internal.SerializedKeys;
import software.amazon.encryption.keyset.model.KeyMaterialClass;
import software.amazon.encryption.keyset.model.KeyTemplate;
import software.amazon.encryption.keyset.model.OutputPrefixKind;
import software.amazon.encryption.keyset.primitives.Aead;
import software.amazon.encryption.keyset.registry.KeyManager;
import software.amazon.encryption.keyset.registry.Registry;

/**
 * Key manager for keys held in a remote KMS. The serialized key is only the key URI; every
 * operation of the resulting {@link Aead} is served by the {@link software.amazon.encryption.keyset.registry.KmsClient}
 * registered for that URI.
 * <p>
 * Key format: {@code {"keyUri": uri}}. Key: {@code {"version": 0, "keyUri": uri}}.
 */
public class KmsAeadKeyManager implements KeyManager<Aead> {

    public static final String TYPE_ID = "aws.keyset.KmsAeadKey";
    private static final int VERSION = 0;

    public static KeyTemplate createKeyTemplate(String keyUri) {
        byte[] format = SerializedKeys.write(writer -> writer.writeFieldName("keyUri").writeValue(keyUri));
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
        Map<String, JsonNode> fields = SerializedKeys.read(serializedKey, "KMS Aead key");
        SerializedKeys.validateVersion(fields, VERSION);
        return remoteAead(SerializedKeys.string(fields, "keyUri"));
    }

    @Override
    public byte[] newKey(byte[] serializedKeyFormat) throws GeneralSecurityException {
        Map<String, JsonNode> fields = SerializedKeys.read(serializedKeyFormat, "KMS Aead key format");
        String keyUri = SerializedKeys.string(fields, "keyUri");
        return SerializedKeys.write(writer -> {
            writer.writeFieldName("version").writeValue(VERSION);
            writer.writeFieldName("keyUri").writeValue(keyUri);
        });
    }

    /**
     * Resolves the remote Aead for a key URI through the registered KMS clients.
     *
     * @throws PrimitiveInstantiationException if no client supports the URI or the client fails
     */
    static Aead remoteAead(String keyUri) {
        try {
            return Registry.kmsClient(keyUri).getAead(keyUri);
        } catch (KeyNotFoundException e) {
            throw new PrimitiveInstantiationException("No KMS client registered for " + keyUri, e);
        } catch (GeneralSecurityException e) {
            throw new PrimitiveInstantiationException("KMS client cannot resolve " + keyUri, e);
        }
    }
}
