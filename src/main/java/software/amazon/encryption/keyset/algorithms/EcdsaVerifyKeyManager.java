// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.keyset.algorithms;

import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.Provider;
import java.security.PublicKey;
import java.security.spec.X509EncodedKeySpec;
import java.util.Map;

import software.amazon.awssdk.protocols.jsoncore.JsonNode;
import software.amazon.encryption.keyset.internal.CryptoFactory;
import software.amazon.encryption.keyset.internal.SerializedKeys;
import software.amazon.encryption.keyset.model.KeyMaterialClass;
import software.amazon.encryption.keyset.primitives.Verifier;
import software.amazon.encryption.keyset.registry.KeyManager;

/**
 * Key manager for ECDSA public keys.
 * Public keys are never generated directly; derive them from a private key keyset.
 */
public class EcdsaVerifyKeyManager implements KeyManager<Verifier> {

    public static final String TYPE_ID = "aws.keyset.EcdsaPublicKey";

    private final Provider _cryptoProvider;

    public EcdsaVerifyKeyManager() {
        this(null);
    }

    public EcdsaVerifyKeyManager(Provider cryptoProvider) {
        _cryptoProvider = cryptoProvider;
    }

    static byte[] serialize(EllipticCurve curve, HashType hashType, EcdsaSignatureEncoding encoding,
                            byte[] publicKey) {
        return SerializedKeys.write(writer -> {
            writer.writeFieldName("version").writeValue(EcdsaSignKeyManager.VERSION);
            writer.writeFieldName("curve").writeValue(curve.name());
            writer.writeFieldName("hash").writeValue(hashType.name());
            writer.writeFieldName(EcdsaSignatureEncoding.FIELD_NAME).writeValue(encoding.name());
            writer.writeFieldName("publicKey").writeValue(SerializedKeys.encodeBytes(publicKey));
        });
    }

    @Override
    public String typeId() {
        return TYPE_ID;
    }

    @Override
    public Class<Verifier> primitiveClass() {
        return Verifier.class;
    }

    @Override
    public KeyMaterialClass materialClass() {
        return KeyMaterialClass.ASYMMETRIC_PUBLIC;
    }

    @Override
    public Verifier primitive(byte[] serializedKey) throws GeneralSecurityException {
        Map<String, JsonNode> fields = SerializedKeys.read(serializedKey, "ECDSA public key");
        SerializedKeys.validateVersion(fields, EcdsaSignKeyManager.VERSION);
        EllipticCurve curve = EllipticCurve.fromName(SerializedKeys.string(fields, "curve"));
        HashType hashType = HashType.fromName(SerializedKeys.string(fields, "hash"));
        EcdsaSignKeyManager.validateParameters(curve, hashType);
        EcdsaSignatureEncoding encoding = EcdsaSignatureEncoding.read(fields);

        PublicKey publicKey = parsePublicKey(SerializedKeys.bytes(fields, "publicKey"), curve, _cryptoProvider);
        return new EcdsaVerifier(publicKey, hashType, curve, encoding, _cryptoProvider);
    }

    static PublicKey parsePublicKey(byte[] encoded, EllipticCurve curve, Provider cryptoProvider)
            throws GeneralSecurityException {
        KeyFactory keyFactory = CryptoFactory.createKeyFactory(EcdsaSignKeyManager.KEY_ALGORITHM, cryptoProvider);
        PublicKey publicKey = keyFactory.generatePublic(new X509EncodedKeySpec(encoded));
        EcdsaSignKeyManager.validateCurve(publicKey, curve, cryptoProvider);
        return publicKey;
    }

    @Override
    public byte[] newKey(byte[] serializedKeyFormat) throws GeneralSecurityException {
        throw new GeneralSecurityException("ECDSA public keys cannot be generated, derive them from a private key");
    }
}
