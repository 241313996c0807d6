// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.keyset.algorithms;

import java.security.AlgorithmParameters;
import java.security.GeneralSecurityException;
import java.security.InvalidAlgorithmParameterException;
import java.security.InvalidKeyException;
import java.security.Key;
import java.security.KeyFactory;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.PrivateKey;
import java.security.Provider;
import java.security.PublicKey;
import java.security.SecureRandom;
import java.security.SignatureException;
import java.security.interfaces.ECKey;
import java.security.spec.ECGenParameterSpec;
import java.security.spec.ECParameterSpec;
import java.security.spec.PKCS8EncodedKeySpec;
import java.util.Arrays;
import java.util.Map;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import software.amazon.awssdk.protocols.jsoncore.JsonNode;
import software.amazon.encryption.keyset.internal.CryptoFactory;
import software.amazon.encryption.keyset.internal.SerializedKeys;
import software.amazon.encryption.keyset.model.KeyMaterialClass;
import software.amazon.encryption.keyset.primitives.Signer;
import software.amazon.encryption.keyset.registry.PrivateKeyManager;

/**
 * Key manager for ECDSA private keys over the NIST curves.
 * <p>
 * Key format: {@code {"curve": "NIST_P256", "hash": "SHA256", "encoding": "DER"}}.
 * Key: {@code {"version": 0, "curve", "hash", "encoding", "privateKey": base64 PKCS#8, "publicKey": base64 X.509}}.
 * A missing {@code encoding} means DER.
 * The matching public keys are handled by {@link EcdsaVerifyKeyManager}.
 */
public class EcdsaSignKeyManager implements PrivateKeyManager<Signer> {

    public static final String TYPE_ID = "aws.keyset.EcdsaPrivateKey";
    static final String KEY_ALGORITHM = "EC";
    static final int VERSION = 0;

    private final Provider _cryptoProvider;
    private final SecureRandom _secureRandom;

    public EcdsaSignKeyManager() {
        this(null);
    }

    public EcdsaSignKeyManager(Provider cryptoProvider) {
        this(cryptoProvider, new SecureRandom());
    }

    @SuppressFBWarnings(value = "EI_EXPOSE_REP2", justification = "Pass mutability into key generation")
    public EcdsaSignKeyManager(Provider cryptoProvider, SecureRandom secureRandom) {
        _cryptoProvider = cryptoProvider;
        _secureRandom = secureRandom;
    }

    public static byte[] keyFormat(EllipticCurve curve, HashType hashType) {
        return keyFormat(curve, hashType, EcdsaSignatureEncoding.DER);
    }

    public static byte[] keyFormat(EllipticCurve curve, HashType hashType, EcdsaSignatureEncoding encoding) {
        return SerializedKeys.write(writer -> {
            writer.writeFieldName("curve").writeValue(curve.name());
            writer.writeFieldName("hash").writeValue(hashType.name());
            writer.writeFieldName(EcdsaSignatureEncoding.FIELD_NAME).writeValue(encoding.name());
        });
    }

    @Override
    public String typeId() {
        return TYPE_ID;
    }

    @Override
    public Class<Signer> primitiveClass() {
        return Signer.class;
    }

    @Override
    public KeyMaterialClass materialClass() {
        return KeyMaterialClass.ASYMMETRIC_PRIVATE;
    }

    @Override
    public String publicKeyTypeId() {
        return EcdsaVerifyKeyManager.TYPE_ID;
    }

    @Override
    public Signer primitive(byte[] serializedKey) throws GeneralSecurityException {
        Map<String, JsonNode> fields = SerializedKeys.read(serializedKey, "ECDSA private key");
        SerializedKeys.validateVersion(fields, VERSION);
        EllipticCurve curve = EllipticCurve.fromName(SerializedKeys.string(fields, "curve"));
        HashType hashType = HashType.fromName(SerializedKeys.string(fields, "hash"));
        validateParameters(curve, hashType);
        EcdsaSignatureEncoding encoding = EcdsaSignatureEncoding.read(fields);

        PrivateKey privateKey = parsePrivateKey(fields, curve);
        return new EcdsaSigner(privateKey, hashType, curve, encoding, _cryptoProvider, _secureRandom);
    }

    @Override
    public byte[] newKey(byte[] serializedKeyFormat) throws GeneralSecurityException {
        Map<String, JsonNode> fields = SerializedKeys.read(serializedKeyFormat, "ECDSA key format");
        EllipticCurve curve = EllipticCurve.fromName(SerializedKeys.string(fields, "curve"));
        HashType hashType = HashType.fromName(SerializedKeys.string(fields, "hash"));
        validateParameters(curve, hashType);
        EcdsaSignatureEncoding encoding = EcdsaSignatureEncoding.read(fields);

        KeyPairGenerator generator = CryptoFactory.createKeyPairGenerator(KEY_ALGORITHM, _cryptoProvider);
        generator.initialize(new ECGenParameterSpec(curve.jceName()), _secureRandom);
        KeyPair keyPair = generator.generateKeyPair();
        byte[] privateKey = keyPair.getPrivate().getEncoded();
        byte[] publicKey = keyPair.getPublic().getEncoded();
        try {
            return SerializedKeys.write(writer -> {
                writer.writeFieldName("version").writeValue(VERSION);
                writer.writeFieldName("curve").writeValue(curve.name());
                writer.writeFieldName("hash").writeValue(hashType.name());
                writer.writeFieldName(EcdsaSignatureEncoding.FIELD_NAME).writeValue(encoding.name());
                writer.writeFieldName("privateKey").writeValue(SerializedKeys.encodeBytes(privateKey));
                writer.writeFieldName("publicKey").writeValue(SerializedKeys.encodeBytes(publicKey));
            });
        } finally {
            Arrays.fill(privateKey, (byte) 0);
        }
    }

    /**
     * Derives the public key from a private key, after checking that the stored public key is on the
     * key's curve and belongs to the private key.
     */
    @Override
    public byte[] publicKey(byte[] serializedPrivateKey) throws GeneralSecurityException {
        Map<String, JsonNode> fields = SerializedKeys.read(serializedPrivateKey, "ECDSA private key");
        SerializedKeys.validateVersion(fields, VERSION);
        EllipticCurve curve = EllipticCurve.fromName(SerializedKeys.string(fields, "curve"));
        HashType hashType = HashType.fromName(SerializedKeys.string(fields, "hash"));
        validateParameters(curve, hashType);
        EcdsaSignatureEncoding encoding = EcdsaSignatureEncoding.read(fields);

        byte[] encodedPublicKey = SerializedKeys.bytes(fields, "publicKey");
        PublicKey publicKey = EcdsaVerifyKeyManager.parsePublicKey(encodedPublicKey, curve, _cryptoProvider);
        PrivateKey privateKey = parsePrivateKey(fields, curve);
        validateKeyPair(privateKey, publicKey, curve, hashType);
        return EcdsaVerifyKeyManager.serialize(curve, hashType, encoding, encodedPublicKey);
    }

    private PrivateKey parsePrivateKey(Map<String, JsonNode> fields, EllipticCurve curve)
            throws GeneralSecurityException {
        byte[] encoded = SerializedKeys.bytes(fields, "privateKey");
        PrivateKey privateKey;
        try {
            KeyFactory keyFactory = CryptoFactory.createKeyFactory(KEY_ALGORITHM, _cryptoProvider);
            privateKey = keyFactory.generatePrivate(new PKCS8EncodedKeySpec(encoded));
        } finally {
            Arrays.fill(encoded, (byte) 0);
        }
        validateCurve(privateKey, curve, _cryptoProvider);
        return privateKey;
    }

    // Checks the pair with a signature over random data.
    private void validateKeyPair(PrivateKey privateKey, PublicKey publicKey, EllipticCurve curve, HashType hashType)
            throws GeneralSecurityException {
        byte[] challenge = new byte[32];
        _secureRandom.nextBytes(challenge);
        byte[] signature = new EcdsaSigner(privateKey, hashType, curve, EcdsaSignatureEncoding.DER,
                _cryptoProvider, _secureRandom).sign(challenge);
        try {
            new EcdsaVerifier(publicKey, hashType, curve, EcdsaSignatureEncoding.DER, _cryptoProvider)
                    .verify(signature, challenge);
        } catch (SignatureException e) {
            throw new InvalidKeyException("Public key does not match private key", e);
        }
    }

    /**
     * P-256 pairs with SHA-256, P-384 with SHA-384 or SHA-512, and P-521 with SHA-512.
     */
    static void validateParameters(EllipticCurve curve, HashType hashType) throws GeneralSecurityException {
        boolean valid;
        switch (curve) {
            case NIST_P256:
                valid = hashType == HashType.SHA256;
                break;
            case NIST_P384:
                valid = hashType == HashType.SHA384 || hashType == HashType.SHA512;
                break;
            case NIST_P521:
                valid = hashType == HashType.SHA512;
                break;
            default:
                valid = false;
        }
        if (!valid) {
            throw new InvalidAlgorithmParameterException("Hash " + hashType + " cannot be used with curve " + curve);
        }
    }

    /**
     * Compares the key's domain parameters with the named curve's, as reported by the same provider.
     */
    static void validateCurve(Key key, EllipticCurve curve, Provider cryptoProvider) throws GeneralSecurityException {
        if (!(key instanceof ECKey)) {
            throw new InvalidKeyException("Key does not match curve " + curve);
        }
        AlgorithmParameters parameters = CryptoFactory.createAlgorithmParameters(KEY_ALGORITHM, cryptoProvider);
        parameters.init(new ECGenParameterSpec(curve.jceName()));
        ECParameterSpec expected = parameters.getParameterSpec(ECParameterSpec.class);
        ECParameterSpec actual = ((ECKey) key).getParams();
        if (actual == null
                || !expected.getCurve().equals(actual.getCurve())
                || !expected.getGenerator().equals(actual.getGenerator())
                || !expected.getOrder().equals(actual.getOrder())
                || expected.getCofactor() != actual.getCofactor()) {
            throw new InvalidKeyException("Key does not match curve " + curve);
        }
    }
}
