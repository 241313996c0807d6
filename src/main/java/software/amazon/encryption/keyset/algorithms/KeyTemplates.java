// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.keyset.algorithms;

import software.amazon.encryption.keyset.model.KeyTemplate;
import software.amazon.encryption.keyset.model.OutputPrefixKind;

/**
 * Predefined templates for the built-in key types.
 */
public final class KeyTemplates {

    public static final KeyTemplate AES128_GCM = KeyTemplate.create(
            AesGcmKeyManager.TYPE_ID, AesGcmKeyManager.keyFormat(16), OutputPrefixKind.TINK);

    public static final KeyTemplate AES256_GCM = KeyTemplate.create(
            AesGcmKeyManager.TYPE_ID, AesGcmKeyManager.keyFormat(32), OutputPrefixKind.TINK);

    public static final KeyTemplate AES256_GCM_RAW = AES256_GCM.withOutputPrefixKind(OutputPrefixKind.RAW);

    public static final KeyTemplate HMAC_SHA256_128BITTAG = KeyTemplate.create(
            HmacKeyManager.TYPE_ID, HmacKeyManager.keyFormat(32, HashType.SHA256, 16), OutputPrefixKind.TINK);

    public static final KeyTemplate HMAC_SHA256_256BITTAG = KeyTemplate.create(
            HmacKeyManager.TYPE_ID, HmacKeyManager.keyFormat(32, HashType.SHA256, 32), OutputPrefixKind.TINK);

    public static final KeyTemplate HMAC_SHA512_256BITTAG = KeyTemplate.create(
            HmacKeyManager.TYPE_ID, HmacKeyManager.keyFormat(64, HashType.SHA512, 32), OutputPrefixKind.TINK);

    public static final KeyTemplate ECDSA_P256 = KeyTemplate.create(
            EcdsaSignKeyManager.TYPE_ID, EcdsaSignKeyManager.keyFormat(EllipticCurve.NIST_P256, HashType.SHA256),
            OutputPrefixKind.TINK);

    public static final KeyTemplate ECDSA_P384 = KeyTemplate.create(
            EcdsaSignKeyManager.TYPE_ID, EcdsaSignKeyManager.keyFormat(EllipticCurve.NIST_P384, HashType.SHA384),
            OutputPrefixKind.TINK);

    public static final KeyTemplate ECDSA_P256_RAW = ECDSA_P256.withOutputPrefixKind(OutputPrefixKind.RAW);

    public static final KeyTemplate ECDSA_P256_IEEE_P1363 = KeyTemplate.create(
            EcdsaSignKeyManager.TYPE_ID,
            EcdsaSignKeyManager.keyFormat(EllipticCurve.NIST_P256, HashType.SHA256, EcdsaSignatureEncoding.IEEE_P1363),
            OutputPrefixKind.TINK);

    private KeyTemplates() {
    }
}
