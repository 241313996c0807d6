// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.keyset.algorithms;

import java.security.GeneralSecurityException;
import java.security.PublicKey;
import java.security.Provider;
import java.security.Signature;
import java.security.SignatureException;

import software.amazon.encryption.keyset.internal.CryptoFactory;
import software.amazon.encryption.keyset.primitives.Verifier;

/**
 * ECDSA verifier for DER or IEEE P1363 signatures.
 */
public final class EcdsaVerifier implements Verifier {

    private final PublicKey _publicKey;
    private final HashType _hashType;
    private final EllipticCurve _curve;
    private final EcdsaSignatureEncoding _encoding;
    private final Provider _cryptoProvider;

    EcdsaVerifier(PublicKey publicKey, HashType hashType, EllipticCurve curve, EcdsaSignatureEncoding encoding,
                  Provider cryptoProvider) {
        _publicKey = publicKey;
        _hashType = hashType;
        _curve = curve;
        _encoding = encoding;
        _cryptoProvider = cryptoProvider;
    }

    @Override
    public void verify(byte[] signature, byte[] data) throws GeneralSecurityException {
        byte[] der = _encoding.toDer(signature, _curve.coordinateSizeBytes());
        final Signature verifier = CryptoFactory.createSignature(_hashType.ecdsaAlgorithm(), _cryptoProvider);
        verifier.initVerify(_publicKey);
        verifier.update(data);
        if (!verifier.verify(der)) {
            throw new SignatureException("Invalid signature");
        }
    }
}
