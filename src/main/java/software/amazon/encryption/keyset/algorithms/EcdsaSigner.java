// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.keyset.algorithms;

import java.security.GeneralSecurityException;
import java.security.PrivateKey;
import java.security.Provider;
import java.security.SecureRandom;
import java.security.Signature;

import software.amazon.encryption.keyset.internal.CryptoFactory;
import software.amazon.encryption.keyset.primitives.Signer;

/**
 * ECDSA signer producing DER or IEEE P1363 signatures.
 */
public final class EcdsaSigner implements Signer {

    private final PrivateKey _privateKey;
    private final HashType _hashType;
    private final EllipticCurve _curve;
    private final EcdsaSignatureEncoding _encoding;
    private final Provider _cryptoProvider;
    private final SecureRandom _secureRandom;

    EcdsaSigner(PrivateKey privateKey, HashType hashType, EllipticCurve curve, EcdsaSignatureEncoding encoding,
                Provider cryptoProvider, SecureRandom secureRandom) {
        _privateKey = privateKey;
        _hashType = hashType;
        _curve = curve;
        _encoding = encoding;
        _cryptoProvider = cryptoProvider;
        _secureRandom = secureRandom;
    }

    @Override
    public byte[] sign(byte[] data) throws GeneralSecurityException {
        final Signature signature = CryptoFactory.createSignature(_hashType.ecdsaAlgorithm(), _cryptoProvider);
        signature.initSign(_privateKey, _secureRandom);
        signature.update(data);
        return _encoding.fromDer(signature.sign(), _curve.coordinateSizeBytes());
    }
}
