// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.keyset.algorithms;

import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.Provider;
import java.util.Arrays;

import javax.crypto.Mac;
import javax.crypto.SecretKey;

import software.amazon.encryption.keyset.internal.CryptoFactory;
import software.amazon.encryption.keyset.primitives.AuthenticationCode;

/**
 * HMAC truncated to a fixed tag size.
 */
public final class HmacAuthenticationCode implements AuthenticationCode {

    private final SecretKey _key;
    private final HashType _hashType;
    private final int _tagSizeBytes;
    private final Provider _cryptoProvider;

    HmacAuthenticationCode(SecretKey key, HashType hashType, int tagSizeBytes, Provider cryptoProvider) {
        _key = key;
        _hashType = hashType;
        _tagSizeBytes = tagSizeBytes;
        _cryptoProvider = cryptoProvider;
    }

    @Override
    public byte[] computeMac(byte[] data) throws GeneralSecurityException {
        final Mac mac = CryptoFactory.createMac(_hashType.macAlgorithm(), _cryptoProvider);
        mac.init(_key);
        byte[] fullTag = mac.doFinal(data);
        return Arrays.copyOf(fullTag, _tagSizeBytes);
    }

    @Override
    public void verifyMac(byte[] mac, byte[] data) throws GeneralSecurityException {
        // MessageDigest.isEqual runs in constant time
        if (mac == null || !MessageDigest.isEqual(computeMac(data), mac)) {
            throw new GeneralSecurityException("Invalid MAC");
        }
    }
}
