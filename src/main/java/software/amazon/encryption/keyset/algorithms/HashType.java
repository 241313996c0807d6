// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.keyset.algorithms;

import java.security.GeneralSecurityException;
import java.security.NoSuchAlgorithmException;

/**
 * Hash functions supported by the built-in HMAC and ECDSA key managers, with their JCE names.
 */
public enum HashType {
    SHA256("HmacSHA256", "SHA256withECDSA", 32),
    SHA384("HmacSHA384", "SHA384withECDSA", 48),
    SHA512("HmacSHA512", "SHA512withECDSA", 64);

    private final String _macAlgorithm;
    private final String _ecdsaAlgorithm;
    private final int _digestLengthBytes;

    HashType(String macAlgorithm, String ecdsaAlgorithm, int digestLengthBytes) {
        _macAlgorithm = macAlgorithm;
        _ecdsaAlgorithm = ecdsaAlgorithm;
        _digestLengthBytes = digestLengthBytes;
    }

    public String macAlgorithm() {
        return _macAlgorithm;
    }

    public String ecdsaAlgorithm() {
        return _ecdsaAlgorithm;
    }

    public int digestLengthBytes() {
        return _digestLengthBytes;
    }

    static HashType fromName(String name) throws GeneralSecurityException {
        for (HashType hashType : values()) {
            if (hashType.name().equals(name)) {
                return hashType;
            }
        }
        throw new NoSuchAlgorithmException("Unsupported hash type: " + name);
    }
}
