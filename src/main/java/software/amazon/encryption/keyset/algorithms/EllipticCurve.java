// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.keyset.algorithms;

import java.security.GeneralSecurityException;
import java.security.InvalidAlgorithmParameterException;

/**
 * NIST curves supported by the built-in ECDSA key managers.
 */
public enum EllipticCurve {
    NIST_P256("secp256r1", 256),
    NIST_P384("secp384r1", 384),
    NIST_P521("secp521r1", 521);

    private final String _jceName;
    private final int _fieldSizeBits;

    EllipticCurve(String jceName, int fieldSizeBits) {
        _jceName = jceName;
        _fieldSizeBits = fieldSizeBits;
    }

    public String jceName() {
        return _jceName;
    }

    public int fieldSizeBits() {
        return _fieldSizeBits;
    }

    /**
     * Size of one big-endian coordinate, as used by IEEE P1363 signatures.
     */
    public int coordinateSizeBytes() {
        return (_fieldSizeBits + 7) / 8;
    }

    static EllipticCurve fromName(String name) throws GeneralSecurityException {
        for (EllipticCurve curve : values()) {
            if (curve.name().equals(name)) {
                return curve;
            }
        }
        throw new InvalidAlgorithmParameterException("Unsupported curve: " + name);
    }
}
