// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.keyset.model;

/**
 * Determines the prefix that identifies the producing key on every ciphertext, MAC and signature.
 * <ul>
 *     <li>TINK: 5 bytes, {@code 0x01} followed by the big-endian key id.</li>
 *     <li>LEGACY: 5 bytes, {@code 0x00} followed by the big-endian key id. MACs and signatures are
 *     computed over the data with a single {@code 0x00} byte appended.</li>
 *     <li>CRUNCHY: 5 bytes, {@code 0x00} followed by the big-endian key id.</li>
 *     <li>RAW: no prefix.</li>
 * </ul>
 */
public enum OutputPrefixKind {
    TINK((byte) 0x01, 5),
    LEGACY((byte) 0x00, 5),
    CRUNCHY((byte) 0x00, 5),
    RAW((byte) 0x00, 0);

    private final byte _startByte;
    private final int _prefixLength;

    OutputPrefixKind(byte startByte, int prefixLength) {
        _startByte = startByte;
        _prefixLength = prefixLength;
    }

    public byte startByte() {
        return _startByte;
    }

    public int prefixLength() {
        return _prefixLength;
    }

    /**
     * @return true if the data being authenticated or signed gets a trailing zero byte
     */
    public boolean appendsTrailingZero() {
        return this == LEGACY;
    }
}
