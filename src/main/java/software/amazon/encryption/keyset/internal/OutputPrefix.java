// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.keyset.internal;

import java.nio.ByteBuffer;
import java.util.Arrays;

import software.amazon.awssdk.utils.BinaryUtils;
import software.amazon.encryption.keyset.model.OutputPrefixKind;

/**
 * Encodes and inspects the prefix that every produced ciphertext, MAC and signature starts with.
 */
public final class OutputPrefix {

    public static final int NON_RAW_PREFIX_LENGTH = 5;
    public static final byte TINK_START_BYTE = 0x01;
    public static final byte LEGACY_START_BYTE = 0x00;

    private static final byte[] EMPTY = new byte[0];
    private static final byte[] TRAILING_ZERO = new byte[]{0x00};

    private OutputPrefix() {
    }

    /**
     * @return the prefix of a key: empty for RAW, otherwise the start byte and the big-endian key id
     */
    public static byte[] of(int keyId, OutputPrefixKind kind) {
        if (kind.prefixLength() == 0) {
            return EMPTY.clone();
        }
        return ByteBuffer.allocate(NON_RAW_PREFIX_LENGTH)
                .put(kind.startByte())
                .putInt(keyId)
                .array();
    }

    /**
     * @return true if {@code data} is long enough and starts with a byte that a 5-byte prefix can start with
     */
    public static boolean mayHaveNonRawPrefix(byte[] data) {
        return data.length >= NON_RAW_PREFIX_LENGTH
                && (data[0] == TINK_START_BYTE || data[0] == LEGACY_START_BYTE);
    }

    public static byte[] candidatePrefix(byte[] data) {
        return Arrays.copyOf(data, NON_RAW_PREFIX_LENGTH);
    }

    public static byte[] strip(byte[] data, int prefixLength) {
        return Arrays.copyOfRange(data, prefixLength, data.length);
    }

    public static byte[] concat(byte[] prefix, byte[] payload) {
        byte[] result = new byte[prefix.length + payload.length];
        System.arraycopy(prefix, 0, result, 0, prefix.length);
        System.arraycopy(payload, 0, result, prefix.length, payload.length);
        return result;
    }

    /**
     * @return the data to authenticate or sign for a key of the given kind
     */
    public static byte[] dataToAuthenticate(byte[] data, OutputPrefixKind kind) {
        if (kind.appendsTrailingZero()) {
            return concat(data, TRAILING_ZERO);
        }
        return data;
    }

    static String lookupKey(byte[] prefix) {
        return BinaryUtils.toHex(prefix);
    }
}
