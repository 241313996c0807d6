// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.keyset.internal;

import org.junit.jupiter.api.Test;
import software.amazon.encryption.keyset.model.OutputPrefixKind;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class OutputPrefixTest {

    @Test
    public void tinkPrefixIsStartByteAndBigEndianKeyId() {
        assertArrayEquals(new byte[]{0x01, 0x00, 0x00, 0x00, 0x2A}, OutputPrefix.of(42, OutputPrefixKind.TINK));
    }

    @Test
    public void legacyAndCrunchyPrefixesStartWithZero() {
        byte[] expected = {0x00, 0x12, 0x34, 0x56, 0x78};
        assertArrayEquals(expected, OutputPrefix.of(0x12345678, OutputPrefixKind.LEGACY));
        assertArrayEquals(expected, OutputPrefix.of(0x12345678, OutputPrefixKind.CRUNCHY));
    }

    @Test
    public void rawPrefixIsEmpty() {
        assertEquals(0, OutputPrefix.of(42, OutputPrefixKind.RAW).length);
    }

    @Test
    public void keyIdsAboveSignedRangeAreWrittenUnsigned() {
        assertArrayEquals(new byte[]{0x01, (byte) 0xFF, (byte) 0xFF, (byte) 0xFF, (byte) 0xFE},
                OutputPrefix.of(0xFFFFFFFE, OutputPrefixKind.TINK));
    }

    @Test
    public void distinctKeyIdsNeverSharePrefix() {
        assertNotEquals(OutputPrefix.lookupKey(OutputPrefix.of(1, OutputPrefixKind.TINK)),
                OutputPrefix.lookupKey(OutputPrefix.of(256, OutputPrefixKind.TINK)));
        assertNotEquals(OutputPrefix.lookupKey(OutputPrefix.of(7, OutputPrefixKind.TINK)),
                OutputPrefix.lookupKey(OutputPrefix.of(7, OutputPrefixKind.LEGACY)));
    }

    @Test
    public void mayHaveNonRawPrefixChecksLengthAndStartByte() {
        assertTrue(OutputPrefix.mayHaveNonRawPrefix(new byte[]{0x01, 0, 0, 0, 1}));
        assertTrue(OutputPrefix.mayHaveNonRawPrefix(new byte[]{0x00, 0, 0, 0, 1, 9}));
        assertFalse(OutputPrefix.mayHaveNonRawPrefix(new byte[]{0x01, 0, 0, 0}));
        assertFalse(OutputPrefix.mayHaveNonRawPrefix(new byte[]{0x02, 0, 0, 0, 1}));
        assertFalse(OutputPrefix.mayHaveNonRawPrefix(new byte[0]));
    }

    @Test
    public void onlyLegacyAppendsTrailingZero() {
        byte[] data = {1, 2, 3};
        assertArrayEquals(new byte[]{1, 2, 3, 0}, OutputPrefix.dataToAuthenticate(data, OutputPrefixKind.LEGACY));
        assertSame(data, OutputPrefix.dataToAuthenticate(data, OutputPrefixKind.TINK));
        assertSame(data, OutputPrefix.dataToAuthenticate(data, OutputPrefixKind.CRUNCHY));
        assertSame(data, OutputPrefix.dataToAuthenticate(data, OutputPrefixKind.RAW));
    }

    @Test
    public void concatAndStripAreInverse() {
        byte[] prefix = OutputPrefix.of(5, OutputPrefixKind.TINK);
        byte[] payload = {9, 8, 7};
        byte[] joined = OutputPrefix.concat(prefix, payload);
        assertArrayEquals(new byte[]{0x01, 0, 0, 0, 5, 9, 8, 7}, joined);
        assertArrayEquals(payload, OutputPrefix.strip(joined, prefix.length));
        assertArrayEquals(prefix, OutputPrefix.candidatePrefix(joined));
    }
}
