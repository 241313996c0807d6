// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.keyset.wrappers;

import java.util.Arrays;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import software.amazon.encryption.keyset.AuthenticationFailureException;
import software.amazon.encryption.keyset.KeysetManager;
import software.amazon.encryption.keyset.KeysetTestResources;
import software.amazon.encryption.keyset.algorithms.KeyTemplates;
import software.amazon.encryption.keyset.internal.OutputPrefix;
import software.amazon.encryption.keyset.model.KeyEntry;
import software.amazon.encryption.keyset.model.OutputPrefixKind;
import software.amazon.encryption.keyset.primitives.AuthenticationCode;
import software.amazon.encryption.keyset.registry.Registry;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static software.amazon.encryption.keyset.KeysetTestResources.PLAINTEXT;
import static software.amazon.encryption.keyset.KeysetTestResources.generateKey;
import static software.amazon.encryption.keyset.KeysetTestResources.handle;

public class AuthenticationCodeWrapperTest {

    @BeforeEach
    public void setUp() {
        KeysetTestResources.resetRegistry();
    }

    @Test
    public void computesPrefixedTagAndVerifies() throws Exception {
        AuthenticationCode mac = handle(5, generateKey(KeyTemplates.HMAC_SHA256_128BITTAG, 5))
                .getPrimitive(AuthenticationCode.class);

        byte[] tag = mac.computeMac(PLAINTEXT);

        assertEquals(5 + 16, tag.length);
        assertArrayEquals(OutputPrefix.of(5, OutputPrefixKind.TINK), Arrays.copyOf(tag, 5));
        assertDoesNotThrow(() -> mac.verifyMac(tag, PLAINTEXT));
    }

    @Test
    public void legacyTagCoversDataWithTrailingZero() throws Exception {
        KeyEntry legacy = generateKey(KeyTemplates.HMAC_SHA256_256BITTAG.withOutputPrefixKind(OutputPrefixKind.LEGACY), 11);
        AuthenticationCode mac = handle(11, legacy).getPrimitive(AuthenticationCode.class);
        AuthenticationCode primitive = Registry.instantiate(legacy.typeId(), legacy.serializedKey(), AuthenticationCode.class);

        byte[] tag = mac.computeMac(PLAINTEXT);

        assertArrayEquals(new byte[]{0x00, 0x00, 0x00, 0x00, 0x0B}, Arrays.copyOf(tag, 5));
        byte[] expected = primitive.computeMac(OutputPrefix.concat(PLAINTEXT, new byte[]{0x00}));
        assertArrayEquals(expected, Arrays.copyOfRange(tag, 5, tag.length));
        assertDoesNotThrow(() -> mac.verifyMac(tag, PLAINTEXT));
    }

    @Test
    public void crunchyTagCoversDataUnchanged() throws Exception {
        KeyEntry crunchy = generateKey(KeyTemplates.HMAC_SHA256_256BITTAG.withOutputPrefixKind(OutputPrefixKind.CRUNCHY), 12);
        AuthenticationCode mac = handle(12, crunchy).getPrimitive(AuthenticationCode.class);
        AuthenticationCode primitive = Registry.instantiate(crunchy.typeId(), crunchy.serializedKey(), AuthenticationCode.class);

        byte[] tag = mac.computeMac(PLAINTEXT);

        assertArrayEquals(new byte[]{0x00, 0x00, 0x00, 0x00, 0x0C}, Arrays.copyOf(tag, 5));
        assertArrayEquals(primitive.computeMac(PLAINTEXT), Arrays.copyOfRange(tag, 5, tag.length));
    }

    @Test
    public void corruptedTagsFailAuthentication() throws Exception {
        AuthenticationCode mac = handle(5, generateKey(KeyTemplates.HMAC_SHA512_256BITTAG, 5))
                .getPrimitive(AuthenticationCode.class);
        byte[] tag = mac.computeMac(PLAINTEXT);

        for (int i = 0; i < tag.length; i++) {
            byte[] corrupted = tag.clone();
            corrupted[i] ^= 0x01;
            assertThrows(AuthenticationFailureException.class, () -> mac.verifyMac(corrupted, PLAINTEXT));
        }
        assertThrows(AuthenticationFailureException.class, () -> mac.verifyMac(Arrays.copyOf(tag, tag.length - 1), PLAINTEXT));
        assertThrows(AuthenticationFailureException.class, () -> mac.verifyMac(Arrays.copyOf(tag, tag.length + 1), PLAINTEXT));
        assertThrows(AuthenticationFailureException.class, () -> mac.verifyMac(tag, new byte[]{1, 2, 3}));
        assertThrows(AuthenticationFailureException.class, () -> mac.verifyMac(null, PLAINTEXT));
    }

    @Test
    public void rotatedKeysetVerifiesOldTags() throws Exception {
        KeysetManager manager = KeysetManager.withEmptyKeyset();
        int oldKeyId = manager.rotate(KeyTemplates.HMAC_SHA256_128BITTAG);
        byte[] oldTag = manager.keysetHandle().getPrimitive(AuthenticationCode.class).computeMac(PLAINTEXT);
        manager.rotate(KeyTemplates.HMAC_SHA256_256BITTAG.withOutputPrefixKind(OutputPrefixKind.RAW));

        AuthenticationCode rotated = manager.keysetHandle().getPrimitive(AuthenticationCode.class);
        assertDoesNotThrow(() -> rotated.verifyMac(oldTag, PLAINTEXT));
        assertEquals(32, rotated.computeMac(PLAINTEXT).length);

        manager.disable(oldKeyId);
        AuthenticationCode withoutOldKey = manager.keysetHandle().getPrimitive(AuthenticationCode.class);
        assertThrows(AuthenticationFailureException.class, () -> withoutOldKey.verifyMac(oldTag, PLAINTEXT));
    }
}
