// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.keyset.internal;

import java.security.GeneralSecurityException;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import software.amazon.encryption.keyset.KeysetTestResources;
import software.amazon.encryption.keyset.PrimitiveInstantiationException;
import software.amazon.encryption.keyset.algorithms.KeyTemplates;
import software.amazon.encryption.keyset.model.KeyEntry;
import software.amazon.encryption.keyset.model.KeyMaterialClass;
import software.amazon.encryption.keyset.model.KeyStatus;
import software.amazon.encryption.keyset.model.Keyset;
import software.amazon.encryption.keyset.model.OutputPrefixKind;
import software.amazon.encryption.keyset.primitives.Aead;
import software.amazon.encryption.keyset.registry.KeyManager;
import software.amazon.encryption.keyset.registry.Registry;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static software.amazon.encryption.keyset.KeysetTestResources.generateKey;
import static software.amazon.encryption.keyset.KeysetTestResources.keyset;

public class PrimitiveSetTest {

    private static final String BROKEN_TYPE_ID = "test.BrokenAeadKey";

    @BeforeEach
    public void setUp() {
        KeysetTestResources.resetRegistry();
    }

    @Test
    public void buildsEntriesInKeysetOrderWithPrimary() {
        Keyset keyset = keyset(2,
                generateKey(KeyTemplates.AES128_GCM, 1),
                generateKey(KeyTemplates.AES256_GCM, 2),
                generateKey(KeyTemplates.AES256_GCM_RAW, 3));

        PrimitiveSet<Aead> primitives = PrimitiveSet.fromKeyset(keyset, Aead.class);

        assertEquals(Aead.class, primitives.primitiveClass());
        assertEquals(3, primitives.entries().size());
        assertEquals(1, primitives.entries().get(0).keyId());
        assertEquals(2, primitives.entries().get(1).keyId());
        assertEquals(3, primitives.entries().get(2).keyId());
        assertEquals(2, primitives.primary().keyId());
        assertArrayEquals(new byte[]{0x01, 0, 0, 0, 2}, primitives.primary().outputPrefix());
        assertEquals(0, primitives.entries().get(2).prefixLength());
    }

    @Test
    public void disabledKeysAreExcludedUnlessRequested() {
        Keyset keyset = keyset(1,
                generateKey(KeyTemplates.AES128_GCM, 1),
                generateKey(KeyTemplates.AES128_GCM, 2, KeyStatus.DISABLED));

        assertEquals(1, PrimitiveSet.fromKeyset(keyset, Aead.class).entries().size());

        PrimitiveSet<Aead> withDisabled = PrimitiveSet.builder(Aead.class)
                .keyset(keyset)
                .includeDisabledKeys(true)
                .build();
        assertEquals(2, withDisabled.entries().size());
        assertEquals(KeyStatus.DISABLED, withDisabled.entries().get(1).status());
    }

    @Test
    public void destroyedKeysAreNeverIncluded() {
        KeyEntry destroyed = generateKey(KeyTemplates.AES128_GCM, 2).toBuilder()
                .status(KeyStatus.DESTROYED)
                .serializedKey(null)
                .build();
        Keyset keyset = keyset(1, generateKey(KeyTemplates.AES128_GCM, 1), destroyed);

        PrimitiveSet<Aead> primitives = PrimitiveSet.builder(Aead.class)
                .keyset(keyset)
                .includeDisabledKeys(true)
                .build();
        assertEquals(1, primitives.entries().size());
    }

    @Test
    public void candidatesListPrefixMatchesBeforeRawEntries() {
        Keyset keyset = keyset(1,
                generateKey(KeyTemplates.AES128_GCM, 1),
                generateKey(KeyTemplates.AES256_GCM_RAW, 2),
                generateKey(KeyTemplates.AES128_GCM, 3),
                generateKey(KeyTemplates.AES256_GCM_RAW, 4));
        PrimitiveSet<Aead> primitives = PrimitiveSet.fromKeyset(keyset, Aead.class);

        byte[] data = OutputPrefix.concat(OutputPrefix.of(3, OutputPrefixKind.TINK), new byte[20]);
        assertEquals(listOf(3, 2, 4), keyIds(primitives.candidates(data)));

        byte[] unprefixed = new byte[20];
        unprefixed[0] = 0x05;
        assertEquals(listOf(2, 4), keyIds(primitives.candidates(unprefixed)));

        assertEquals(listOf(2, 4), keyIds(primitives.candidates(new byte[0])));
    }

    @Test
    public void failuresAreAggregatedWithEveryKeyId() {
        Registry.register(new BrokenKeyManager());
        Keyset keyset = keyset(1,
                generateKey(KeyTemplates.AES128_GCM, 1),
                brokenKey(2),
                brokenKey(3));

        PrimitiveInstantiationException exception = assertThrows(PrimitiveInstantiationException.class,
                () -> PrimitiveSet.fromKeyset(keyset, Aead.class));
        assertTrue(exception.getMessage().contains("[2, 3]"));
        assertNotNull(exception.getCause());
        assertEquals(1, exception.getSuppressed().length);
    }

    @Test
    public void mismatchedPrimitiveIsReportedAtConstruction() {
        Keyset keyset = keyset(1, generateKey(KeyTemplates.HMAC_SHA256_128BITTAG, 1));
        assertThrows(PrimitiveInstantiationException.class, () -> PrimitiveSet.fromKeyset(keyset, Aead.class));
    }

    private static KeyEntry brokenKey(int keyId) {
        return KeyEntry.builder()
                .keyId(keyId)
                .typeId(BROKEN_TYPE_ID)
                .serializedKey(new byte[]{1})
                .materialClass(KeyMaterialClass.SYMMETRIC)
                .status(KeyStatus.ENABLED)
                .outputPrefixKind(OutputPrefixKind.TINK)
                .build();
    }

    private static List<Integer> keyIds(List<PrimitiveSet.Entry<Aead>> entries) {
        List<Integer> keyIds = new ArrayList<>();
        for (PrimitiveSet.Entry<Aead> entry : entries) {
            keyIds.add(entry.keyId());
        }
        return keyIds;
    }

    private static List<Integer> listOf(Integer... values) {
        List<Integer> list = new ArrayList<>();
        for (Integer value : values) {
            list.add(value);
        }
        return list;
    }

    private static class BrokenKeyManager implements KeyManager<Aead> {
        @Override
        public String typeId() {
            return BROKEN_TYPE_ID;
        }

        @Override
        public Class<Aead> primitiveClass() {
            return Aead.class;
        }

        @Override
        public KeyMaterialClass materialClass() {
            return KeyMaterialClass.SYMMETRIC;
        }

        @Override
        public Aead primitive(byte[] serializedKey) throws GeneralSecurityException {
            throw new GeneralSecurityException("broken");
        }

        @Override
        public byte[] newKey(byte[] serializedKeyFormat) throws GeneralSecurityException {
            throw new GeneralSecurityException("broken");
        }
    }
}
