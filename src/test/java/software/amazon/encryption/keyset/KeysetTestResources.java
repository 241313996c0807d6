// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.keyset;

import java.nio.charset.StandardCharsets;

import software.amazon.encryption.keyset.model.KeyEntry;
import software.amazon.encryption.keyset.model.KeyStatus;
import software.amazon.encryption.keyset.model.KeyTemplate;
import software.amazon.encryption.keyset.model.Keyset;
import software.amazon.encryption.keyset.registry.Registry;

/**
 * Builds keysets with chosen key ids for tests. Expects {@link KeysetConfig#register()} to have run.
 */
public class KeysetTestResources {

    public static final byte[] PLAINTEXT = "hello".getBytes(StandardCharsets.UTF_8);
    public static final byte[] ASSOCIATED_DATA = "associated data".getBytes(StandardCharsets.UTF_8);

    public static void resetRegistry() {
        Registry.reset();
        KeysetConfig.register();
    }

    public static KeyEntry generateKey(KeyTemplate template, int keyId) {
        return generateKey(template, keyId, KeyStatus.ENABLED);
    }

    public static KeyEntry generateKey(KeyTemplate template, int keyId, KeyStatus status) {
        return KeyEntry.builder()
                .keyId(keyId)
                .typeId(template.typeId())
                .serializedKey(Registry.generateNewKey(template.typeId(), template.serializedFormat()))
                .materialClass(Registry.lookup(template.typeId()).materialClass())
                .status(status)
                .outputPrefixKind(template.outputPrefixKind())
                .build();
    }

    public static Keyset keyset(int primaryKeyId, KeyEntry... keys) {
        Keyset.Builder builder = Keyset.builder().primaryKeyId(primaryKeyId);
        for (KeyEntry key : keys) {
            builder.addKey(key);
        }
        return builder.build();
    }

    public static KeysetHandle handle(int primaryKeyId, KeyEntry... keys) {
        return CleartextKeysetHandle.fromKeyset(keyset(primaryKeyId, keys));
    }
}
