// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.keyset;

import java.io.IOException;

import software.amazon.encryption.keyset.io.KeysetReader;
import software.amazon.encryption.keyset.io.KeysetWriter;
import software.amazon.encryption.keyset.model.Keyset;

/**
 * Explicit access to cleartext keysets, including their secret key material.
 * Use {@link KeysetHandle#write(KeysetWriter, software.amazon.encryption.keyset.primitives.Aead)}
 * to persist secret keysets whenever a master key is available.
 */
public final class CleartextKeysetHandle {

    private CleartextKeysetHandle() {
    }

    public static KeysetHandle fromKeyset(Keyset keyset) {
        return new KeysetHandle(keyset);
    }

    public static Keyset getKeyset(KeysetHandle handle) {
        return handle.keyset();
    }

    public static KeysetHandle read(KeysetReader reader) throws IOException {
        return new KeysetHandle(reader.read());
    }

    public static void write(KeysetHandle handle, KeysetWriter writer) throws IOException {
        writer.write(handle.keyset());
    }
}
