// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.keyset.io;

import java.io.IOException;

import software.amazon.encryption.keyset.model.EncryptedKeyset;
import software.amazon.encryption.keyset.model.Keyset;

/**
 * Persists keysets, either in cleartext or encrypted.
 */
public interface KeysetWriter {

    void write(Keyset keyset) throws IOException;

    void write(EncryptedKeyset encryptedKeyset) throws IOException;
}
