// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.keyset.io;

import java.io.IOException;

import software.amazon.encryption.keyset.model.EncryptedKeyset;
import software.amazon.encryption.keyset.model.Keyset;

/**
 * Loads keysets written by a {@link KeysetWriter}.
 */
public interface KeysetReader {

    Keyset read() throws IOException;

    EncryptedKeyset readEncrypted() throws IOException;
}
