// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.keyset.model;

/**
 * A serialized keyset encrypted under a master key, with an optional cleartext {@link KeysetInfo}.
 */
public final class EncryptedKeyset {

    private final byte[] _encryptedKeyset;
    private final KeysetInfo _keysetInfo;

    public EncryptedKeyset(byte[] encryptedKeyset, KeysetInfo keysetInfo) {
        _encryptedKeyset = encryptedKeyset.clone();
        _keysetInfo = keysetInfo;
    }

    public byte[] encryptedKeyset() {
        return _encryptedKeyset.clone();
    }

    /**
     * @return the keyset info stored beside the ciphertext, or null if none was stored
     */
    public KeysetInfo keysetInfo() {
        return _keysetInfo;
    }
}
