// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.keyset.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A view of a {@link Keyset} without any key material. Safe to log and to store next to an
 * encrypted keyset.
 */
public final class KeysetInfo {

    private final int _primaryKeyId;
    private final List<KeyInfo> _keyInfos;

    public KeysetInfo(int primaryKeyId, List<KeyInfo> keyInfos) {
        _primaryKeyId = primaryKeyId;
        _keyInfos = Collections.unmodifiableList(new ArrayList<>(keyInfos));
    }

    public static KeysetInfo of(Keyset keyset) {
        List<KeyInfo> infos = new ArrayList<>(keyset.size());
        for (KeyEntry key : keyset.keys()) {
            infos.add(new KeyInfo(key.typeId(), key.status(), key.keyId(), key.outputPrefixKind()));
        }
        return new KeysetInfo(keyset.primaryKeyId(), infos);
    }

    public int primaryKeyId() {
        return _primaryKeyId;
    }

    public List<KeyInfo> keyInfos() {
        return _keyInfos;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        KeysetInfo other = (KeysetInfo) obj;
        return _primaryKeyId == other._primaryKeyId && _keyInfos.equals(other._keyInfos);
    }

    @Override
    public int hashCode() {
        return Objects.hash(_primaryKeyId, _keyInfos);
    }

    @Override
    public String toString() {
        return "KeysetInfo{primaryKeyId=" + Integer.toUnsignedString(_primaryKeyId) + ", keys=" + _keyInfos + "}";
    }

    /**
     * Metadata of one key.
     */
    public static final class KeyInfo {
        private final String _typeId;
        private final KeyStatus _status;
        private final int _keyId;
        private final OutputPrefixKind _outputPrefixKind;

        public KeyInfo(String typeId, KeyStatus status, int keyId, OutputPrefixKind outputPrefixKind) {
            _typeId = typeId;
            _status = status;
            _keyId = keyId;
            _outputPrefixKind = outputPrefixKind;
        }

        public String typeId() {
            return _typeId;
        }

        public KeyStatus status() {
            return _status;
        }

        public int keyId() {
            return _keyId;
        }

        public OutputPrefixKind outputPrefixKind() {
            return _outputPrefixKind;
        }

        @Override
        public boolean equals(Object obj) {
            if (this == obj) {
                return true;
            }
            if (obj == null || getClass() != obj.getClass()) {
                return false;
            }
            KeyInfo other = (KeyInfo) obj;
            return _keyId == other._keyId
                    && Objects.equals(_typeId, other._typeId)
                    && _status == other._status
                    && _outputPrefixKind == other._outputPrefixKind;
        }

        @Override
        public int hashCode() {
            return Objects.hash(_typeId, _status, _keyId, _outputPrefixKind);
        }

        @Override
        public String toString() {
            return "{keyId=" + Integer.toUnsignedString(_keyId) + ", typeId=" + _typeId
                    + ", status=" + _status + ", outputPrefixKind=" + _outputPrefixKind + "}";
        }
    }
}
