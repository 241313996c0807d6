// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.keyset.model;

import software.amazon.encryption.keyset.InvalidKeyMaterialException;

/**
 * One key of a {@link Keyset}: its id, type, opaque serialized key, and lifecycle metadata.
 * Instances are immutable; the serialized key is copied on the way in and on the way out.
 */
public final class KeyEntry {

    private static final byte[] EMPTY = new byte[0];

    private final int _keyId;
    private final String _typeId;
    private final byte[] _serializedKey;
    private final KeyMaterialClass _materialClass;
    private final KeyStatus _status;
    private final OutputPrefixKind _outputPrefixKind;

    private KeyEntry(Builder builder) {
        _keyId = builder._keyId;
        _typeId = builder._typeId;
        _serializedKey = builder._serializedKey;
        _materialClass = builder._materialClass;
        _status = builder._status;
        _outputPrefixKind = builder._outputPrefixKind;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return the key id; an unsigned 32-bit value stored in an int
     */
    public int keyId() {
        return _keyId;
    }

    public String typeId() {
        return _typeId;
    }

    public byte[] serializedKey() {
        return _serializedKey.clone();
    }

    public boolean hasKeyMaterial() {
        return _serializedKey.length > 0;
    }

    public KeyMaterialClass materialClass() {
        return _materialClass;
    }

    public KeyStatus status() {
        return _status;
    }

    public OutputPrefixKind outputPrefixKind() {
        return _outputPrefixKind;
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    @Override
    public String toString() {
        // never include the serialized key
        return "KeyEntry{keyId=" + Integer.toUnsignedString(_keyId)
                + ", typeId=" + _typeId
                + ", materialClass=" + _materialClass
                + ", status=" + _status
                + ", outputPrefixKind=" + _outputPrefixKind + "}";
    }

    public static class Builder {
        private int _keyId;
        private String _typeId;
        private byte[] _serializedKey = EMPTY;
        private KeyMaterialClass _materialClass;
        private KeyStatus _status;
        private OutputPrefixKind _outputPrefixKind;

        private Builder() {
        }

        private Builder(KeyEntry entry) {
            _keyId = entry._keyId;
            _typeId = entry._typeId;
            _serializedKey = entry._serializedKey;
            _materialClass = entry._materialClass;
            _status = entry._status;
            _outputPrefixKind = entry._outputPrefixKind;
        }

        public Builder keyId(int keyId) {
            _keyId = keyId;
            return this;
        }

        public Builder typeId(String typeId) {
            _typeId = typeId;
            return this;
        }

        public Builder serializedKey(byte[] serializedKey) {
            _serializedKey = serializedKey == null ? EMPTY : serializedKey.clone();
            return this;
        }

        public Builder materialClass(KeyMaterialClass materialClass) {
            _materialClass = materialClass;
            return this;
        }

        public Builder status(KeyStatus status) {
            _status = status;
            return this;
        }

        public Builder outputPrefixKind(OutputPrefixKind outputPrefixKind) {
            _outputPrefixKind = outputPrefixKind;
            return this;
        }

        public KeyEntry build() {
            if (_typeId == null || _typeId.isEmpty()) {
                throw new InvalidKeyMaterialException("Key " + Integer.toUnsignedString(_keyId) + " has no type id");
            }
            if (_materialClass == null) {
                throw new InvalidKeyMaterialException("Key " + Integer.toUnsignedString(_keyId) + " has no material class");
            }
            if (_status == null) {
                throw new InvalidKeyMaterialException("Key " + Integer.toUnsignedString(_keyId) + " has no status");
            }
            if (_outputPrefixKind == null) {
                throw new InvalidKeyMaterialException("Key " + Integer.toUnsignedString(_keyId) + " has no output prefix kind");
            }
            return new KeyEntry(this);
        }
    }
}
