// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.keyset.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import software.amazon.encryption.keyset.InvalidKeysetStateException;

/**
 * An ordered, immutable collection of {@link KeyEntry} instances plus the id of the primary key.
 * <p>
 * {@link Builder#build()} enforces the keyset invariants: at least one key, unique key ids, a primary
 * key that exists and is {@link KeyStatus#ENABLED}, and no key material left on destroyed keys.
 */
public final class Keyset {

    private final int _primaryKeyId;
    private final List<KeyEntry> _keys;

    private Keyset(Builder builder) {
        _primaryKeyId = builder._primaryKeyId;
        _keys = Collections.unmodifiableList(new ArrayList<>(builder._keys));
    }

    public static Builder builder() {
        return new Builder();
    }

    public int primaryKeyId() {
        return _primaryKeyId;
    }

    public List<KeyEntry> keys() {
        return _keys;
    }

    public int size() {
        return _keys.size();
    }

    /**
     * @return the key with the given id, or null if there is none
     */
    public KeyEntry key(int keyId) {
        for (KeyEntry entry : _keys) {
            if (entry.keyId() == keyId) {
                return entry;
            }
        }
        return null;
    }

    public KeyEntry primaryKey() {
        return key(_primaryKeyId);
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    @Override
    public String toString() {
        return KeysetInfo.of(this).toString();
    }

    public static class Builder {
        private Integer _primaryKeyId;
        private final List<KeyEntry> _keys = new ArrayList<>();

        private Builder() {
        }

        private Builder(Keyset keyset) {
            _primaryKeyId = keyset._primaryKeyId;
            _keys.addAll(keyset._keys);
        }

        public Builder primaryKeyId(int primaryKeyId) {
            _primaryKeyId = primaryKeyId;
            return this;
        }

        public Builder addKey(KeyEntry key) {
            _keys.add(key);
            return this;
        }

        public Builder keys(List<KeyEntry> keys) {
            _keys.clear();
            _keys.addAll(keys);
            return this;
        }

        public Keyset build() {
            if (_keys.isEmpty()) {
                throw new InvalidKeysetStateException("A keyset must contain at least one key");
            }
            if (_primaryKeyId == null) {
                throw new InvalidKeysetStateException("A keyset must have a primary key");
            }
            Set<Integer> keyIds = new HashSet<>();
            KeyEntry primary = null;
            for (KeyEntry key : _keys) {
                if (key == null) {
                    throw new InvalidKeysetStateException("A keyset cannot contain null keys");
                }
                if (!keyIds.add(key.keyId())) {
                    throw new InvalidKeysetStateException("Duplicate key id " + Integer.toUnsignedString(key.keyId()) + " in keyset");
                }
                if (key.status() == KeyStatus.DESTROYED && key.hasKeyMaterial()) {
                    throw new InvalidKeysetStateException("Destroyed key " + Integer.toUnsignedString(key.keyId()) + " still carries key material");
                }
                if (key.keyId() == _primaryKeyId) {
                    primary = key;
                }
            }
            if (primary == null) {
                throw new InvalidKeysetStateException("Primary key " + Integer.toUnsignedString(_primaryKeyId) + " is not in the keyset");
            }
            if (primary.status() != KeyStatus.ENABLED) {
                throw new InvalidKeysetStateException("Primary key " + Integer.toUnsignedString(_primaryKeyId) + " is " + primary.status() + ", expecting ENABLED");
            }
            return new Keyset(this);
        }
    }
}
