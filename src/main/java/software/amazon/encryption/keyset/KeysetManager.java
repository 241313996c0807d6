// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.keyset;

import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import software.amazon.encryption.keyset.model.KeyEntry;
import software.amazon.encryption.keyset.model.KeyStatus;
import software.amazon.encryption.keyset.model.KeyTemplate;
import software.amazon.encryption.keyset.model.Keyset;
import software.amazon.encryption.keyset.model.OutputPrefixKind;
import software.amazon.encryption.keyset.registry.KeyManager;
import software.amazon.encryption.keyset.registry.Registry;

/**
 * Mutable owner of a keyset under construction. Every operation either leaves the manager in a new
 * consistent state or fails with nothing changed. Snapshots are taken with {@link #keyset()} or
 * {@link #keysetHandle()}.
 * <p>
 * A manager may be empty or have no primary while keys are being added; snapshots of such a
 * keyset are rejected.
 */
public final class KeysetManager {

    private static final Log LOG = LogFactory.getLog(KeysetManager.class);

    private final SecureRandom _secureRandom;
    private List<KeyEntry> _keys;
    private Integer _primaryKeyId;

    private KeysetManager(Builder builder) {
        _secureRandom = builder._secureRandom;
        if (builder._keyset != null) {
            _keys = Collections.unmodifiableList(new ArrayList<>(builder._keyset.keys()));
            _primaryKeyId = builder._keyset.primaryKeyId();
        } else {
            _keys = Collections.emptyList();
            _primaryKeyId = null;
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static KeysetManager withEmptyKeyset() {
        return builder().build();
    }

    public static KeysetManager withKeysetHandle(KeysetHandle handle) {
        if (handle == null) {
            throw new KeysetException("Keyset handle cannot be null!");
        }
        return builder().keyset(handle.keyset()).build();
    }

    /**
     * Generates a new key from the template and appends it as {@link KeyStatus#ENABLED}.
     *
     * @return the new key id
     */
    public synchronized int add(KeyTemplate template) {
        if (template == null) {
            throw new KeysetException("Key template cannot be null!");
        }
        return add(template.typeId(), template.serializedFormat(), template.outputPrefixKind());
    }

    /**
     * Generates a new key of the given type and appends it as {@link KeyStatus#ENABLED}.
     *
     * @return the new key id
     */
    public synchronized int add(String typeId, byte[] serializedFormat, OutputPrefixKind outputPrefixKind) {
        KeyEntry entry = newKey(typeId, serializedFormat, outputPrefixKind);
        List<KeyEntry> updated = new ArrayList<>(_keys);
        updated.add(entry);
        _keys = Collections.unmodifiableList(updated);
        LOG.debug("Added key " + Integer.toUnsignedString(entry.keyId()) + " of type " + typeId);
        return entry.keyId();
    }

    /**
     * Adds a new key and makes it the primary.
     *
     * @return the new key id
     */
    public synchronized int rotate(KeyTemplate template) {
        if (template == null) {
            throw new KeysetException("Key template cannot be null!");
        }
        return rotate(template.typeId(), template.serializedFormat(), template.outputPrefixKind());
    }

    public synchronized int rotate(String typeId, byte[] serializedFormat, OutputPrefixKind outputPrefixKind) {
        int keyId = add(typeId, serializedFormat, outputPrefixKind);
        _primaryKeyId = keyId;
        LOG.debug("Rotated primary key to " + Integer.toUnsignedString(keyId));
        return keyId;
    }

    /**
     * @throws KeyNotFoundException if the key does not exist
     * @throws InvalidKeysetStateException if the key is not enabled
     */
    public synchronized void setPrimary(int keyId) {
        KeyEntry entry = find(keyId);
        if (entry.status() != KeyStatus.ENABLED) {
            throw new InvalidKeysetStateException("Cannot make key " + Integer.toUnsignedString(keyId)
                    + " primary, its status is " + entry.status());
        }
        _primaryKeyId = keyId;
        LOG.debug("Set primary key to " + Integer.toUnsignedString(keyId));
    }

    /**
     * @throws InvalidKeysetStateException if the key is destroyed
     */
    public synchronized void enable(int keyId) {
        KeyEntry entry = find(keyId);
        if (entry.status() == KeyStatus.DESTROYED) {
            throw new InvalidKeysetStateException("Cannot enable destroyed key " + Integer.toUnsignedString(keyId));
        }
        replace(entry.toBuilder().status(KeyStatus.ENABLED).build());
    }

    /**
     * @throws InvalidKeysetStateException if the key is the primary or destroyed
     */
    public synchronized void disable(int keyId) {
        KeyEntry entry = find(keyId);
        rejectPrimary(keyId, "disable");
        if (entry.status() == KeyStatus.DESTROYED) {
            throw new InvalidKeysetStateException("Cannot disable destroyed key " + Integer.toUnsignedString(keyId));
        }
        replace(entry.toBuilder().status(KeyStatus.DISABLED).build());
    }

    /**
     * Wipes the key material and marks the key {@link KeyStatus#DESTROYED}. The id and metadata stay in the
     * keyset. Destroying a destroyed key does nothing.
     *
     * @throws InvalidKeysetStateException if the key is the primary
     */
    public synchronized void destroy(int keyId) {
        KeyEntry entry = find(keyId);
        rejectPrimary(keyId, "destroy");
        if (entry.status() == KeyStatus.DESTROYED) {
            return;
        }
        replace(entry.toBuilder().status(KeyStatus.DESTROYED).serializedKey(null).build());
        LOG.debug("Destroyed key " + Integer.toUnsignedString(keyId));
    }

    /**
     * Removes the key from the keyset entirely.
     *
     * @throws InvalidKeysetStateException if the key is the primary
     */
    public synchronized void delete(int keyId) {
        KeyEntry entry = find(keyId);
        rejectPrimary(keyId, "delete");
        List<KeyEntry> updated = new ArrayList<>(_keys);
        updated.remove(entry);
        _keys = Collections.unmodifiableList(updated);
        LOG.debug("Deleted key " + Integer.toUnsignedString(keyId));
    }

    /**
     * @return a validated snapshot of the current keyset
     * @throws InvalidKeysetStateException if the keyset is empty or has no primary
     */
    public synchronized Keyset keyset() {
        if (_keys.isEmpty()) {
            throw new InvalidKeysetStateException("Keyset is empty");
        }
        if (_primaryKeyId == null) {
            throw new InvalidKeysetStateException("Keyset has no primary key");
        }
        return Keyset.builder()
                .primaryKeyId(_primaryKeyId)
                .keys(_keys)
                .build();
    }

    public synchronized KeysetHandle keysetHandle() {
        return new KeysetHandle(keyset());
    }

    private KeyEntry newKey(String typeId, byte[] serializedFormat, OutputPrefixKind outputPrefixKind) {
        if (outputPrefixKind == null) {
            throw new KeysetException("Output prefix kind cannot be null!");
        }
        KeyManager<?> keyManager = Registry.lookup(typeId);
        byte[] serializedKey = Registry.generateNewKey(typeId, serializedFormat);
        try {
            return KeyEntry.builder()
                    .keyId(newKeyId())
                    .typeId(typeId)
                    .serializedKey(serializedKey)
                    .materialClass(keyManager.materialClass())
                    .status(KeyStatus.ENABLED)
                    .outputPrefixKind(outputPrefixKind)
                    .build();
        } finally {
            Arrays.fill(serializedKey, (byte) 0);
        }
    }

    private int newKeyId() {
        int keyId = _secureRandom.nextInt();
        while (keyId == 0 || contains(keyId)) {
            keyId = _secureRandom.nextInt();
        }
        return keyId;
    }

    private boolean contains(int keyId) {
        for (KeyEntry key : _keys) {
            if (key.keyId() == keyId) {
                return true;
            }
        }
        return false;
    }

    private KeyEntry find(int keyId) {
        for (KeyEntry key : _keys) {
            if (key.keyId() == keyId) {
                return key;
            }
        }
        throw new KeyNotFoundException("Key " + Integer.toUnsignedString(keyId) + " is not in the keyset");
    }

    private void rejectPrimary(int keyId, String operation) {
        if (_primaryKeyId != null && _primaryKeyId == keyId) {
            throw new InvalidKeysetStateException("Cannot " + operation + " the primary key "
                    + Integer.toUnsignedString(keyId));
        }
    }

    private void replace(KeyEntry entry) {
        List<KeyEntry> updated = new ArrayList<>(_keys.size());
        for (KeyEntry key : _keys) {
            updated.add(key.keyId() == entry.keyId() ? entry : key);
        }
        _keys = Collections.unmodifiableList(updated);
    }

    public static class Builder {
        private Keyset _keyset;
        private SecureRandom _secureRandom;

        private Builder() {
        }

        /**
         * Starts from an existing keyset instead of an empty one.
         */
        public Builder keyset(Keyset keyset) {
            _keyset = keyset;
            return this;
        }

        /**
         * Note that this does NOT create a defensive copy of the SecureRandom object. Any modifications to the
         * object will be reflected in this Builder.
         */
        @SuppressFBWarnings(value = "EI_EXPOSE_REP2")
        public Builder secureRandom(SecureRandom secureRandom) {
            if (secureRandom == null) {
                throw new KeysetException("SecureRandom provided to KeysetManager cannot be null");
            }
            _secureRandom = secureRandom;
            return this;
        }

        public KeysetManager build() {
            if (_secureRandom == null) {
                _secureRandom = new SecureRandom();
            }
            return new KeysetManager(this);
        }
    }
}
