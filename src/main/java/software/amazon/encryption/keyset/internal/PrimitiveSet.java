// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.keyset.internal;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

import software.amazon.encryption.keyset.InvalidKeysetStateException;
import software.amazon.encryption.keyset.KeysetException;
import software.amazon.encryption.keyset.PrimitiveInstantiationException;
import software.amazon.encryption.keyset.model.KeyEntry;
import software.amazon.encryption.keyset.model.KeyStatus;
import software.amazon.encryption.keyset.model.Keyset;
import software.amazon.encryption.keyset.model.OutputPrefixKind;
import software.amazon.encryption.keyset.registry.Registry;

/**
 * The primitives of a keyset, resolved once through the {@link Registry} and indexed by output prefix.
 * <p>
 * A primitive set is read-only after construction and can be shared between threads. Entries with
 * the same prefix keep keyset order, and that order is the order candidates are tried in.
 *
 * @param <P> the primitive type
 */
public final class PrimitiveSet<P> {

    private static final Log LOG = LogFactory.getLog(PrimitiveSet.class);
    private static final String RAW_LOOKUP_KEY = "";

    private final Class<P> _primitiveClass;
    private final List<Entry<P>> _entries;
    private final Map<String, List<Entry<P>>> _entriesByPrefix;
    private final Entry<P> _primary;

    private PrimitiveSet(Class<P> primitiveClass, List<Entry<P>> entries, Entry<P> primary) {
        _primitiveClass = primitiveClass;
        _entries = Collections.unmodifiableList(entries);
        Map<String, List<Entry<P>>> byPrefix = new LinkedHashMap<>();
        for (Entry<P> entry : entries) {
            byPrefix.computeIfAbsent(OutputPrefix.lookupKey(entry._outputPrefix), k -> new ArrayList<>()).add(entry);
        }
        for (Map.Entry<String, List<Entry<P>>> group : byPrefix.entrySet()) {
            group.setValue(Collections.unmodifiableList(group.getValue()));
        }
        _entriesByPrefix = Collections.unmodifiableMap(byPrefix);
        _primary = primary;
    }

    /**
     * Builds a primitive set from the enabled keys of a keyset.
     */
    public static <P> PrimitiveSet<P> fromKeyset(Keyset keyset, Class<P> primitiveClass) {
        return builder(primitiveClass).keyset(keyset).build();
    }

    public static <P> Builder<P> builder(Class<P> primitiveClass) {
        return new Builder<>(primitiveClass);
    }

    public Class<P> primitiveClass() {
        return _primitiveClass;
    }

    public Entry<P> primary() {
        return _primary;
    }

    /**
     * @return every entry in keyset order
     */
    public List<Entry<P>> entries() {
        return _entries;
    }

    public List<Entry<P>> entriesForPrefix(byte[] prefix) {
        List<Entry<P>> entries = _entriesByPrefix.get(OutputPrefix.lookupKey(prefix));
        return entries == null ? Collections.emptyList() : entries;
    }

    public List<Entry<P>> rawEntries() {
        List<Entry<P>> entries = _entriesByPrefix.get(RAW_LOOKUP_KEY);
        return entries == null ? Collections.emptyList() : entries;
    }

    /**
     * Lists the entries that may have produced {@code data}: first the entries whose 5-byte prefix
     * matches the start of the data, then every RAW entry.
     */
    public List<Entry<P>> candidates(byte[] data) {
        List<Entry<P>> candidates = new ArrayList<>();
        if (OutputPrefix.mayHaveNonRawPrefix(data)) {
            candidates.addAll(entriesForPrefix(OutputPrefix.candidatePrefix(data)));
        }
        candidates.addAll(rawEntries());
        return candidates;
    }

    /**
     * A primitive together with the metadata of the key it was built from.
     */
    public static final class Entry<P> {
        private final P _primitive;
        private final int _keyId;
        private final String _typeId;
        private final KeyStatus _status;
        private final OutputPrefixKind _outputPrefixKind;
        private final byte[] _outputPrefix;

        private Entry(P primitive, KeyEntry key) {
            _primitive = primitive;
            _keyId = key.keyId();
            _typeId = key.typeId();
            _status = key.status();
            _outputPrefixKind = key.outputPrefixKind();
            _outputPrefix = OutputPrefix.of(key.keyId(), key.outputPrefixKind());
        }

        public P primitive() {
            return _primitive;
        }

        public int keyId() {
            return _keyId;
        }

        public String typeId() {
            return _typeId;
        }

        public KeyStatus status() {
            return _status;
        }

        public OutputPrefixKind outputPrefixKind() {
            return _outputPrefixKind;
        }

        public byte[] outputPrefix() {
            return _outputPrefix.clone();
        }

        public int prefixLength() {
            return _outputPrefix.length;
        }
    }

    public static class Builder<P> {
        private final Class<P> _primitiveClass;
        private Keyset _keyset;
        private boolean _includeDisabledKeys = false;

        private Builder(Class<P> primitiveClass) {
            if (primitiveClass == null) {
                throw new KeysetException("Primitive class cannot be null!");
            }
            _primitiveClass = primitiveClass;
        }

        public Builder<P> keyset(Keyset keyset) {
            if (keyset == null) {
                throw new KeysetException("Keyset cannot be null!");
            }
            _keyset = keyset;
            return this;
        }

        /**
         * Disabled keys are left out by default. Including them is meant for inspection and
         * auditing; a primitive set with disabled keys must not back a dispatch wrapper.
         */
        public Builder<P> includeDisabledKeys(boolean includeDisabledKeys) {
            _includeDisabledKeys = includeDisabledKeys;
            return this;
        }

        public PrimitiveSet<P> build() {
            if (_keyset == null) {
                throw new KeysetException("Keyset cannot be null!");
            }
            List<Entry<P>> entries = new ArrayList<>();
            List<KeysetException> failures = new ArrayList<>();
            List<String> failedKeyIds = new ArrayList<>();
            Entry<P> primary = null;

            for (KeyEntry key : _keyset.keys()) {
                if (key.status() == KeyStatus.DESTROYED
                        || (key.status() == KeyStatus.DISABLED && !_includeDisabledKeys)) {
                    continue;
                }
                byte[] serializedKey = key.serializedKey();
                try {
                    P primitive = Registry.instantiate(key.typeId(), serializedKey, _primitiveClass);
                    Entry<P> entry = new Entry<>(primitive, key);
                    entries.add(entry);
                    if (key.keyId() == _keyset.primaryKeyId()) {
                        primary = entry;
                    }
                } catch (KeysetException e) {
                    failures.add(e);
                    failedKeyIds.add(Integer.toUnsignedString(key.keyId()));
                } finally {
                    Arrays.fill(serializedKey, (byte) 0);
                }
            }

            if (!failures.isEmpty()) {
                PrimitiveInstantiationException exception = new PrimitiveInstantiationException(
                        "Unable to instantiate keys " + failedKeyIds + " as " + _primitiveClass.getSimpleName(),
                        failures.get(0));
                for (int i = 1; i < failures.size(); i++) {
                    exception.addSuppressed(failures.get(i));
                }
                throw exception;
            }
            if (primary == null) {
                throw new InvalidKeysetStateException("Primary key " + Integer.toUnsignedString(_keyset.primaryKeyId())
                        + " is not usable as " + _primitiveClass.getSimpleName());
            }
            if (LOG.isDebugEnabled()) {
                LOG.debug("Built " + _primitiveClass.getSimpleName() + " primitive set with " + entries.size()
                        + " of " + _keyset.size() + " keys");
            }
            return new PrimitiveSet<>(_primitiveClass, entries, primary);
        }
    }
}
