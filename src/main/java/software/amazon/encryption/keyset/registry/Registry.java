// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.keyset.registry;

import java.security.GeneralSecurityException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

import software.amazon.encryption.keyset.InvalidKeyMaterialException;
import software.amazon.encryption.keyset.KeyNotFoundException;
import software.amazon.encryption.keyset.KeysetException;
import software.amazon.encryption.keyset.RegistryConflictException;
import software.amazon.encryption.keyset.internal.PrimitiveSet;

/**
 * Process-wide registry of key managers, primitive wrappers and KMS clients.
 * <p>
 * Writes are serialized on a single lock and publish fresh immutable maps; reads never lock.
 * Nothing is registered implicitly: call {@link software.amazon.encryption.keyset.KeysetConfig#register()}
 * (or register individual key managers) at startup, and {@link #reset()} to start over in tests.
 */
public final class Registry {

    private static final Log LOG = LogFactory.getLog(Registry.class);
    private static final Object WRITE_LOCK = new Object();

    private static volatile Map<String, KeyManager<?>> _keyManagers = Collections.emptyMap();
    private static volatile Map<Class<?>, PrimitiveWrapper<?>> _primitiveWrappers = Collections.emptyMap();
    private static volatile List<KmsClient> _kmsClients = Collections.emptyList();

    private Registry() {
    }

    /**
     * Registers a key manager under its type id. Registering a key manager that behaves exactly
     * like the one already registered (same implementation, material class and primitive) is a no-op.
     *
     * @throws RegistryConflictException if a different key manager is registered for the type id
     */
    public static void register(KeyManager<?> keyManager) {
        if (keyManager == null) {
            throw new KeysetException("Key manager cannot be null!");
        }
        final String typeId = keyManager.typeId();
        if (typeId == null || typeId.isEmpty()) {
            throw new KeysetException("Key manager type id cannot be empty or null");
        }
        synchronized (WRITE_LOCK) {
            KeyManager<?> existing = _keyManagers.get(typeId);
            if (existing != null) {
                if (isSameBehavior(existing, keyManager)) {
                    LOG.debug("Key manager for " + typeId + " is already registered");
                    return;
                }
                throw new RegistryConflictException("A different key manager is already registered for " + typeId
                        + ": " + existing.getClass().getName());
            }
            Map<String, KeyManager<?>> updated = new HashMap<>(_keyManagers);
            updated.put(typeId, keyManager);
            _keyManagers = Collections.unmodifiableMap(updated);
            LOG.debug("Registered key manager " + keyManager.getClass().getSimpleName() + " for " + typeId);
        }
    }

    private static boolean isSameBehavior(KeyManager<?> existing, KeyManager<?> candidate) {
        return existing.getClass().equals(candidate.getClass())
                && existing.materialClass() == candidate.materialClass()
                && existing.primitiveClass().equals(candidate.primitiveClass());
    }

    /**
     * @throws KeyNotFoundException if no key manager is registered for the type id
     */
    public static KeyManager<?> lookup(String typeId) {
        KeyManager<?> keyManager = _keyManagers.get(typeId);
        if (keyManager == null) {
            throw new KeyNotFoundException("No key manager registered for type id " + typeId);
        }
        return keyManager;
    }

    /**
     * @throws KeyNotFoundException if no key manager is registered for the type id
     * @throws InvalidKeyMaterialException if the key manager produces a different primitive
     */
    @SuppressWarnings("unchecked")
    public static <P> KeyManager<P> lookup(String typeId, Class<P> primitiveClass) {
        KeyManager<?> keyManager = lookup(typeId);
        if (!keyManager.primitiveClass().equals(primitiveClass)) {
            throw new InvalidKeyMaterialException("Key type " + typeId + " produces "
                    + keyManager.primitiveClass().getSimpleName() + ", not " + primitiveClass.getSimpleName());
        }
        return (KeyManager<P>) keyManager;
    }

    /**
     * Instantiates a primitive from a serialized key of the given type.
     *
     * @throws InvalidKeyMaterialException if the key manager rejects the serialized key
     */
    public static <P> P instantiate(String typeId, byte[] serializedKey, Class<P> primitiveClass) {
        KeyManager<P> keyManager = lookup(typeId, primitiveClass);
        try {
            return keyManager.primitive(serializedKey);
        } catch (GeneralSecurityException e) {
            throw new InvalidKeyMaterialException("Key type " + typeId + " rejected the serialized key: " + e.getMessage(), e);
        }
    }

    /**
     * Generates a new serialized key of the given type.
     *
     * @throws InvalidKeyMaterialException if the key manager rejects the serialized key format
     */
    public static byte[] generateNewKey(String typeId, byte[] serializedFormat) {
        KeyManager<?> keyManager = lookup(typeId);
        try {
            return keyManager.newKey(serializedFormat);
        } catch (GeneralSecurityException e) {
            throw new InvalidKeyMaterialException("Key type " + typeId + " rejected the key format: " + e.getMessage(), e);
        }
    }

    /**
     * @throws InvalidKeyMaterialException if the type does not hold private keys or the key is malformed
     */
    public static PrivateKeyManager<?> privateKeyManager(String typeId) {
        KeyManager<?> keyManager = lookup(typeId);
        if (!keyManager.supportsPrivateKeys() || !(keyManager instanceof PrivateKeyManager)) {
            throw new InvalidKeyMaterialException("Key type " + typeId + " does not hold private keys");
        }
        return (PrivateKeyManager<?>) keyManager;
    }

    /**
     * Derives the serialized public key from a serialized private key.
     */
    public static byte[] publicKey(String typeId, byte[] serializedPrivateKey) {
        PrivateKeyManager<?> keyManager = privateKeyManager(typeId);
        try {
            return keyManager.publicKey(serializedPrivateKey);
        } catch (GeneralSecurityException e) {
            throw new InvalidKeyMaterialException("Key type " + typeId + " rejected the private key: " + e.getMessage(), e);
        }
    }

    /**
     * Registers the wrapper used to combine primitive sets of its primitive class. Registering
     * a wrapper of the same implementation again is a no-op.
     */
    public static void registerPrimitiveWrapper(PrimitiveWrapper<?> wrapper) {
        if (wrapper == null) {
            throw new KeysetException("Primitive wrapper cannot be null!");
        }
        synchronized (WRITE_LOCK) {
            PrimitiveWrapper<?> existing = _primitiveWrappers.get(wrapper.primitiveClass());
            if (existing != null) {
                if (existing.getClass().equals(wrapper.getClass())) {
                    return;
                }
                throw new RegistryConflictException("A different primitive wrapper is already registered for "
                        + wrapper.primitiveClass().getName());
            }
            Map<Class<?>, PrimitiveWrapper<?>> updated = new HashMap<>(_primitiveWrappers);
            updated.put(wrapper.primitiveClass(), wrapper);
            _primitiveWrappers = Collections.unmodifiableMap(updated);
        }
    }

    /**
     * Wraps a primitive set into a single primitive using the registered wrapper.
     *
     * @throws KeyNotFoundException if no wrapper is registered for the primitive class
     */
    @SuppressWarnings("unchecked")
    public static <P> P wrap(PrimitiveSet<P> primitives) {
        PrimitiveWrapper<P> wrapper = (PrimitiveWrapper<P>) _primitiveWrappers.get(primitives.primitiveClass());
        if (wrapper == null) {
            throw new KeyNotFoundException("No primitive wrapper registered for " + primitives.primitiveClass().getName());
        }
        return wrapper.wrap(primitives);
    }

    /**
     * Adds a KMS client. Clients are consulted in registration order.
     */
    public static void registerKmsClient(KmsClient kmsClient) {
        if (kmsClient == null) {
            throw new KeysetException("KMS client cannot be null!");
        }
        synchronized (WRITE_LOCK) {
            List<KmsClient> updated = new ArrayList<>(_kmsClients);
            updated.add(kmsClient);
            _kmsClients = Collections.unmodifiableList(updated);
        }
    }

    /**
     * @return the first registered KMS client supporting the key URI
     * @throws KeyNotFoundException if no registered client supports the key URI
     */
    public static KmsClient kmsClient(String keyUri) {
        for (KmsClient client : _kmsClients) {
            if (client.supports(keyUri)) {
                return client;
            }
        }
        throw new KeyNotFoundException("No KMS client supports the key URI " + keyUri);
    }

    /**
     * Removes every key manager, primitive wrapper and KMS client.
     */
    public static void reset() {
        synchronized (WRITE_LOCK) {
            _keyManagers = Collections.emptyMap();
            _primitiveWrappers = Collections.emptyMap();
            _kmsClients = Collections.emptyList();
        }
    }
}
