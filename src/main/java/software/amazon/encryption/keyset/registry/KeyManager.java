// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.keyset.registry;

import java.security.GeneralSecurityException;

import software.amazon.encryption.keyset.model.KeyMaterialClass;

/**
 * A KeyManager knows how to turn serialized keys of one type into primitives and how to generate
 * new serialized keys of that type. Key managers are registered with the {@link Registry} under
 * their {@link #typeId()}.
 * <p>
 * Serialized keys and key formats are opaque to everything but the key manager that owns the type.
 * Implementations must not echo key bytes in exception messages, and must not retain the arrays
 * passed to them: callers zero those arrays once the call returns.
 *
 * @param <P> the primitive this key manager produces
 */
public interface KeyManager<P> {

    String typeId();

    Class<P> primitiveClass();

    KeyMaterialClass materialClass();

    /**
     * Creates a primitive from a serialized key.
     *
     * @throws GeneralSecurityException if the key is malformed or uses unsupported parameters
     */
    P primitive(byte[] serializedKey) throws GeneralSecurityException;

    /**
     * Generates a new serialized key according to a serialized key format.
     *
     * @throws GeneralSecurityException if the format is malformed or uses unsupported parameters
     */
    byte[] newKey(byte[] serializedKeyFormat) throws GeneralSecurityException;

    default boolean supportsPrivateKeys() {
        return false;
    }
}
