// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.keyset.registry;

import java.security.GeneralSecurityException;

/**
 * A {@link KeyManager} for private keys, able to derive the matching public key.
 *
 * @param <P> the primitive this key manager produces
 */
public interface PrivateKeyManager<P> extends KeyManager<P> {

    /**
     * @return the type id of the public keys derived by {@link #publicKey(byte[])}
     */
    String publicKeyTypeId();

    /**
     * Extracts the serialized public key from a serialized private key.
     */
    byte[] publicKey(byte[] serializedPrivateKey) throws GeneralSecurityException;

    @Override
    default boolean supportsPrivateKeys() {
        return true;
    }
}
