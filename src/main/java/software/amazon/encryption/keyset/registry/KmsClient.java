// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.keyset.registry;

import java.security.GeneralSecurityException;

import software.amazon.encryption.keyset.primitives.Aead;

/**
 * A client for a key management service that holds keys remotely and exposes them as {@link Aead}.
 * Clients are registered with the {@link Registry} and looked up by key URI when a keyset contains
 * {@link software.amazon.encryption.keyset.model.KeyMaterialClass#REMOTE} keys.
 */
public interface KmsClient {

    /**
     * @return true if this client can serve the key identified by {@code keyUri}
     */
    boolean supports(String keyUri);

    Aead getAead(String keyUri) throws GeneralSecurityException;
}
