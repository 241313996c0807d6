// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.keyset.kms;

import java.security.GeneralSecurityException;
import java.util.HashMap;
import java.util.Map;

import software.amazon.encryption.keyset.algorithms.AesGcmKeyManager;
import software.amazon.encryption.keyset.primitives.Aead;
import software.amazon.encryption.keyset.registry.KmsClient;

/**
 * In-memory KMS: each key URI maps to a local AES-256-GCM key created on first use.
 */
public class FakeKmsClient implements KmsClient {

    public static final String PREFIX = "fake-kms://";

    private final AesGcmKeyManager _keyManager = new AesGcmKeyManager();
    private final Map<String, Aead> _aeads = new HashMap<>();

    @Override
    public boolean supports(String keyUri) {
        return keyUri != null && keyUri.startsWith(PREFIX);
    }

    @Override
    public synchronized Aead getAead(String keyUri) throws GeneralSecurityException {
        if (!supports(keyUri)) {
            throw new GeneralSecurityException("Unsupported key URI " + keyUri);
        }
        Aead aead = _aeads.get(keyUri);
        if (aead == null) {
            aead = _keyManager.primitive(_keyManager.newKey(AesGcmKeyManager.keyFormat(32)));
            _aeads.put(keyUri, aead);
        }
        return aead;
    }
}
