// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.keyset;

import software.amazon.encryption.keyset.algorithms.AesGcmKeyManager;
import software.amazon.encryption.keyset.algorithms.EcdsaSignKeyManager;
import software.amazon.encryption.keyset.algorithms.EcdsaVerifyKeyManager;
import software.amazon.encryption.keyset.algorithms.HmacKeyManager;
import software.amazon.encryption.keyset.kms.KmsAeadKeyManager;
import software.amazon.encryption.keyset.kms.KmsEnvelopeAeadKeyManager;
import software.amazon.encryption.keyset.registry.Registry;
import software.amazon.encryption.keyset.wrappers.AeadWrapper;
import software.amazon.encryption.keyset.wrappers.AuthenticationCodeWrapper;
import software.amazon.encryption.keyset.wrappers.SignerWrapper;
import software.amazon.encryption.keyset.wrappers.VerifierWrapper;

/**
 * Registers the built-in key managers and primitive wrappers. Safe to call more than once.
 * KMS clients are not registered here; add them with {@link Registry#registerKmsClient}.
 */
public final class KeysetConfig {

    private KeysetConfig() {
    }

    public static void register() {
        Registry.register(new AesGcmKeyManager());
        Registry.register(new HmacKeyManager());
        Registry.register(new EcdsaSignKeyManager());
        Registry.register(new EcdsaVerifyKeyManager());
        Registry.register(new KmsAeadKeyManager());
        Registry.register(new KmsEnvelopeAeadKeyManager());

        Registry.registerPrimitiveWrapper(new AeadWrapper());
        Registry.registerPrimitiveWrapper(new AuthenticationCodeWrapper());
        Registry.registerPrimitiveWrapper(new SignerWrapper());
        Registry.registerPrimitiveWrapper(new VerifierWrapper());
    }
}
