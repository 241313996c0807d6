// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.keyset.internal;

import javax.crypto.Cipher;
import javax.crypto.KeyGenerator;
import javax.crypto.Mac;
import javax.crypto.NoSuchPaddingException;
import java.security.AlgorithmParameters;
import java.security.KeyFactory;
import java.security.KeyPairGenerator;
import java.security.NoSuchAlgorithmException;
import java.security.Provider;
import java.security.Signature;

/**
 * Creates JCE engines from the caller's provider, or from the default provider chain when the
 * provider is null.
 */
public class CryptoFactory {
    public static Cipher createCipher(String algorithm, Provider provider)
            throws NoSuchPaddingException, NoSuchAlgorithmException {
        // if the user has specified a provider, go with that.
        if (provider != null) {
            return Cipher.getInstance(algorithm, provider);
        }

        // Otherwise, go with the default provider.
        return Cipher.getInstance(algorithm);
    }

    public static Mac createMac(String algorithm, Provider provider) throws NoSuchAlgorithmException {
        if (provider != null) {
            return Mac.getInstance(algorithm, provider);
        }
        return Mac.getInstance(algorithm);
    }

    public static Signature createSignature(String algorithm, Provider provider) throws NoSuchAlgorithmException {
        if (provider != null) {
            return Signature.getInstance(algorithm, provider);
        }
        return Signature.getInstance(algorithm);
    }

    public static KeyGenerator createKeyGenerator(String algorithm, Provider provider) throws NoSuchAlgorithmException {
        if (provider != null) {
            return KeyGenerator.getInstance(algorithm, provider);
        }
        return KeyGenerator.getInstance(algorithm);
    }

    public static KeyPairGenerator createKeyPairGenerator(String algorithm, Provider provider) throws NoSuchAlgorithmException {
        if (provider != null) {
            return KeyPairGenerator.getInstance(algorithm, provider);
        }
        return KeyPairGenerator.getInstance(algorithm);
    }

    public static KeyFactory createKeyFactory(String algorithm, Provider provider) throws NoSuchAlgorithmException {
        if (provider != null) {
            return KeyFactory.getInstance(algorithm, provider);
        }
        return KeyFactory.getInstance(algorithm);
    }

    public static AlgorithmParameters createAlgorithmParameters(String algorithm, Provider provider)
            throws NoSuchAlgorithmException {
        if (provider != null) {
            return AlgorithmParameters.getInstance(algorithm, provider);
        }
        return AlgorithmParameters.getInstance(algorithm);
    }
}
