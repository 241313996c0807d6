// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.keyset.wrappers;

import java.security.GeneralSecurityException;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

import software.amazon.encryption.keyset.AuthenticationFailureException;
import software.amazon.encryption.keyset.internal.OutputPrefix;
import software.amazon.encryption.keyset.internal.PrimitiveSet;
import software.amazon.encryption.keyset.primitives.Aead;
import software.amazon.encryption.keyset.registry.PrimitiveWrapper;

/**
 * Wraps a primitive set of {@link Aead} into one Aead.
 * Encryption uses the primary key and prepends its output prefix; decryption tries every candidate
 * key for the ciphertext's prefix, then every RAW key, and returns the first plaintext that
 * authenticates. The associated data is passed to the underlying primitive unchanged for all
 * prefix kinds.
 */
public class AeadWrapper implements PrimitiveWrapper<Aead> {

    @Override
    public Class<Aead> primitiveClass() {
        return Aead.class;
    }

    @Override
    public Aead wrap(PrimitiveSet<Aead> primitives) {
        return new WrappedAead(primitives);
    }

    private static final class WrappedAead implements Aead {
        private static final Log LOG = LogFactory.getLog(WrappedAead.class);

        private final PrimitiveSet<Aead> _primitives;

        private WrappedAead(PrimitiveSet<Aead> primitives) {
            _primitives = primitives;
        }

        @Override
        public byte[] encrypt(byte[] plaintext, byte[] associatedData) throws GeneralSecurityException {
            PrimitiveSet.Entry<Aead> primary = _primitives.primary();
            byte[] ciphertext = primary.primitive().encrypt(plaintext, associatedData);
            return OutputPrefix.concat(primary.outputPrefix(), ciphertext);
        }

        @Override
        public byte[] decrypt(byte[] ciphertext, byte[] associatedData) {
            if (ciphertext == null) {
                throw new AuthenticationFailureException();
            }
            for (PrimitiveSet.Entry<Aead> candidate : _primitives.candidates(ciphertext)) {
                byte[] payload = OutputPrefix.strip(ciphertext, candidate.prefixLength());
                try {
                    return candidate.primitive().decrypt(payload, associatedData);
                } catch (GeneralSecurityException | RuntimeException e) {
                    if (LOG.isTraceEnabled()) {
                        LOG.trace("Key " + Integer.toUnsignedString(candidate.keyId()) + " did not decrypt the ciphertext");
                    }
                }
            }
            throw new AuthenticationFailureException();
        }
    }
}
