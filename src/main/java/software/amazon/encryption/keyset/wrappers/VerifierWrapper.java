// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.keyset.wrappers;

import java.security.GeneralSecurityException;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

import software.amazon.encryption.keyset.AuthenticationFailureException;
import software.amazon.encryption.keyset.internal.OutputPrefix;
import software.amazon.encryption.keyset.internal.PrimitiveSet;
import software.amazon.encryption.keyset.primitives.Verifier;
import software.amazon.encryption.keyset.registry.PrimitiveWrapper;

/**
 * Wraps a primitive set of {@link Verifier} into one Verifier that accepts a signature made by any
 * enabled key of the keyset.
 */
public class VerifierWrapper implements PrimitiveWrapper<Verifier> {

    @Override
    public Class<Verifier> primitiveClass() {
        return Verifier.class;
    }

    @Override
    public Verifier wrap(PrimitiveSet<Verifier> primitives) {
        return new WrappedVerifier(primitives);
    }

    private static final class WrappedVerifier implements Verifier {
        private static final Log LOG = LogFactory.getLog(WrappedVerifier.class);

        private final PrimitiveSet<Verifier> _primitives;

        private WrappedVerifier(PrimitiveSet<Verifier> primitives) {
            _primitives = primitives;
        }

        @Override
        public void verify(byte[] signature, byte[] data) {
            if (signature == null || data == null) {
                throw new AuthenticationFailureException();
            }
            for (PrimitiveSet.Entry<Verifier> candidate : _primitives.candidates(signature)) {
                byte[] payload = OutputPrefix.strip(signature, candidate.prefixLength());
                try {
                    candidate.primitive().verify(payload, OutputPrefix.dataToAuthenticate(data, candidate.outputPrefixKind()));
                    return;
                } catch (GeneralSecurityException | RuntimeException e) {
                    if (LOG.isTraceEnabled()) {
                        LOG.trace("Key " + Integer.toUnsignedString(candidate.keyId()) + " did not verify the signature");
                    }
                }
            }
            throw new AuthenticationFailureException();
        }
    }
}
