// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.keyset.wrappers;

import java.security.GeneralSecurityException;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

import software.amazon.encryption.keyset.AuthenticationFailureException;
import software.amazon.encryption.keyset.internal.OutputPrefix;
import software.amazon.encryption.keyset.internal.PrimitiveSet;
import software.amazon.encryption.keyset.primitives.AuthenticationCode;
import software.amazon.encryption.keyset.registry.PrimitiveWrapper;

/**
 * Wraps a primitive set of {@link AuthenticationCode} into one AuthenticationCode.
 * For LEGACY keys the MAC covers the data followed by a single zero byte.
 */
public class AuthenticationCodeWrapper implements PrimitiveWrapper<AuthenticationCode> {

    @Override
    public Class<AuthenticationCode> primitiveClass() {
        return AuthenticationCode.class;
    }

    @Override
    public AuthenticationCode wrap(PrimitiveSet<AuthenticationCode> primitives) {
        return new WrappedAuthenticationCode(primitives);
    }

    private static final class WrappedAuthenticationCode implements AuthenticationCode {
        private static final Log LOG = LogFactory.getLog(WrappedAuthenticationCode.class);

        private final PrimitiveSet<AuthenticationCode> _primitives;

        private WrappedAuthenticationCode(PrimitiveSet<AuthenticationCode> primitives) {
            _primitives = primitives;
        }

        @Override
        public byte[] computeMac(byte[] data) throws GeneralSecurityException {
            PrimitiveSet.Entry<AuthenticationCode> primary = _primitives.primary();
            byte[] mac = primary.primitive().computeMac(OutputPrefix.dataToAuthenticate(data, primary.outputPrefixKind()));
            return OutputPrefix.concat(primary.outputPrefix(), mac);
        }

        @Override
        public void verifyMac(byte[] mac, byte[] data) {
            if (mac == null || data == null) {
                throw new AuthenticationFailureException();
            }
            for (PrimitiveSet.Entry<AuthenticationCode> candidate : _primitives.candidates(mac)) {
                byte[] payload = OutputPrefix.strip(mac, candidate.prefixLength());
                try {
                    candidate.primitive().verifyMac(payload, OutputPrefix.dataToAuthenticate(data, candidate.outputPrefixKind()));
                    return;
                } catch (GeneralSecurityException | RuntimeException e) {
                    if (LOG.isTraceEnabled()) {
                        LOG.trace("Key " + Integer.toUnsignedString(candidate.keyId()) + " did not verify the MAC");
                    }
                }
            }
            throw new AuthenticationFailureException();
        }
    }
}
