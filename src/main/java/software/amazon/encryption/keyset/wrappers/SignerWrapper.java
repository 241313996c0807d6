// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.keyset.wrappers;

import java.security.GeneralSecurityException;

import software.amazon.encryption.keyset.internal.OutputPrefix;
import software.amazon.encryption.keyset.internal.PrimitiveSet;
import software.amazon.encryption.keyset.primitives.Signer;
import software.amazon.encryption.keyset.registry.PrimitiveWrapper;

/**
 * Wraps a primitive set of {@link Signer} into one Signer that signs with the primary key.
 * For LEGACY keys the signature covers the data followed by a single zero byte.
 */
public class SignerWrapper implements PrimitiveWrapper<Signer> {

    @Override
    public Class<Signer> primitiveClass() {
        return Signer.class;
    }

    @Override
    public Signer wrap(PrimitiveSet<Signer> primitives) {
        return new WrappedSigner(primitives);
    }

    private static final class WrappedSigner implements Signer {
        private final PrimitiveSet<Signer> _primitives;

        private WrappedSigner(PrimitiveSet<Signer> primitives) {
            _primitives = primitives;
        }

        @Override
        public byte[] sign(byte[] data) throws GeneralSecurityException {
            PrimitiveSet.Entry<Signer> primary = _primitives.primary();
            byte[] signature = primary.primitive().sign(OutputPrefix.dataToAuthenticate(data, primary.outputPrefixKind()));
            return OutputPrefix.concat(primary.outputPrefix(), signature);
        }
    }
}
