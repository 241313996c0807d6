// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.keyset.registry;

import software.amazon.encryption.keyset.internal.PrimitiveSet;

/**
 * Combines the primitives of a {@link PrimitiveSet} into a single primitive of the same type that
 * produces with the primary key and consumes with any enabled key.
 *
 * @param <P> the primitive being wrapped
 */
public interface PrimitiveWrapper<P> {

    Class<P> primitiveClass();

    P wrap(PrimitiveSet<P> primitives);
}
