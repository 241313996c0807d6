// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.keyset.primitives;

import java.security.GeneralSecurityException;

/**
 * Verifies digital signatures with a public key.
 */
public interface Verifier {

    /**
     * @throws GeneralSecurityException if {@code signature} is not a valid signature of {@code data}
     */
    void verify(byte[] signature, byte[] data) throws GeneralSecurityException;
}
