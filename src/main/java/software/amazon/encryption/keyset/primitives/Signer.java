// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.keyset.primitives;

import java.security.GeneralSecurityException;

/**
 * Produces digital signatures with a private key.
 */
public interface Signer {

    byte[] sign(byte[] data) throws GeneralSecurityException;
}
