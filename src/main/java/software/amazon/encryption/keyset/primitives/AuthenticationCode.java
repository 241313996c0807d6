// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.keyset.primitives;

import java.security.GeneralSecurityException;

/**
 * Message authentication code.
 */
public interface AuthenticationCode {

    byte[] computeMac(byte[] data) throws GeneralSecurityException;

    /**
     * @throws GeneralSecurityException if {@code mac} is not a valid MAC of {@code data}
     */
    void verifyMac(byte[] mac, byte[] data) throws GeneralSecurityException;
}
