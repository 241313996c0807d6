// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.keyset.model;

/**
 * Lifecycle status of a key within a keyset.
 */
public enum KeyStatus {
    /**
     * Usable for producing and consuming data.
     */
    ENABLED,
    /**
     * Kept in the keyset but not usable; can become {@link #ENABLED} again.
     */
    DISABLED,
    /**
     * Metadata only. The key material has been wiped and the key can never be used again.
     */
    DESTROYED
}
