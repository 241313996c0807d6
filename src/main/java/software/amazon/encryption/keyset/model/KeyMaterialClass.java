// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.keyset.model;

/**
 * The kind of material a serialized key holds.
 */
public enum KeyMaterialClass {
    SYMMETRIC(true),
    ASYMMETRIC_PRIVATE(true),
    ASYMMETRIC_PUBLIC(false),
    /**
     * Points to a key held by a key management service; the serialized key is only a reference.
     */
    REMOTE(false);

    private final boolean _secret;

    KeyMaterialClass(boolean secret) {
        _secret = secret;
    }

    /**
     * @return true if a serialized key of this class contains secret key material
     */
    public boolean isSecret() {
        return _secret;
    }
}
