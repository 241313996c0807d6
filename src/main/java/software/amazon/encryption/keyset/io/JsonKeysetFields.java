// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.keyset.io;

/**
 * Field names of the JSON keyset format.
 */
final class JsonKeysetFields {
    static final String PRIMARY_KEY_ID = "primaryKeyId";
    static final String KEY = "key";
    static final String KEY_DATA = "keyData";
    static final String TYPE_URL = "typeUrl";
    static final String VALUE = "value";
    static final String KEY_MATERIAL_TYPE = "keyMaterialType";
    static final String STATUS = "status";
    static final String KEY_ID = "keyId";
    static final String OUTPUT_PREFIX_TYPE = "outputPrefixType";
    static final String ENCRYPTED_KEYSET = "encryptedKeyset";
    static final String KEYSET_INFO = "keysetInfo";
    static final String KEY_INFO = "keyInfo";

    private JsonKeysetFields() {
    }
}
