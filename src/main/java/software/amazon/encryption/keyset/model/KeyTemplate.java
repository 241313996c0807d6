// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.keyset.model;

import software.amazon.encryption.keyset.InvalidKeyMaterialException;

/**
 * Describes how to generate a new key: the key type, the serialized key format handed to the key
 * manager of that type, and the output prefix kind of the resulting key.
 */
public final class KeyTemplate {

    private final String _typeId;
    private final byte[] _serializedFormat;
    private final OutputPrefixKind _outputPrefixKind;

    private KeyTemplate(String typeId, byte[] serializedFormat, OutputPrefixKind outputPrefixKind) {
        _typeId = typeId;
        _serializedFormat = serializedFormat;
        _outputPrefixKind = outputPrefixKind;
    }

    public static KeyTemplate create(String typeId, byte[] serializedFormat, OutputPrefixKind outputPrefixKind) {
        if (typeId == null || typeId.isEmpty()) {
            throw new InvalidKeyMaterialException("Key template type id cannot be empty or null");
        }
        if (outputPrefixKind == null) {
            throw new InvalidKeyMaterialException("Key template output prefix kind cannot be null");
        }
        return new KeyTemplate(typeId,
                serializedFormat == null ? new byte[0] : serializedFormat.clone(),
                outputPrefixKind);
    }

    public String typeId() {
        return _typeId;
    }

    public byte[] serializedFormat() {
        return _serializedFormat.clone();
    }

    public OutputPrefixKind outputPrefixKind() {
        return _outputPrefixKind;
    }

    /**
     * @return a copy of this template producing keys with a different output prefix kind
     */
    public KeyTemplate withOutputPrefixKind(OutputPrefixKind outputPrefixKind) {
        return create(_typeId, _serializedFormat, outputPrefixKind);
    }

    @Override
    public String toString() {
        return "KeyTemplate{typeId=" + _typeId + ", outputPrefixKind=" + _outputPrefixKind + "}";
    }
}
