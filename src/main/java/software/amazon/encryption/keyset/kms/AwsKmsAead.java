// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.keyset.kms;

import java.security.GeneralSecurityException;
import java.util.Collections;
import java.util.Map;

import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.kms.KmsClient;
import software.amazon.awssdk.services.kms.model.DecryptRequest;
import software.amazon.awssdk.services.kms.model.DecryptResponse;
import software.amazon.awssdk.services.kms.model.EncryptRequest;
import software.amazon.awssdk.services.kms.model.EncryptResponse;
import software.amazon.awssdk.utils.BinaryUtils;
import software.amazon.encryption.keyset.internal.ApiNameVersion;
import software.amazon.encryption.keyset.primitives.Aead;

/**
 * An {@link Aead} backed by a key in AWS KMS. Every call is a KMS {@code Encrypt} or {@code Decrypt}
 * request; the associated data is bound through the encryption context.
 */
public final class AwsKmsAead implements Aead {

    static final String ASSOCIATED_DATA_CONTEXT_KEY = "associatedData";

    private final KmsClient _kmsClient;
    private final String _keyId;

    AwsKmsAead(KmsClient kmsClient, String keyId) {
        _kmsClient = kmsClient;
        _keyId = keyId;
    }

    @Override
    public byte[] encrypt(byte[] plaintext, byte[] associatedData) throws GeneralSecurityException {
        EncryptRequest request = EncryptRequest.builder()
                .keyId(_keyId)
                .plaintext(SdkBytes.fromByteArray(plaintext))
                .encryptionContext(encryptionContext(associatedData))
                .overrideConfiguration(ApiNameVersion.API_NAME_INTERCEPTOR)
                .build();
        try {
            EncryptResponse response = _kmsClient.encrypt(request);
            return response.ciphertextBlob().asByteArray();
        } catch (SdkException e) {
            throw new GeneralSecurityException("AWS KMS encryption failed", e);
        }
    }

    @Override
    public byte[] decrypt(byte[] ciphertext, byte[] associatedData) throws GeneralSecurityException {
        DecryptRequest request = DecryptRequest.builder()
                .keyId(_keyId)
                .ciphertextBlob(SdkBytes.fromByteArray(ciphertext))
                .encryptionContext(encryptionContext(associatedData))
                .overrideConfiguration(ApiNameVersion.API_NAME_INTERCEPTOR)
                .build();
        DecryptResponse response;
        try {
            response = _kmsClient.decrypt(request);
        } catch (SdkException e) {
            throw new GeneralSecurityException("AWS KMS decryption failed", e);
        }
        // KMS always answers with the key ARN, so only a configured ARN can be compared
        if (isKeyArn(_keyId) && response.keyId() != null && !_keyId.equals(response.keyId())) {
            throw new GeneralSecurityException("AWS KMS decrypted with an unexpected key");
        }
        return response.plaintext().asByteArray();
    }

    private static Map<String, String> encryptionContext(byte[] associatedData) {
        if (associatedData == null || associatedData.length == 0) {
            return Collections.emptyMap();
        }
        return Collections.singletonMap(ASSOCIATED_DATA_CONTEXT_KEY, BinaryUtils.toHex(associatedData));
    }

    private static boolean isKeyArn(String keyId) {
        return keyId.startsWith("arn:") && keyId.contains(":key/");
    }
}
