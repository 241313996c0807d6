// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.keyset.kms;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.Collections;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.kms.KmsClient;
import software.amazon.awssdk.services.kms.model.DecryptRequest;
import software.amazon.awssdk.services.kms.model.DecryptResponse;
import software.amazon.awssdk.services.kms.model.EncryptRequest;
import software.amazon.awssdk.services.kms.model.EncryptResponse;
import software.amazon.awssdk.utils.BinaryUtils;
import software.amazon.encryption.keyset.internal.ApiNameVersion;
import software.amazon.encryption.keyset.primitives.Aead;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class AwsKmsAeadTest {

    private static final String KEY_ARN = "arn:aws:kms:us-west-2:111122223333:key/1234abcd-12ab-34cd-56ef-1234567890ab";
    private static final String OTHER_KEY_ARN = "arn:aws:kms:us-west-2:111122223333:key/0987dcba-09fe-87dc-65ba-ab0987654321";
    private static final byte[] PLAINTEXT = "plaintext".getBytes(StandardCharsets.UTF_8);
    private static final byte[] CIPHERTEXT = "kms ciphertext blob".getBytes(StandardCharsets.UTF_8);
    private static final byte[] AAD = "aad".getBytes(StandardCharsets.UTF_8);

    private KmsClient kmsClient;

    @BeforeEach
    public void setUp() {
        kmsClient = mock(KmsClient.class);
    }

    private Aead aead(String keyId) throws GeneralSecurityException {
        return AwsKmsClient.builder().kmsClient(kmsClient).build().getAead(AwsKmsClient.PREFIX + keyId);
    }

    @Test
    public void encryptSendsAssociatedDataAsEncryptionContext() throws GeneralSecurityException {
        when(kmsClient.encrypt(any(EncryptRequest.class))).thenReturn(EncryptResponse.builder()
                .ciphertextBlob(SdkBytes.fromByteArray(CIPHERTEXT))
                .keyId(KEY_ARN)
                .build());

        assertArrayEquals(CIPHERTEXT, aead(KEY_ARN).encrypt(PLAINTEXT, AAD));

        ArgumentCaptor<EncryptRequest> captor = ArgumentCaptor.forClass(EncryptRequest.class);
        verify(kmsClient).encrypt(captor.capture());
        EncryptRequest request = captor.getValue();
        assertEquals(KEY_ARN, request.keyId());
        assertArrayEquals(PLAINTEXT, request.plaintext().asByteArray());
        assertEquals(Collections.singletonMap(AwsKmsAead.ASSOCIATED_DATA_CONTEXT_KEY, BinaryUtils.toHex(AAD)),
                request.encryptionContext());
        assertTrue(request.overrideConfiguration().isPresent());
        assertTrue(request.overrideConfiguration().get().apiNames().stream()
                .anyMatch(apiName -> ApiNameVersion.NAME.equals(apiName.name())));
    }

    @Test
    public void emptyAssociatedDataSendsNoEncryptionContext() throws GeneralSecurityException {
        when(kmsClient.encrypt(any(EncryptRequest.class))).thenReturn(EncryptResponse.builder()
                .ciphertextBlob(SdkBytes.fromByteArray(CIPHERTEXT))
                .build());

        aead(KEY_ARN).encrypt(PLAINTEXT, new byte[0]);

        ArgumentCaptor<EncryptRequest> captor = ArgumentCaptor.forClass(EncryptRequest.class);
        verify(kmsClient).encrypt(captor.capture());
        assertTrue(captor.getValue().encryptionContext().isEmpty());
    }

    @Test
    public void decryptReturnsPlaintextOfConfiguredKey() throws GeneralSecurityException {
        when(kmsClient.decrypt(any(DecryptRequest.class))).thenReturn(DecryptResponse.builder()
                .plaintext(SdkBytes.fromByteArray(PLAINTEXT))
                .keyId(KEY_ARN)
                .build());

        assertArrayEquals(PLAINTEXT, aead(KEY_ARN).decrypt(CIPHERTEXT, AAD));

        ArgumentCaptor<DecryptRequest> captor = ArgumentCaptor.forClass(DecryptRequest.class);
        verify(kmsClient).decrypt(captor.capture());
        DecryptRequest request = captor.getValue();
        assertEquals(KEY_ARN, request.keyId());
        assertArrayEquals(CIPHERTEXT, request.ciphertextBlob().asByteArray());
        assertEquals(Collections.singletonMap(AwsKmsAead.ASSOCIATED_DATA_CONTEXT_KEY, BinaryUtils.toHex(AAD)),
                request.encryptionContext());
    }

    @Test
    public void decryptByAnotherKeyFails() throws GeneralSecurityException {
        when(kmsClient.decrypt(any(DecryptRequest.class))).thenReturn(DecryptResponse.builder()
                .plaintext(SdkBytes.fromByteArray(PLAINTEXT))
                .keyId(OTHER_KEY_ARN)
                .build());

        Aead aead = aead(KEY_ARN);
        assertThrows(GeneralSecurityException.class, () -> aead.decrypt(CIPHERTEXT, AAD));
    }

    @Test
    public void aliasesAreNotComparedWithTheResponseKeyArn() throws GeneralSecurityException {
        when(kmsClient.decrypt(any(DecryptRequest.class))).thenReturn(DecryptResponse.builder()
                .plaintext(SdkBytes.fromByteArray(PLAINTEXT))
                .keyId(KEY_ARN)
                .build());

        assertArrayEquals(PLAINTEXT, aead("alias/my-key").decrypt(CIPHERTEXT, AAD));
    }

    @Test
    public void sdkFailuresBecomeGeneralSecurityExceptions() throws GeneralSecurityException {
        SdkClientException failure = SdkClientException.create("Unable to reach KMS");
        when(kmsClient.encrypt(any(EncryptRequest.class))).thenThrow(failure);
        when(kmsClient.decrypt(any(DecryptRequest.class))).thenThrow(failure);

        Aead aead = aead(KEY_ARN);
        GeneralSecurityException encryptFailure = assertThrows(GeneralSecurityException.class,
                () -> aead.encrypt(PLAINTEXT, AAD));
        assertSame(failure, encryptFailure.getCause());
        assertThrows(GeneralSecurityException.class, () -> aead.decrypt(CIPHERTEXT, AAD));
    }
}
