// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.keyset.kms;

import java.security.GeneralSecurityException;

import org.junit.jupiter.api.Test;
import software.amazon.awssdk.services.kms.KmsClient;
import software.amazon.encryption.keyset.KeysetException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;

public class AwsKmsClientTest {

    private static final String KEY_ARN = "arn:aws:kms:us-west-2:111122223333:key/1234abcd-12ab-34cd-56ef-1234567890ab";
    private static final String KEY_URI = AwsKmsClient.PREFIX + KEY_ARN;

    @Test
    public void unboundClientSupportsEveryAwsKmsUri() {
        AwsKmsClient client = AwsKmsClient.builder().kmsClient(mock(KmsClient.class)).build();
        assertTrue(client.supports(KEY_URI));
        assertTrue(client.supports("aws-kms://alias/my-key"));
        assertFalse(client.supports("fake-kms://key"));
        assertFalse(client.supports(null));
    }

    @Test
    public void boundClientSupportsOnlyItsKey() {
        AwsKmsClient client = AwsKmsClient.builder()
                .kmsClient(mock(KmsClient.class))
                .keyUri(KEY_URI)
                .build();
        assertTrue(client.supports(KEY_URI));
        assertFalse(client.supports("aws-kms://alias/my-key"));
    }

    @Test
    public void builderRejectsNonAwsKeyUri() {
        assertThrows(KeysetException.class, () -> AwsKmsClient.builder().keyUri(KEY_ARN));
        assertThrows(KeysetException.class, () -> AwsKmsClient.builder().keyUri(null));
    }

    @Test
    public void getAeadRejectsUnsupportedUris() throws GeneralSecurityException {
        AwsKmsClient client = AwsKmsClient.builder().kmsClient(mock(KmsClient.class)).build();
        assertThrows(GeneralSecurityException.class, () -> client.getAead("fake-kms://key"));
        assertThrows(GeneralSecurityException.class, () -> client.getAead(AwsKmsClient.PREFIX));
        assertNotNull(client.getAead(KEY_URI));
    }

    @Test
    public void keyIdStripsPrefix() {
        assertEquals(KEY_ARN, AwsKmsClient.keyId(KEY_URI));
    }
}
