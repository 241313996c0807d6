// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.keyset.internal;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ApiNameVersionTest {

    private final static String EXPECTED_API_NAME = "AwsKeysetCrypto";
    private final static String EXPECTED_API_MAJOR_VERSION = "1";

    @Test
    public void testApiNameWithVersion() {
        assertEquals(EXPECTED_API_NAME, ApiNameVersion.apiNameWithVersion().name());
        // To avoid having to hardcode versions, just check that we're incrementing from 1
        assertTrue(ApiNameVersion.apiNameWithVersion().version().startsWith(EXPECTED_API_MAJOR_VERSION));
    }
}
