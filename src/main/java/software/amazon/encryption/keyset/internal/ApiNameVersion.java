// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.keyset.internal;

import software.amazon.awssdk.awscore.AwsRequestOverrideConfiguration;
import software.amazon.awssdk.core.ApiName;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.util.Enumeration;
import java.util.Properties;
import java.util.function.Consumer;

/**
 * Provides the information for the ApiName APIs for the AWS SDK
 */
public class ApiNameVersion {
    private static final ApiName API_NAME = ApiNameVersion.apiNameWithVersion();
    // This is used in overrideConfiguration
    public static final Consumer<AwsRequestOverrideConfiguration.Builder> API_NAME_INTERCEPTOR =
            builder -> builder.addApiName(API_NAME);

    public static final String NAME = "AwsKeysetCrypto";
    public static final String API_VERSION_UNKNOWN = "1-unknown";
    private static final String VERSION_PROPERTY = "keysetCryptoVersion";

    public static ApiName apiNameWithVersion() {
        return ApiName.builder()
                .name(NAME)
                .version(apiVersion())
                .build();
    }

    private static String apiVersion() {
        try {
            final ClassLoader loader = ApiNameVersion.class.getClassLoader();

            // Other JARs on the classpath may also define project.properties
            // Enumerate through and find the one that carries our version property
            Enumeration<URL> urls = loader.getResources("project.properties");
            if (urls == null) {
                return API_VERSION_UNKNOWN;
            }
            while (urls.hasMoreElements()) {
                final Properties properties = new Properties();
                try (InputStream in = urls.nextElement().openStream()) {
                    properties.load(in);
                }
                String maybeVersion = properties.getProperty(VERSION_PROPERTY);
                if (maybeVersion != null) {
                    return maybeVersion;
                }
            }
            return API_VERSION_UNKNOWN;
        } catch (final IOException ex) {
            return API_VERSION_UNKNOWN;
        }
    }
}
