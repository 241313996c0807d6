// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.keyset.kms;

import java.security.GeneralSecurityException;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import software.amazon.encryption.keyset.KeysetException;
import software.amazon.encryption.keyset.primitives.Aead;
import software.amazon.encryption.keyset.registry.KmsClient;

/**
 * {@link KmsClient} for AWS KMS. Key URIs have the form {@code aws-kms://<key id, alias or ARN>}.
 * A client bound to a key URI only supports that URI; an unbound client supports every AWS KMS URI.
 */
public class AwsKmsClient implements KmsClient {

    public static final String PREFIX = "aws-kms://";
    private static final Log LOG = LogFactory.getLog(AwsKmsClient.class);

    private final software.amazon.awssdk.services.kms.KmsClient _kmsClient;
    private final String _keyUri;

    private AwsKmsClient(Builder builder) {
        _kmsClient = builder._kmsClient;
        _keyUri = builder._keyUri;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean supports(String keyUri) {
        if (keyUri == null || !keyUri.startsWith(PREFIX)) {
            return false;
        }
        return _keyUri == null || _keyUri.equals(keyUri);
    }

    @Override
    public Aead getAead(String keyUri) throws GeneralSecurityException {
        if (!supports(keyUri)) {
            throw new GeneralSecurityException("This client does not support the key URI " + keyUri);
        }
        String keyId = keyId(keyUri);
        if (keyId.isEmpty()) {
            throw new GeneralSecurityException("Key URI " + keyUri + " names no key");
        }
        LOG.debug("Creating AWS KMS Aead for " + keyId);
        return new AwsKmsAead(_kmsClient, keyId);
    }

    static String keyId(String keyUri) {
        return keyUri.substring(PREFIX.length());
    }

    public static class Builder {
        private software.amazon.awssdk.services.kms.KmsClient _kmsClient;
        private String _keyUri;

        private Builder() {
        }

        /**
         * Note that this does NOT create a defensive clone of KmsClient. Any modifications made to the wrapped
         * client will be reflected in this Builder.
         */
        @SuppressFBWarnings(value = "EI_EXPOSE_REP2", justification = "Pass mutability into wrapping client")
        public Builder kmsClient(software.amazon.awssdk.services.kms.KmsClient kmsClient) {
            _kmsClient = kmsClient;
            return this;
        }

        /**
         * Binds the client to a single key URI.
         */
        public Builder keyUri(String keyUri) {
            if (keyUri == null || !keyUri.startsWith(PREFIX)) {
                throw new KeysetException("Key URI must start with " + PREFIX);
            }
            _keyUri = keyUri;
            return this;
        }

        public AwsKmsClient build() {
            if (_kmsClient == null) {
                _kmsClient = software.amazon.awssdk.services.kms.KmsClient.create();
            }
            return new AwsKmsClient(this);
        }
    }
}
