// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.keyset.algorithms;

import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.security.GeneralSecurityException;
import java.security.InvalidAlgorithmParameterException;
import java.security.SignatureException;
import java.util.Arrays;
import java.util.Map;

import software.amazon.awssdk.protocols.jsoncore.JsonNode;
import software.amazon.encryption.keyset.internal.SerializedKeys;

/**
 * Wire encodings for ECDSA signatures.
 * <p>
 * JCE engines always produce and consume DER, so {@link #IEEE_P1363} signatures are converted at the
 * edges: {@code r || s}, each big-endian and left-padded to the curve's coordinate size.
 */
public enum EcdsaSignatureEncoding {
    DER,
    IEEE_P1363;

    static final String FIELD_NAME = "encoding";

    private static final byte SEQUENCE_TAG = 0x30;
    private static final byte INTEGER_TAG = 0x02;

    /**
     * Reads the {@code encoding} field, defaulting to DER for keys written before the field existed.
     */
    static EcdsaSignatureEncoding read(Map<String, JsonNode> fields) throws GeneralSecurityException {
        if (!fields.containsKey(FIELD_NAME)) {
            return DER;
        }
        String name = SerializedKeys.string(fields, FIELD_NAME);
        for (EcdsaSignatureEncoding encoding : values()) {
            if (encoding.name().equals(name)) {
                return encoding;
            }
        }
        throw new InvalidAlgorithmParameterException("Unsupported signature encoding: " + name);
    }

    byte[] fromDer(byte[] der, int coordinateSizeBytes) throws SignatureException {
        if (this == DER) {
            return der;
        }
        BigInteger[] rs = decodeDer(der);
        byte[] signature = new byte[2 * coordinateSizeBytes];
        writeFixed(rs[0], signature, 0, coordinateSizeBytes);
        writeFixed(rs[1], signature, coordinateSizeBytes, coordinateSizeBytes);
        return signature;
    }

    byte[] toDer(byte[] signature, int coordinateSizeBytes) throws SignatureException {
        if (this == DER) {
            return signature;
        }
        if (signature.length != 2 * coordinateSizeBytes) {
            throw new SignatureException("Invalid signature");
        }
        BigInteger r = new BigInteger(1, Arrays.copyOfRange(signature, 0, coordinateSizeBytes));
        BigInteger s = new BigInteger(1, Arrays.copyOfRange(signature, coordinateSizeBytes, signature.length));
        return encodeDer(r, s);
    }

    private static BigInteger[] decodeDer(byte[] der) throws SignatureException {
        if (der.length < 2 || der[0] != SEQUENCE_TAG) {
            throw new SignatureException("Invalid DER signature");
        }
        int offset = 1;
        int length = der[offset++] & 0xff;
        if (length == 0x81) {
            if (der.length < 3) {
                throw new SignatureException("Invalid DER signature");
            }
            length = der[offset++] & 0xff;
        } else if (length > 0x7f) {
            throw new SignatureException("Invalid DER signature");
        }
        if (offset + length != der.length) {
            throw new SignatureException("Invalid DER signature");
        }
        BigInteger[] values = new BigInteger[2];
        for (int i = 0; i < values.length; i++) {
            if (offset + 2 > der.length || der[offset] != INTEGER_TAG) {
                throw new SignatureException("Invalid DER signature");
            }
            int integerLength = der[offset + 1] & 0xff;
            offset += 2;
            if (integerLength == 0 || integerLength > 0x7f || offset + integerLength > der.length) {
                throw new SignatureException("Invalid DER signature");
            }
            values[i] = new BigInteger(Arrays.copyOfRange(der, offset, offset + integerLength));
            offset += integerLength;
        }
        if (offset != der.length) {
            throw new SignatureException("Invalid DER signature");
        }
        return values;
    }

    private static byte[] encodeDer(BigInteger r, BigInteger s) {
        byte[] rBytes = r.toByteArray();
        byte[] sBytes = s.toByteArray();
        int contentLength = 2 + rBytes.length + 2 + sBytes.length;
        // Coordinates are at most 66 bytes, so the sequence length always fits in one byte.
        ByteBuffer buffer = ByteBuffer.allocate((contentLength > 0x7f ? 3 : 2) + contentLength);
        buffer.put(SEQUENCE_TAG);
        if (contentLength > 0x7f) {
            buffer.put((byte) 0x81);
        }
        buffer.put((byte) contentLength);
        buffer.put(INTEGER_TAG).put((byte) rBytes.length).put(rBytes);
        buffer.put(INTEGER_TAG).put((byte) sBytes.length).put(sBytes);
        return buffer.array();
    }

    private static void writeFixed(BigInteger value, byte[] out, int offset, int length) throws SignatureException {
        if (value.signum() < 0 || value.bitLength() > 8 * length) {
            throw new SignatureException("Signature value does not fit the curve");
        }
        byte[] bytes = value.toByteArray();
        int copied = Math.min(bytes.length, length);
        System.arraycopy(bytes, bytes.length - copied, out, offset + length - copied, copied);
    }
}
