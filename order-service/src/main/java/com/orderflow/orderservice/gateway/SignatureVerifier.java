package com.orderflow.orderservice.gateway;

import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.regex.Pattern;

/**
 * Hex HMAC-SHA256 signatures as used by the payment gateway, both for
 * client-submitted payment confirmations and for webhook bodies.
 */
@Component
public class SignatureVerifier {

    private static final String ALGORITHM = "HmacSHA256";
    private static final Pattern HEX_SHA256 = Pattern.compile("^[0-9a-fA-F]{64}$");

    public String sign(String secret, byte[] message) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM));
            return HexFormat.of().formatHex(mac.doFinal(message));
        } catch (NoSuchAlgorithmException | InvalidKeyException e) {
            throw new IllegalStateException("HMAC-SHA256 is not available", e);
        }
    }

    public String sign(String secret, String message) {
        return sign(secret, message.getBytes(StandardCharsets.UTF_8));
    }

    public boolean isWellFormed(String signature) {
        return signature != null && HEX_SHA256.matcher(signature).matches();
    }

    /**
     * Constant-time comparison of the expected signature with the supplied one.
     * Malformed or missing signatures simply fail.
     */
    public boolean verify(String secret, byte[] message, String signature) {
        if (secret == null || secret.isEmpty() || !isWellFormed(signature)) {
            return false;
        }
        byte[] expected = sign(secret, message).getBytes(StandardCharsets.US_ASCII);
        byte[] actual = signature.getBytes(StandardCharsets.US_ASCII);
        return MessageDigest.isEqual(expected, actual);
    }

    public boolean verify(String secret, String message, String signature) {
        return verify(secret, message.getBytes(StandardCharsets.UTF_8), signature);
    }
}
