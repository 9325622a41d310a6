package com.signalrelay.security;

import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Authenticates webhook bodies with an HMAC-SHA256 shared secret.
 *
 * <p>The sender signs the raw request body and puts the lower-case hex digest in the
 * signature header. Verification recomputes the digest over the exact bytes received
 * and compares the two hex strings with {@link MessageDigest#isEqual}, which does not
 * short-circuit on the first differing byte.
 *
 * <p>{@link #verify} never throws: a missing signature, a blank secret or a malformed
 * value is simply a rejection.
 */
@Component
public class SignatureVerifier {

    private static final Logger log = LoggerFactory.getLogger(SignatureVerifier.class);

    private static final String HMAC_ALGORITHM = "HmacSHA256";

    /**
     * @return true only if {@code signature} is the hex HMAC-SHA256 of {@code body} under {@code secret}
     */
    public boolean verify(byte[] body, String secret, String signature) {
        if (body == null || signature == null || signature.isEmpty()) {
            log.debug("Missing signature or body");
            return false;
        }
        if (secret == null || secret.isEmpty()) {
            log.error("Webhook secret is not configured, rejecting request");
            return false;
        }

        byte[] expected = sign(body, secret).getBytes(StandardCharsets.US_ASCII);
        byte[] supplied = signature.getBytes(StandardCharsets.UTF_8);
        boolean valid = MessageDigest.isEqual(expected, supplied);
        if (!valid) {
            log.debug(
                    "Signature mismatch: expectedLength={}, receivedLength={}, bodySize={}",
                    expected.length,
                    supplied.length,
                    body.length);
        }
        return valid;
    }

    /**
     * Computes the lower-case hex HMAC-SHA256 of {@code body}. Used by senders and tests
     * to produce the value {@link #verify} expects.
     */
    public String sign(byte[] body, String secret) {
        if (secret == null || secret.isEmpty()) {
            throw new IllegalArgumentException("Secret key is required");
        }
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM));
            return HexFormat.of().formatHex(mac.doFinal(body));
        } catch (NoSuchAlgorithmException | InvalidKeyException e) {
            // Every JRE ships HmacSHA256
            throw new IllegalStateException("HmacSHA256 not available", e);
        }
    }
}
