package com.tethersystems.live.bridge;

import com.tethersystems.live.TetherException;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;
import java.util.Base64;

/**
 * Signs and verifies short-lived tokens with HMAC-SHA256.
 * <p>
 * Token layout: {@code base64url(value) "." signedAtMillis "." base64url(hmac)}, where the HMAC covers
 * the salt and the first two parts. The salt separates token purposes that share a secret.
 */
public class TokenSigner {

    private static final String ALGORITHM = "HmacSHA256";
    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();
    private static final Base64.Decoder DECODER = Base64.getUrlDecoder();

    private final byte[] secret;
    private final Duration maxAge;
    private final Clock clock;

    /**
     * @param secret Signing key
     * @param maxAge Longest accepted token age, or null for no limit
     */
    public TokenSigner(String secret, Duration maxAge) {
        this(secret, maxAge, Clock.systemUTC());
    }

    public TokenSigner(String secret, Duration maxAge, Clock clock) {
        if (secret == null || secret.isEmpty()) {
            throw new IllegalArgumentException("Token secret must not be empty");
        }
        this.secret = secret.getBytes(StandardCharsets.UTF_8);
        this.maxAge = maxAge;
        this.clock = clock;
    }

    public String sign(String salt, String value) {
        String body = ENCODER.encodeToString(value.getBytes(StandardCharsets.UTF_8)) + "." + clock.millis();
        return body + "." + ENCODER.encodeToString(hmac(salt, body));
    }

    /**
     * Verifies a token and returns the value it was signed over.
     *
     * @param salt  The salt used when signing
     * @param token The token
     * @return the signed value
     * @throws TokenVerificationException if the token is malformed, forged or older than the max age
     */
    public String verify(String salt, String token) {
        return open(salt, token, true);
    }

    /**
     * Verifies only the signature. Used to find the call an expired reply belonged to.
     */
    String verifySignature(String salt, String token) {
        return open(salt, token, false);
    }

    private String open(String salt, String token, boolean checkAge) {
        if (token == null) {
            throw new TokenVerificationException(TokenVerificationException.Reason.INVALID, "Missing token");
        }
        int lastDot = token.lastIndexOf('.');
        int firstDot = token.indexOf('.');
        if (firstDot <= 0 || lastDot == firstDot) {
            throw new TokenVerificationException(TokenVerificationException.Reason.INVALID, "Malformed token");
        }
        String body = token.substring(0, lastDot);
        byte[] signature;
        long signedAt;
        String value;
        try {
            signature = DECODER.decode(token.substring(lastDot + 1));
            signedAt = Long.parseLong(token.substring(firstDot + 1, lastDot));
            value = new String(DECODER.decode(token.substring(0, firstDot)), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            throw new TokenVerificationException(TokenVerificationException.Reason.INVALID, "Malformed token");
        }
        if (!MessageDigest.isEqual(signature, hmac(salt, body))) {
            throw new TokenVerificationException(TokenVerificationException.Reason.INVALID, "Invalid token signature");
        }
        if (checkAge && maxAge != null && clock.millis() - signedAt > maxAge.toMillis()) {
            throw new TokenVerificationException(TokenVerificationException.Reason.EXPIRED, "Token expired");
        }
        return value;
    }

    private byte[] hmac(String salt, String body) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(secret, ALGORITHM));
            mac.update(salt.getBytes(StandardCharsets.UTF_8));
            mac.update((byte) 0);
            return mac.doFinal(body.getBytes(StandardCharsets.UTF_8));
        } catch (GeneralSecurityException e) {
            throw new TetherException("HMAC computation failed", e);
        }
    }
}
