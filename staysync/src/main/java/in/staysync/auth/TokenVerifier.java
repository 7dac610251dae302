package in.staysync.auth;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.staysync.domain.common.Identity;
import in.staysync.util.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;
import java.util.Base64;

/**
 * Resolves HS256 bearer tokens into a tenant/actor identity.
 *
 * Claims: {@code sub} actor id, {@code org} tenant id, {@code name} display label,
 * {@code iat} and {@code exp} in epoch seconds.
 */
public final class TokenVerifier {
    private static final Logger log = LoggerFactory.getLogger(TokenVerifier.class);
    private static final String HEADER = base64Encode("{\"alg\":\"HS256\",\"typ\":\"JWT\"}");

    private final byte[] secret;
    private final Duration ttl;
    private final Clock clock;

    public TokenVerifier(String secret, Duration ttl) {
        this(secret, ttl, Clock.systemUTC());
    }

    public TokenVerifier(String secret, Duration ttl, Clock clock) {
        if (secret == null || secret.isEmpty()) {
            throw new IllegalArgumentException("Token secret is required");
        }
        this.secret = secret.getBytes(StandardCharsets.UTF_8);
        this.ttl = ttl;
        this.clock = clock;
    }

    /**
     * Issue a token for an identity. Used by tooling and tests.
     */
    public String issue(Identity identity) {
        long now = clock.millis() / 1000;
        ObjectNode claims = Json.MAPPER.createObjectNode()
            .put("sub", identity.actorId())
            .put("org", identity.tenantId())
            .put("iat", now)
            .put("exp", now + ttl.toSeconds());
        if (identity.label() != null) {
            claims.put("name", identity.label());
        }
        String payload = base64Encode(claims.toString());
        return HEADER + "." + payload + "." + sign(HEADER + "." + payload);
    }

    /**
     * Verify a token, with or without the {@code Bearer } prefix.
     *
     * @return the identity, or null when the token is malformed, badly signed or expired
     */
    public Identity verify(String token) {
        if (token == null || token.isBlank()) {
            return null;
        }
        if (token.startsWith("Bearer ")) {
            token = token.substring(7).trim();
        }

        String[] parts = token.split("\\.");
        if (parts.length != 3) {
            log.debug("[Auth] Invalid token format");
            return null;
        }

        byte[] expected = sign(parts[0] + "." + parts[1]).getBytes(StandardCharsets.US_ASCII);
        if (!MessageDigest.isEqual(expected, parts[2].getBytes(StandardCharsets.US_ASCII))) {
            log.debug("[Auth] Invalid token signature");
            return null;
        }

        try {
            JsonNode claims = Json.MAPPER.readTree(Base64.getUrlDecoder().decode(parts[1]));
            if (!claims.hasNonNull("sub") || !claims.hasNonNull("org") || !claims.hasNonNull("exp")) {
                log.debug("[Auth] Missing required claims");
                return null;
            }
            if (clock.millis() / 1000 > claims.get("exp").asLong()) {
                log.debug("[Auth] Token expired");
                return null;
            }
            long tenantId = claims.get("org").asLong();
            long actorId = claims.get("sub").asLong();
            if (tenantId <= 0) {
                log.debug("[Auth] Token carries no tenant");
                return null;
            }
            String label = claims.hasNonNull("name") ? claims.get("name").asText() : null;
            return new Identity(tenantId, actorId, label);
        } catch (Exception e) {
            log.debug("[Auth] Token validation error: {}", e.getMessage());
            return null;
        }
    }

    private String sign(String data) {
        try {
            Mac mac = Mac.getInstance("HmacSHA256");
            mac.init(new SecretKeySpec(secret, "HmacSHA256"));
            byte[] hash = mac.doFinal(data.getBytes(StandardCharsets.UTF_8));
            return Base64.getUrlEncoder().withoutPadding().encodeToString(hash);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to sign token", e);
        }
    }

    private static String base64Encode(String data) {
        return Base64.getUrlEncoder().withoutPadding().encodeToString(data.getBytes(StandardCharsets.UTF_8));
    }
}
