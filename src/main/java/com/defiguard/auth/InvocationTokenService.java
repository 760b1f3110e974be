package com.defiguard.auth;

import com.defiguard.exception.ConfigurationException;
import com.defiguard.exception.UnauthorizedException;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Mints and checks the per-evaluation tokens that prove a tool call comes from an
 * authorized script evaluation.
 *
 * <p>Tokens are HS256 JWTs whose subject is the evaluation id. A token is accepted only
 * while its signature verifies, it has not expired, and its evaluation is still active;
 * {@link #revoke} ends an evaluation, which invalidates its token at once and makes the
 * gateway abandon any call still in flight for it.
 */
public class InvocationTokenService {

    private static final Logger log = LoggerFactory.getLogger(InvocationTokenService.class);

    static final int MIN_SECRET_BYTES = 32;

    private final SecretKey secretKey;
    private final Duration tokenTtl;
    private final Clock clock;

    /** evaluation id -> expiry */
    private final Map<String, Instant> activeEvaluations = new ConcurrentHashMap<>();

    public InvocationTokenService(String secret, Duration tokenTtl, Clock clock) {
        if (secret == null || secret.getBytes(StandardCharsets.UTF_8).length < MIN_SECRET_BYTES) {
            throw new ConfigurationException(
                    "defiguard.auth.invocation-secret must be at least " + MIN_SECRET_BYTES + " bytes");
        }
        if (tokenTtl == null || tokenTtl.isNegative() || tokenTtl.isZero()) {
            throw new ConfigurationException("defiguard.auth.token-ttl must be positive");
        }
        this.secretKey = new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), "HmacSHA256");
        this.tokenTtl = tokenTtl;
        this.clock = clock;
    }

    /** Starts a new evaluation and returns its token. Expired evaluations are swept first. */
    public InvocationGrant issue() {
        Instant now = clock.instant();
        purgeExpired(now);
        String evaluationId = UUID.randomUUID().toString();
        Instant expiry = now.plus(tokenTtl);

        String token = Jwts.builder()
                .subject(evaluationId)
                .id(UUID.randomUUID().toString())
                .issuedAt(Date.from(now))
                .expiration(Date.from(expiry))
                .signWith(secretKey)
                .compact();

        activeEvaluations.put(evaluationId, expiry);
        log.info("Evaluation started [evaluationId={}, expiresAt={}]", evaluationId, expiry);
        return InvocationGrant.builder()
                .evaluationId(evaluationId)
                .invocationToken(token)
                .expiresAt(expiry)
                .build();
    }

    /**
     * Validates a token and returns its evaluation id.
     *
     * @throws UnauthorizedException if the token is missing, malformed, tampered, expired
     *         or belongs to an evaluation that has ended
     */
    public String validate(String token) {
        if (token == null || token.isBlank()) {
            throw new UnauthorizedException("Missing invocation token");
        }

        Claims claims;
        try {
            claims = Jwts.parser()
                    .verifyWith(secretKey)
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
        } catch (JwtException | IllegalArgumentException e) {
            throw new UnauthorizedException("Invalid invocation token");
        }

        String evaluationId = claims.getSubject();
        if (evaluationId == null || !isActive(evaluationId)) {
            throw new UnauthorizedException("Evaluation is not active");
        }
        return evaluationId;
    }

    /** Ends an evaluation. Returns false if it was not active. */
    public boolean revoke(String evaluationId) {
        boolean removed = activeEvaluations.remove(evaluationId) != null;
        if (removed) {
            log.info("Evaluation revoked [evaluationId={}]", evaluationId);
        }
        return removed;
    }

    public boolean isActive(String evaluationId) {
        Instant expiry = activeEvaluations.get(evaluationId);
        if (expiry == null) {
            return false;
        }
        if (!clock.instant().isBefore(expiry)) {
            activeEvaluations.remove(evaluationId, expiry);
            return false;
        }
        return true;
    }

    /** Number of evaluations still tracked, after dropping the expired ones. */
    public int getActiveCount() {
        purgeExpired(clock.instant());
        return activeEvaluations.size();
    }

    private void purgeExpired(Instant now) {
        int before = activeEvaluations.size();
        activeEvaluations.values().removeIf(expiry -> !now.isBefore(expiry));
        int removed = before - activeEvaluations.size();
        if (removed > 0) {
            log.debug("Swept {} expired evaluations", removed);
        }
    }
}
