package com.remotelink.gateway.auth;

import com.remotelink.common.config.ConfigService;
import com.remotelink.common.config.RemoteLinkConfig;
import com.remotelink.common.model.Session;
import com.remotelink.common.model.TokenStatus;
import com.remotelink.common.response.AuthException;
import com.remotelink.common.response.ErrorCodes;
import com.remotelink.common.response.NotFoundException;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Issues, verifies and invalidates session tokens.
 * <p>
 * Sessions live in memory only. Credentials come from the {@code auth}
 * config section and are compared in constant time. After
 * {@code maxFailures} consecutive failures an address is refused for
 * {@code cooldownMs}.
 */
@Slf4j
public class SessionManager {

    private static final int TOKEN_BYTES = 32;

    private final ConfigService configService;
    private final Clock clock;
    private final SecureRandom random = new SecureRandom();
    private final Map<String, Session> sessions = new ConcurrentHashMap<>();

    /**
     * Track consecutive failures per remote address for cooldown.
     */
    private final Map<String, FailureRecord> failureRecords = new ConcurrentHashMap<>();

    public SessionManager(ConfigService configService) {
        this(configService, Clock.systemUTC());
    }

    public SessionManager(ConfigService configService, Clock clock) {
        this.configService = configService;
        this.clock = clock;
    }

    // ─── Core API ───────────────────────────────────────────────

    /**
     * Check credentials and open a new session.
     *
     * @throws AuthException wrong credentials, or the address is cooling down
     */
    public Session login(Credentials credentials) {
        String remoteAddr = credentials.remoteAddr();
        if (isInCooldown(remoteAddr)) {
            log.warn("Login refused for {}: too many failures", remoteAddr);
            throw new AuthException(ErrorCodes.RATE_LIMITED, "too many failed attempts, try again later");
        }

        RemoteLinkConfig.AuthConfig auth = authConfig();
        boolean userOk = safeEqual(credentials.username(), auth.getUsername());
        boolean passwordOk = safeEqual(credentials.password(), auth.getPassword());
        if (!userOk || !passwordOk) {
            recordFailure(remoteAddr);
            throw new AuthException(ErrorCodes.INVALID_CREDENTIALS, "invalid username or password");
        }
        clearFailures(remoteAddr);

        Instant now = clock.instant();
        Instant expiresAt = auth.getSessionTtlMinutes() > 0
                ? now.plus(Duration.ofMinutes(auth.getSessionTtlMinutes()))
                : null;
        Session session = new Session(newToken(), credentials.username(), now, expiresAt);
        sessions.put(session.token(), session);
        log.info("Login for '{}' from {} (session {})", session.username(), remoteAddr, shorten(session.token()));
        return session;
    }

    /**
     * Invalidate a session.
     *
     * @throws NotFoundException the token is not a live session
     */
    public Session logout(String token) {
        Session removed = token == null ? null : sessions.remove(token);
        if (removed == null) {
            throw new NotFoundException(ErrorCodes.SESSION_NOT_FOUND, "Session");
        }
        log.info("Logout for '{}' (session {})", removed.username(), shorten(token));
        return removed;
    }

    public TokenStatus verify(String token) {
        if (token == null || token.isBlank()) {
            return TokenStatus.UNKNOWN;
        }
        Session session = sessions.get(token);
        if (session == null) {
            return TokenStatus.UNKNOWN;
        }
        if (session.isExpiredAt(clock.instant())) {
            sessions.remove(token, session);
            log.debug("Session {} expired", shorten(token));
            return TokenStatus.EXPIRED;
        }
        return TokenStatus.VALID;
    }

    /** The live session for a token, if it is valid. */
    public Optional<Session> session(String token) {
        if (verify(token) != TokenStatus.VALID) {
            return Optional.empty();
        }
        return Optional.ofNullable(sessions.get(token));
    }

    /**
     * Drop sessions whose expiry has passed.
     *
     * @return number of sessions removed
     */
    @Scheduled(fixedDelayString = "${remotelink.auth.sweep-interval-ms:60000}")
    public int sweepExpired() {
        Instant now = clock.instant();
        int before = sessions.size();
        sessions.values().removeIf(s -> s.isExpiredAt(now));
        int removed = before - sessions.size();
        if (removed > 0) {
            log.debug("Swept {} expired session(s)", removed);
        }
        return removed;
    }

    @PreDestroy
    public void clear() {
        sessions.clear();
        failureRecords.clear();
    }

    public int size() {
        return sessions.size();
    }

    // ─── Rate limiting ──────────────────────────────────────────

    /**
     * Check if a remote address is in cooldown period.
     */
    public boolean isInCooldown(String remoteAddr) {
        if (remoteAddr == null) {
            return false;
        }
        FailureRecord record = failureRecords.get(remoteAddr);
        if (record == null) {
            return false;
        }
        RemoteLinkConfig.AuthConfig auth = authConfig();
        if (record.count >= auth.getMaxFailures()) {
            long elapsed = clock.millis() - record.lastFailureTime;
            if (elapsed < auth.getCooldownMs()) {
                return true;
            }
            failureRecords.remove(remoteAddr);
        }
        return false;
    }

    private void recordFailure(String remoteAddr) {
        if (remoteAddr == null) {
            log.warn("Auth failure from unknown address");
            return;
        }
        FailureRecord record = failureRecords.compute(remoteAddr, (k, v) -> {
            FailureRecord next = v == null ? new FailureRecord() : v;
            next.count++;
            next.lastFailureTime = clock.millis();
            return next;
        });
        log.warn("Auth failure from {} (count={})", remoteAddr, record.count);
    }

    private void clearFailures(String remoteAddr) {
        if (remoteAddr != null) {
            failureRecords.remove(remoteAddr);
        }
    }

    // ─── Helpers ────────────────────────────────────────────────

    private RemoteLinkConfig.AuthConfig authConfig() {
        return configService.loadConfig().getAuth();
    }

    private String newToken() {
        byte[] bytes = new byte[TOKEN_BYTES];
        String token;
        do {
            random.nextBytes(bytes);
            token = HexFormat.of().formatHex(bytes);
        } while (sessions.containsKey(token));
        return token;
    }

    /**
     * Timing-safe string comparison.
     */
    private static boolean safeEqual(String a, String b) {
        if (a == null || b == null) {
            return false;
        }
        return MessageDigest.isEqual(a.getBytes(StandardCharsets.UTF_8), b.getBytes(StandardCharsets.UTF_8));
    }

    static String shorten(String token) {
        if (token == null) {
            return "null";
        }
        return token.length() <= 8 ? token : token.substring(0, 8) + "…";
    }

    private static class FailureRecord {
        int count;
        long lastFailureTime;
    }
}
