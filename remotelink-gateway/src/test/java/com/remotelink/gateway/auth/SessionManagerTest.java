package com.remotelink.gateway.auth;

import com.remotelink.common.config.ConfigService;
import com.remotelink.common.model.Session;
import com.remotelink.common.model.TokenStatus;
import com.remotelink.common.response.AuthException;
import com.remotelink.common.response.ErrorCodes;
import com.remotelink.common.response.NotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class SessionManagerTest {

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private SessionManager manager;

    /** Clock the test can move forward. */
    static final class MutableClock extends Clock {
        private Instant now = Instant.parse("2026-01-01T00:00:00Z");

        void advance(Duration d) {
            now = now.plus(d);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }

    @BeforeEach
    void setUp() throws IOException {
        Path config = tempDir.resolve("config.json");
        Files.writeString(config, """
                {
                  "auth": {
                    "username": "admin",
                    "password": "password",
                    "sessionTtlMinutes": 30,
                    "maxFailures": 3,
                    "cooldownMs": 60000
                  }
                }
                """);
        clock = new MutableClock();
        manager = new SessionManager(new ConfigService(config), clock);
    }

    private Session login() {
        return manager.login(new Credentials("admin", "password", "10.0.0.5"));
    }

    @Test
    void loginVerifyLogoutVerify() {
        Session session = login();

        assertEquals(64, session.token().length());
        assertEquals(TokenStatus.VALID, manager.verify(session.token()));

        manager.logout(session.token());
        assertEquals(TokenStatus.UNKNOWN, manager.verify(session.token()));
    }

    @Test
    void login_issuesFreshTokens() {
        assertNotEquals(login().token(), login().token());
        assertEquals(2, manager.size());
    }

    @Test
    void login_wrongPassword_throwsAuth() {
        AuthException e = assertThrows(AuthException.class,
                () -> manager.login(new Credentials("admin", "nope", "10.0.0.5")));
        assertEquals(ErrorCodes.INVALID_CREDENTIALS, e.getError().code());
        assertEquals(0, manager.size());
    }

    @Test
    void login_nullFields_throwsAuth() {
        assertThrows(AuthException.class, () -> manager.login(new Credentials(null, null, null)));
    }

    @Test
    void logout_unknownToken_throwsNotFound() {
        NotFoundException e = assertThrows(NotFoundException.class, () -> manager.logout("deadbeef"));
        assertEquals(ErrorCodes.SESSION_NOT_FOUND, e.getError().code());
    }

    @Test
    void logout_twice_secondIsNotFound() {
        Session session = login();
        manager.logout(session.token());
        assertThrows(NotFoundException.class, () -> manager.logout(session.token()));
    }

    @Test
    void verify_afterTtl_isExpired_thenUnknown() {
        Session session = login();
        assertEquals(clock.instant().plus(Duration.ofMinutes(30)), session.expiresAt());

        clock.advance(Duration.ofMinutes(31));

        assertEquals(TokenStatus.EXPIRED, manager.verify(session.token()));
        assertEquals(TokenStatus.UNKNOWN, manager.verify(session.token()));
        assertTrue(manager.session(session.token()).isEmpty());
    }

    @Test
    void verify_blankOrNull_isUnknown() {
        assertEquals(TokenStatus.UNKNOWN, manager.verify(null));
        assertEquals(TokenStatus.UNKNOWN, manager.verify(""));
    }

    @Test
    void sweepExpired_removesOnlyExpired() {
        login();
        clock.advance(Duration.ofMinutes(20));
        Session fresh = login();
        clock.advance(Duration.ofMinutes(15));

        assertEquals(1, manager.sweepExpired());
        assertEquals(1, manager.size());
        assertEquals(TokenStatus.VALID, manager.verify(fresh.token()));
    }

    @Test
    void repeatedFailures_startCooldown_thenExpire() {
        Credentials bad = new Credentials("admin", "wrong", "10.0.0.9");
        for (int i = 0; i < 3; i++) {
            assertThrows(AuthException.class, () -> manager.login(bad));
        }

        Credentials good = new Credentials("admin", "password", "10.0.0.9");
        AuthException limited = assertThrows(AuthException.class, () -> manager.login(good));
        assertEquals(ErrorCodes.RATE_LIMITED, limited.getError().code());

        // other addresses are unaffected
        assertDoesNotThrow(() -> manager.login(new Credentials("admin", "password", "10.0.0.10")));

        clock.advance(Duration.ofSeconds(61));
        assertDoesNotThrow(() -> manager.login(good));
    }

    @Test
    void clear_dropsAllSessions() {
        Session session = login();
        manager.clear();
        assertEquals(TokenStatus.UNKNOWN, manager.verify(session.token()));
    }

    @Test
    void shorten_hidesMostOfToken() {
        assertEquals("abcdef12…", SessionManager.shorten("abcdef1234567890"));
    }
}
