package io.nebula.identity.session;

import io.nebula.identity.authentication.AuthConfig;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.core.NewCookie;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;

/**
 * Builds session cookies with the configured name and security attributes.
 */
@ApplicationScoped
public class SessionCookies {

    @Inject
    AuthConfig authConfig;

    @Inject
    SessionCookieCodec codec;

    public NewCookie issue(WebSession session) {
        long maxAge = Math.max(0, Duration.between(Instant.now(), session.expiresAt).toSeconds());
        return builder()
            .value(codec.encode(session.id))
            .maxAge((int) Math.min(maxAge, Integer.MAX_VALUE))
            .build();
    }

    public NewCookie expire() {
        return builder()
            .value("")
            .maxAge(0)
            .build();
    }

    private NewCookie.Builder builder() {
        AuthConfig.SessionConfig config = authConfig.session();
        return new NewCookie.Builder(config.cookieName())
            .path("/")
            .httpOnly(config.httpOnly())
            .secure(config.secure())
            .sameSite(NewCookie.SameSite.valueOf(config.sameSite().toUpperCase(Locale.ROOT)));
    }
}
