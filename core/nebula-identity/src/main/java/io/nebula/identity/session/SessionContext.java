package io.nebula.identity.session;

import io.nebula.identity.user.User;
import jakarta.enterprise.context.RequestScoped;
import jakarta.inject.Inject;

import java.util.Optional;

/**
 * Request-scoped view of the caller's session.
 *
 * Populated by {@link SessionContextFilter} from the session cookie. The user is
 * loaded through {@link SessionAuthority} at most once per request and never
 * carried over to another request.
 */
@RequestScoped
public class SessionContext {

    @Inject
    SessionAuthority sessionAuthority;

    private String sessionId;
    private Optional<User> user;

    public void setSessionId(String sessionId) {
        this.sessionId = sessionId;
        this.user = null;
    }

    /**
     * Id of the session the request arrived with, or null.
     */
    public String sessionId() {
        return sessionId;
    }

    public Optional<User> currentUser() {
        if (user == null) {
            user = sessionAuthority.current(sessionId);
        }
        return user;
    }
}
