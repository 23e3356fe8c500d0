package io.nebula.identity.session;

import io.nebula.identity.user.User;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

class SessionContextTest {

    @Test
    @DisplayName("currentUser should load the user once per request")
    void currentUser_shouldMemoizeLookup() {
        // Arrange
        SessionAuthority authority = mock(SessionAuthority.class);
        User user = new User();
        user.id = "usr_1";
        when(authority.current("sess-1")).thenReturn(Optional.of(user));

        SessionContext context = new SessionContext();
        context.sessionAuthority = authority;
        context.setSessionId("sess-1");

        // Act
        context.currentUser();
        Optional<User> second = context.currentUser();

        // Assert
        assertThat(second).containsSame(user);
        verify(authority, times(1)).current("sess-1");
    }

    @Test
    @DisplayName("request without a session cookie should be anonymous")
    void currentUser_shouldBeEmpty_whenNoSessionId() {
        SessionAuthority authority = mock(SessionAuthority.class);
        when(authority.current(null)).thenReturn(Optional.empty());
        SessionContext context = new SessionContext();
        context.sessionAuthority = authority;

        assertThat(context.sessionId()).isNull();
        assertThat(context.currentUser()).isEmpty();
    }
}
