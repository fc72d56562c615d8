package com.frogolio.frogol.security;

import com.frogolio.frogol.entity.User;
import com.frogolio.frogol.exception.AuthException;
import com.frogolio.frogol.service.AuthService;
import jakarta.servlet.http.Cookie;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockHttpServletRequest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("CurrentUserResolver")
class CurrentUserResolverTest {

    @Mock
    private AuthService authService;

    @InjectMocks
    private CurrentUserResolver resolver;

    @Test
    @DisplayName("Should prefer the auth cookie over the bearer header")
    void shouldPreferCookie() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.setCookies(new Cookie("auth_token", "from-cookie"));
        request.addHeader("Authorization", "Bearer from-header");

        assertThat(resolver.findToken(request)).contains("from-cookie");
    }

    @Test
    @DisplayName("Should fall back to the bearer header")
    void shouldUseBearerHeader() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.addHeader("Authorization", "Bearer abc.def.ghi");

        assertThat(resolver.findToken(request)).contains("abc.def.ghi");
    }

    @Test
    @DisplayName("Should resolve the user behind the token")
    void shouldResolveUser() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.addHeader("Authorization", "Bearer token");
        User user = User.builder().email("frog@example.com").build();
        when(authService.validateToken("token")).thenReturn(user);

        assertThat(resolver.requireUser(request)).isSameAs(user);
    }

    @Test
    @DisplayName("Should reject requests without a token")
    void shouldRejectAnonymous() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.addHeader("Authorization", "Basic Zm9vOmJhcg==");

        assertThatThrownBy(() -> resolver.requireUser(request))
                .isInstanceOf(AuthException.class)
                .hasMessage("Not authenticated");
        verifyNoInteractions(authService);
    }
}
