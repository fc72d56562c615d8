package com.frogolio.frogol.security;

import com.frogolio.frogol.entity.User;
import com.frogolio.frogol.exception.AuthException;
import com.frogolio.frogol.service.AuthService;
import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Finds the session token on a request (auth cookie first, then bearer header)
 * and resolves the signed-in user
 */
@Component
@RequiredArgsConstructor
public class CurrentUserResolver {

    public static final String AUTH_COOKIE = "auth_token";
    private static final String BEARER_PREFIX = "Bearer ";

    private final AuthService authService;

    public Optional<String> findToken(HttpServletRequest request) {
        Cookie[] cookies = request.getCookies();
        if (cookies != null) {
            for (Cookie cookie : cookies) {
                if (AUTH_COOKIE.equals(cookie.getName()) && !cookie.getValue().isBlank()) {
                    return Optional.of(cookie.getValue());
                }
            }
        }
        String header = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (header != null && header.startsWith(BEARER_PREFIX)) {
            String token = header.substring(BEARER_PREFIX.length()).trim();
            if (!token.isEmpty()) {
                return Optional.of(token);
            }
        }
        return Optional.empty();
    }

    public User requireUser(HttpServletRequest request) {
        String token = findToken(request)
                .orElseThrow(() -> new AuthException("Not authenticated"));
        return authService.validateToken(token);
    }
}
