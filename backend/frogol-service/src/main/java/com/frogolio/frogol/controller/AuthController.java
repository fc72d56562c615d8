package com.frogolio.frogol.controller;

import com.frogolio.frogol.dto.LoginRequest;
import com.frogolio.frogol.dto.RegisterRequest;
import com.frogolio.frogol.dto.SessionDto;
import com.frogolio.frogol.dto.UserDto;
import com.frogolio.frogol.entity.Session;
import com.frogolio.frogol.entity.User;
import com.frogolio.frogol.security.CurrentUserResolver;
import com.frogolio.frogol.security.JwtTokenProvider;
import com.frogolio.frogol.service.AuthService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseCookie;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.util.Map;

/**
 * REST API for accounts and sessions
 */
@RestController
@RequestMapping("/api/auth")
@RequiredArgsConstructor
@Tag(name = "Auth", description = "Registration, login and session APIs")
public class AuthController {

    private final AuthService authService;
    private final CurrentUserResolver currentUserResolver;
    private final JwtTokenProvider jwtTokenProvider;

    @PostMapping("/register")
    @Operation(summary = "Register", description = "Create an account with email and password")
    public ResponseEntity<Map<String, Object>> register(@Valid @RequestBody RegisterRequest request) {
        User user = authService.register(request.getEmail(), request.getPassword());
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of(
                "success", true,
                "user", UserDto.from(user)));
    }

    @PostMapping("/login")
    @Operation(summary = "Log in", description = "Issue a session token, also set as the auth cookie")
    public ResponseEntity<SessionDto> login(@Valid @RequestBody LoginRequest request) {
        Session session = authService.login(request.getEmail(), request.getPassword());
        return ResponseEntity.ok()
                .header(HttpHeaders.SET_COOKIE, authCookie(session.getToken(), jwtTokenProvider.getTtl()).toString())
                .body(SessionDto.from(session));
    }

    @PostMapping("/logout")
    @Operation(summary = "Log out", description = "Revoke the current session and clear the auth cookie")
    public ResponseEntity<Map<String, Object>> logout(HttpServletRequest request) {
        currentUserResolver.findToken(request).ifPresent(authService::logout);
        return ResponseEntity.ok()
                .header(HttpHeaders.SET_COOKIE, authCookie("", Duration.ZERO).toString())
                .body(Map.of("success", true));
    }

    @GetMapping("/me")
    @Operation(summary = "Current user", description = "Get the account behind the session token")
    public ResponseEntity<UserDto> me(HttpServletRequest request) {
        return ResponseEntity.ok(UserDto.from(currentUserResolver.requireUser(request)));
    }

    private static ResponseCookie authCookie(String value, Duration maxAge) {
        return ResponseCookie.from(CurrentUserResolver.AUTH_COOKIE, value)
                .httpOnly(true)
                .path("/")
                .sameSite("Lax")
                .maxAge(maxAge)
                .build();
    }
}
