package com.frogolio.frogol.service;

import com.frogolio.frogol.entity.Session;
import com.frogolio.frogol.entity.User;
import com.frogolio.frogol.exception.AuthException;
import com.frogolio.frogol.exception.InvalidInputException;
import com.frogolio.frogol.repository.SessionRepository;
import com.frogolio.frogol.repository.UserRepository;
import com.frogolio.frogol.security.JwtTokenProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.Locale;
import java.util.UUID;

/**
 * Account registration and token-backed sessions
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuthService {

    private final UserRepository userRepository;
    private final SessionRepository sessionRepository;
    private final PasswordEncoder passwordEncoder;
    private final JwtTokenProvider tokenProvider;
    private final Clock clock;

    // ==================== Accounts ====================

    @Transactional
    public User register(String email, String password) {
        String normalizedEmail = email.trim().toLowerCase(Locale.ROOT);

        if (userRepository.existsByEmail(normalizedEmail)) {
            throw new InvalidInputException("User already exists");
        }

        User user = User.builder()
                .email(normalizedEmail)
                .passwordHash(passwordEncoder.encode(password))
                .active(true)
                .build();

        user = userRepository.save(user);
        log.info("Registered user {}", user.getId());
        return user;
    }

    // ==================== Sessions ====================

    /**
     * Check credentials and open a session whose token expires with the session record
     */
    @Transactional
    public Session login(String email, String password) {
        String normalizedEmail = email.trim().toLowerCase(Locale.ROOT);

        User user = userRepository.findByEmail(normalizedEmail)
                .orElseThrow(() -> new AuthException("Invalid credentials"));

        if (user.getPasswordHash() == null || !passwordEncoder.matches(password, user.getPasswordHash())) {
            log.warn("Failed login for user {}", user.getId());
            throw new AuthException("Invalid credentials");
        }
        if (!Boolean.TRUE.equals(user.getActive())) {
            throw new AuthException("Account is disabled");
        }

        Instant now = clock.instant();
        String token = tokenProvider.generateToken(user.getId(), now);

        Session session = Session.builder()
                .user(user)
                .token(token)
                .expiresAt(LocalDateTime.ofInstant(now.plus(tokenProvider.getTtl()), clock.getZone()))
                .createdAt(LocalDateTime.ofInstant(now, clock.getZone()))
                .build();

        session = sessionRepository.save(session);
        log.info("Opened session for user {}", user.getId());
        return session;
    }

    /**
     * Resolve the user behind a token; the token must verify and its session must still be live
     */
    @Transactional(readOnly = true)
    public User validateToken(String token) {
        UUID userId = tokenProvider.parseUserId(token)
                .orElseThrow(() -> new AuthException("Invalid token"));

        Session session = sessionRepository.findByToken(token)
                .orElseThrow(() -> new AuthException("Invalid session"));

        if (session.isExpired(LocalDateTime.now(clock))) {
            throw new AuthException("Session expired");
        }

        User user = userRepository.findById(userId)
                .orElseThrow(() -> new AuthException("User not found"));

        if (!Boolean.TRUE.equals(user.getActive())) {
            throw new AuthException("Account is disabled");
        }
        return user;
    }

    @Transactional
    public void logout(String token) {
        int removed = sessionRepository.deleteByToken(token);
        log.debug("Logout removed {} session(s)", removed);
    }
}
