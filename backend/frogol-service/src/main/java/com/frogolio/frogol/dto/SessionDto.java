package com.frogolio.frogol.dto;

import com.frogolio.frogol.entity.Session;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Issued session token
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SessionDto {

    private UUID userId;
    private String token;
    private LocalDateTime expiresAt;

    public static SessionDto from(Session session) {
        return SessionDto.builder()
                .userId(session.getUser().getId())
                .token(session.getToken())
                .expiresAt(session.getExpiresAt())
                .build();
    }
}
