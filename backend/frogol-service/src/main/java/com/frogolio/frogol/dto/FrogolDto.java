package com.frogolio.frogol.dto;

import com.frogolio.frogol.entity.Frogol;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * DTO for frogol info
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class FrogolDto {

    private UUID id;
    private UUID userId;
    private String slug;
    private String displayName;
    private String theme;
    private String avatarUrl;
    private String bio;
    private LocalDateTime createdAt;

    public static FrogolDto from(Frogol frogol) {
        return FrogolDto.builder()
                .id(frogol.getId())
                .userId(frogol.getUser() != null ? frogol.getUser().getId() : null)
                .slug(frogol.getSlug())
                .displayName(frogol.getDisplayName())
                .theme(frogol.getTheme())
                .avatarUrl(frogol.getAvatarUrl())
                .bio(frogol.getBio())
                .createdAt(frogol.getCreatedAt())
                .build();
    }
}
