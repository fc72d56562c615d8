package com.frogolio.frogol.entity;

import jakarta.persistence.*;
import lombok.*;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Frogol entity - a user's public link-in-bio page, addressed by its slug
 */
@Entity
@Table(name = "frogols", indexes = {
    @Index(name = "idx_frogols_user", columnList = "user_id")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Frogol {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "user_id", nullable = false)
    private User user;

    @Column(unique = true, nullable = false, length = 100)
    private String slug;

    @Column(name = "display_name")
    private String displayName;

    private String theme;

    @Column(name = "avatar_url")
    private String avatarUrl;

    @Column(length = 2000)
    private String bio;

    @Column(name = "created_at", nullable = false)
    @Builder.Default
    private LocalDateTime createdAt = LocalDateTime.now();

    public boolean isOwnedBy(UUID userId) {
        return user != null && user.getId() != null && user.getId().equals(userId);
    }
}
