package com.frogolio.frogol.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Metadata of an image file stored for a frogol
 */
@Entity
@Table(name = "frogol_avatar_images", indexes = {
    @Index(name = "idx_frogol_avatar_images_frogol_id", columnList = "frogol_id")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class FrogolAvatarImage {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "frogol_id", nullable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private Frogol frogol;

    @Column(name = "image_filename", nullable = false)
    private String imageFilename;

    @Column(name = "created_at", nullable = false)
    @Builder.Default
    private LocalDateTime createdAt = LocalDateTime.now();
}
