package com.frogolio.frogol.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Outbound link shown on a frogol, ordered by sortOrder
 */
@Entity
@Table(name = "links", indexes = {
    @Index(name = "idx_links_frogol_active_order", columnList = "frogol_id, is_active, sort_order")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Link {

    public static final String DEFAULT_KIND = "link";

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "frogol_id", nullable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private Frogol frogol;

    @Column(nullable = false, length = 2048)
    private String url;

    @Column(nullable = false)
    private String label;

    @Column(name = "sort_order", nullable = false)
    @Builder.Default
    private Integer sortOrder = 0;

    @Column(name = "is_active", nullable = false)
    @Builder.Default
    private Boolean active = true;

    @Column(nullable = false, length = 32)
    @Builder.Default
    private String kind = DEFAULT_KIND;

    @Column(name = "created_at", nullable = false)
    @Builder.Default
    private LocalDateTime createdAt = LocalDateTime.now();
}
