package com.frogolio.frogol.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Lead entity - an email captured from a visitor on a frogol page
 */
@Entity
@Table(name = "leads", indexes = {
    @Index(name = "idx_leads_frogol_created", columnList = "frogol_id, created_at")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Lead {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "frogol_id", nullable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private Frogol frogol;

    @Column(nullable = false)
    private String email;

    private String source;

    private Integer score;

    @Column(length = 2000)
    private String message;

    @Column(name = "created_at", nullable = false)
    @Builder.Default
    private LocalDateTime createdAt = LocalDateTime.now();
}
