package com.frogolio.frogol.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * DTO for a frogol row on the dashboard
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class FrogolSummaryDto {

    private UUID id;
    private String slug;
    private String displayName;
    private long totalLinks;
    private long totalLeads;
    private long totalClicks;
    private LocalDateTime createdAt;
    private String formattedDate;
}
