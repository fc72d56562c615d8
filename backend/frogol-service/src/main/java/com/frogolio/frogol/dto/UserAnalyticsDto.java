package com.frogolio.frogol.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import java.util.List;

/**
 * DTO for the analytics dashboard
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class UserAnalyticsDto {

    private long totalFrogols;
    private long totalLinks;
    private long totalLeads;
    private long totalClicks;
    private List<FrogolSummaryDto> topPerformingFrogols;
}
