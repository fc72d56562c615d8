package com.frogolio.frogol.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import java.util.List;

/**
 * DTO for the dashboard landing view
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DashboardDto {

    private String userEmail;
    private List<FrogolSummaryDto> frogols;
    private int frogolsCount;
    private long totalLeads;
    private long totalClicks;
}
