package com.frogolio.frogol.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import java.util.Map;
import java.util.UUID;

/**
 * Click totals of one frogol
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ClickStatsDto {

    private long totalClicks;
    private long uniqueClicks;
    private Map<UUID, Long> perLinkClicks;
}
