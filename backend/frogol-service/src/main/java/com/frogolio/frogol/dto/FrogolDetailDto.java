package com.frogolio.frogol.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import java.util.List;

/**
 * Owner view of a frogol with all links, leads and click stats
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class FrogolDetailDto {

    private FrogolDto frogol;
    private String formattedDate;
    private List<LinkDto> links;
    private List<LeadDto> leads;
    private ClickStatsDto clickStats;
}
