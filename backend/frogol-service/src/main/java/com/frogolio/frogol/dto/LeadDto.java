package com.frogolio.frogol.dto;

import com.frogolio.frogol.entity.Lead;
import com.frogolio.frogol.service.DisplayDates;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * DTO for lead info
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LeadDto {

    private UUID id;
    private UUID frogolId;
    private String email;
    private String source;
    private Integer score;
    private String message;
    private LocalDateTime createdAt;
    private String formattedDate;

    public static LeadDto from(Lead lead) {
        return LeadDto.builder()
                .id(lead.getId())
                .frogolId(lead.getFrogol() != null ? lead.getFrogol().getId() : null)
                .email(lead.getEmail())
                .source(lead.getSource())
                .score(lead.getScore())
                .message(lead.getMessage())
                .createdAt(lead.getCreatedAt())
                .formattedDate(DisplayDates.format(lead.getCreatedAt()))
                .build();
    }
}
