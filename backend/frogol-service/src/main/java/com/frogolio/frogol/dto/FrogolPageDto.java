package com.frogolio.frogol.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import java.util.List;
import java.util.UUID;

/**
 * Public view of a frogol: profile plus its active links
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class FrogolPageDto {

    private UUID frogolId;
    private String slug;
    private String displayName;
    private String theme;
    private String avatarUrl;
    private String bio;
    private List<LinkDto> links;
}
