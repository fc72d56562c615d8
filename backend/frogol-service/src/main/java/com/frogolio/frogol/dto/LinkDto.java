package com.frogolio.frogol.dto;

import com.frogolio.frogol.entity.Link;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import java.util.UUID;

/**
 * DTO for link info; clicks is only filled on dashboard views
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LinkDto {

    private UUID id;
    private UUID frogolId;
    private String url;
    private String label;
    private int sortOrder;
    private boolean active;
    private String kind;
    private long clicks;

    public static LinkDto from(Link link) {
        return LinkDto.builder()
                .id(link.getId())
                .frogolId(link.getFrogol() != null ? link.getFrogol().getId() : null)
                .url(link.getUrl())
                .label(link.getLabel())
                .sortOrder(link.getSortOrder() != null ? link.getSortOrder() : 0)
                .active(Boolean.TRUE.equals(link.getActive()))
                .kind(link.getKind())
                .build();
    }
}
