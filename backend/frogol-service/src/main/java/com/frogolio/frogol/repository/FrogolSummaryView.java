package com.frogolio.frogol.repository;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Projection of a frogol with its link, lead and click counts
 */
public interface FrogolSummaryView {

    UUID getId();

    String getSlug();

    String getDisplayName();

    LocalDateTime getCreatedAt();

    Long getTotalLinks();

    Long getTotalLeads();

    Long getTotalClicks();
}
