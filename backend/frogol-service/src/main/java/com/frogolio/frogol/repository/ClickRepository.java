package com.frogolio.frogol.repository;

import com.frogolio.frogol.entity.Click;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface ClickRepository extends JpaRepository<Click, UUID> {

    @Query("SELECT COUNT(c) FROM Click c WHERE c.link.frogol.id = :frogolId")
    long countByFrogolId(UUID frogolId);

    @Query("SELECT COUNT(DISTINCT c.ipAddress) FROM Click c WHERE c.link.frogol.id = :frogolId AND c.ipAddress IS NOT NULL")
    long countDistinctIpByFrogolId(UUID frogolId);

    /**
     * Click count of every link of the frogol, active or not; links without clicks report 0
     */
    @Query("SELECT l.id AS linkId, COUNT(c.id) AS clicks FROM Link l "
            + "LEFT JOIN Click c ON c.link = l "
            + "WHERE l.frogol.id = :frogolId "
            + "GROUP BY l.id")
    List<LinkClickCount> countPerLinkByFrogolId(UUID frogolId);

    @Query("SELECT COUNT(c) FROM Click c WHERE c.link.frogol.user.id = :userId")
    long countByOwnerId(UUID userId);
}
