package com.frogolio.frogol.repository;

import com.frogolio.frogol.entity.Frogol;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface FrogolRepository extends JpaRepository<Frogol, UUID> {

    Optional<Frogol> findBySlug(String slug);

    boolean existsBySlug(String slug);

    long countByUserId(UUID userId);

    @Query("SELECT f.id AS id, f.slug AS slug, f.displayName AS displayName, f.createdAt AS createdAt, "
            + "COUNT(DISTINCT l.id) AS totalLinks, COUNT(DISTINCT ld.id) AS totalLeads, COUNT(DISTINCT c.id) AS totalClicks "
            + "FROM Frogol f "
            + "LEFT JOIN Link l ON l.frogol = f "
            + "LEFT JOIN Lead ld ON ld.frogol = f "
            + "LEFT JOIN Click c ON c.link = l "
            + "WHERE f.user.id = :userId "
            + "GROUP BY f.id, f.slug, f.displayName, f.createdAt "
            + "ORDER BY f.createdAt DESC")
    List<FrogolSummaryView> findSummariesByUserId(UUID userId);

    // bulk delete so the store-level cascade removes links, leads, clicks and images
    @Modifying
    @Query("DELETE FROM Frogol f WHERE f.id = :id")
    int deleteFrogolById(UUID id);
}
