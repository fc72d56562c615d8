package com.frogolio.frogol.repository;

import com.frogolio.frogol.entity.Link;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface LinkRepository extends JpaRepository<Link, UUID> {

    List<Link> findByFrogolIdAndActiveTrueOrderBySortOrderAscIdAsc(UUID frogolId);

    List<Link> findByFrogolIdOrderBySortOrderAscIdAsc(UUID frogolId);

    @Query("SELECT COALESCE(MAX(l.sortOrder), -1) + 1 FROM Link l WHERE l.frogol.id = :frogolId")
    Integer nextSortOrder(UUID frogolId);

    @Query("SELECT COUNT(l) FROM Link l WHERE l.frogol.user.id = :userId")
    long countByOwnerId(UUID userId);
}
