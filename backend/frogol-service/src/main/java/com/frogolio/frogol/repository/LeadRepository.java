package com.frogolio.frogol.repository;

import com.frogolio.frogol.entity.Lead;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface LeadRepository extends JpaRepository<Lead, UUID> {

    List<Lead> findByFrogolIdOrderByCreatedAtDesc(UUID frogolId);

    @Query("SELECT COUNT(l) FROM Lead l WHERE l.frogol.user.id = :userId")
    long countByOwnerId(UUID userId);
}
