package com.frogolio.frogol.repository;

import com.frogolio.frogol.entity.Session;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface SessionRepository extends JpaRepository<Session, UUID> {

    Optional<Session> findByToken(String token);

    @Modifying
    @Query("DELETE FROM Session s WHERE s.token = :token")
    int deleteByToken(String token);
}
