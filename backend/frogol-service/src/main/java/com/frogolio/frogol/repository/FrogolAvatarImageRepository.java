package com.frogolio.frogol.repository;

import com.frogolio.frogol.entity.FrogolAvatarImage;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface FrogolAvatarImageRepository extends JpaRepository<FrogolAvatarImage, UUID> {

    List<FrogolAvatarImage> findByFrogolId(UUID frogolId);

    Optional<FrogolAvatarImage> findFirstByFrogolIdOrderByCreatedAtDesc(UUID frogolId);

    @Modifying
    @Query("DELETE FROM FrogolAvatarImage i WHERE i.frogol.id = :frogolId")
    int deleteAllByFrogolId(UUID frogolId);
}
