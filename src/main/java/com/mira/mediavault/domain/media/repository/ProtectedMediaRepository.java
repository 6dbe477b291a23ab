package com.mira.mediavault.domain.media.repository;

import com.mira.mediavault.domain.media.entity.ProtectedMedia;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface ProtectedMediaRepository extends JpaRepository<ProtectedMedia, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT m FROM ProtectedMedia m WHERE m.id = :id")
    Optional<ProtectedMedia> findByIdForUpdate(@Param("id") Long id);

    /**
     * Live ephemeral media where no recipient can open anymore: every permission is
     * revoked, past its timer, or a consumed view-once.
     */
    @Query("""
        SELECT m FROM ProtectedMedia m
        WHERE m.deletedAt IS NULL
          AND (m.timerSeconds IS NOT NULL OR m.viewOnce = true)
          AND NOT EXISTS (
            SELECT p.id FROM MediaPermission p
            WHERE p.media = m
              AND p.revoked = false
              AND (p.expiresAt IS NULL OR p.expiresAt > :now)
              AND (m.viewOnce = false OR p.viewCount < 1)
          )
        ORDER BY m.id ASC
        """)
    List<ProtectedMedia> findSpentEphemeralMedia(@Param("now") LocalDateTime now, Pageable pageable);
}
