package com.mira.mediavault.domain.media.repository;

import com.mira.mediavault.domain.media.entity.MediaPermission;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface MediaPermissionRepository extends JpaRepository<MediaPermission, Long> {

    Optional<MediaPermission> findByMediaIdAndRecipientId(Long mediaId, Long recipientId);

    boolean existsByMediaIdAndRecipientId(Long mediaId, Long recipientId);

    /**
     * Row locks on every permission of a media item, taken in id order.
     * Revocation writes whole rows back, so it must not start from a copy read before a concurrent open committed.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM MediaPermission p WHERE p.media.id = :mediaId ORDER BY p.id ASC")
    List<MediaPermission> findAllForUpdate(@Param("mediaId") Long mediaId);

    /**
     * Row lock on the (media, recipient) pair; serializes concurrent opens and revocations.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM MediaPermission p WHERE p.media.id = :mediaId AND p.recipientId = :recipientId")
    Optional<MediaPermission> findForUpdate(@Param("mediaId") Long mediaId,
                                            @Param("recipientId") Long recipientId);
}
