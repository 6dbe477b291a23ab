package com.mira.mediavault.domain.media.repository;

import com.mira.mediavault.domain.media.entity.SecurityEvent;
import com.mira.mediavault.domain.media.enums.SecurityEventType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface SecurityEventRepository extends JpaRepository<SecurityEvent, Long> {

    List<SecurityEvent> findByMediaIdOrderByCreatedAtAscIdAsc(Long mediaId);

    List<SecurityEvent> findByMediaIdAndEventTypeOrderByCreatedAtAscIdAsc(Long mediaId, SecurityEventType eventType);

    boolean existsByMediaIdAndActorIdAndEventType(Long mediaId, Long actorId, SecurityEventType eventType);

    boolean existsByMediaIdAndEventType(Long mediaId, SecurityEventType eventType);

    @Query("SELECT e.eventType, COUNT(e) FROM SecurityEvent e WHERE e.mediaId = :mediaId GROUP BY e.eventType")
    List<Object[]> countByEventTypeForMedia(@Param("mediaId") Long mediaId);
}
