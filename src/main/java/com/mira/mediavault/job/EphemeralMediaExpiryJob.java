package com.mira.mediavault.job;

import com.mira.mediavault.domain.media.entity.ProtectedMedia;
import com.mira.mediavault.domain.media.service.MediaRegistryService;
import com.mira.mediavault.domain.media.service.MediaViewSessionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Ephemeral Media Expiry Job
 * Burns timer and view-once media that no recipient can open anymore, for clients that
 * never reported the close themselves. Each item is closed in its own transaction.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "media.expiry-sweep.enabled", havingValue = "true", matchIfMissing = true)
public class EphemeralMediaExpiryJob {

    private final MediaRegistryService registryService;
    private final MediaViewSessionService viewSessionService;

    @Value("${media.expiry-sweep.batch-size:100}")
    private int batchSize;

    @Scheduled(fixedDelayString = "${media.expiry-sweep.interval-ms:60000}",
            initialDelayString = "${media.expiry-sweep.initial-delay-ms:30000}")
    public void burnSpentMedia() {
        List<ProtectedMedia> spent = registryService.findSpentEphemeralMedia(batchSize);
        if (spent.isEmpty()) {
            return;
        }

        log.info("Expiry sweep found {} spent ephemeral media", spent.size());
        int burned = 0;

        for (ProtectedMedia media : spent) {
            try {
                if (viewSessionService.close(media.getId(), media.getOwnerId(), Map.of("trigger", "sweep"))) {
                    burned++;
                }
            } catch (Exception e) {
                log.error("Expiry sweep failed for media {}", media.getId(), e);
            }
        }

        log.info("Expiry sweep burned {} of {} media", burned, spent.size());
    }
}
