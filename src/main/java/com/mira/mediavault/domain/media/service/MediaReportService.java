package com.mira.mediavault.domain.media.service;

import com.mira.mediavault.domain.media.entity.MediaReport;
import com.mira.mediavault.domain.media.entity.ProtectedMedia;
import com.mira.mediavault.domain.media.enums.MediaReportReason;
import com.mira.mediavault.domain.media.repository.MediaReportRepository;
import com.mira.mediavault.exception.BusinessException;
import com.mira.mediavault.exception.UnauthorizedActionException;
import com.mira.mediavault.integration.conversation.ConversationDirectory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Report intake for protected media. Burned media can still be reported.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MediaReportService {

    private final MediaReportRepository reportRepository;
    private final MediaRegistryService registryService;
    private final ConversationDirectory conversationDirectory;
    private final Clock clock;

    /**
     * @param reportedUserId user being reported, defaults to the media owner
     * @return the new report, in pending state
     */
    @Transactional
    public MediaReport report(Long mediaId, Long reporterId, Long reportedUserId,
                              MediaReportReason reason, String description) {
        ProtectedMedia media = registryService.get(mediaId);

        if (!isInvolved(media, reporterId)) {
            log.warn("[MediaReport] Non-participant {} tried to report media {}", reporterId, mediaId);
            throw new UnauthorizedActionException("Not a participant of this conversation");
        }

        Long reported = reportedUserId != null ? reportedUserId : media.getOwnerId();
        if (reported.equals(reporterId)) {
            throw new BusinessException("You cannot report yourself");
        }
        if (!isInvolved(media, reported)) {
            throw new BusinessException("Reported user is not part of this conversation");
        }

        MediaReport report = reportRepository.save(MediaReport.builder()
                .conversationId(media.getConversationId())
                .mediaId(media.getId())
                .reporterId(reporterId)
                .reportedUserId(reported)
                .reason(reason)
                .description(description == null || description.isBlank() ? null : description.trim())
                .createdAt(LocalDateTime.now(clock))
                .build());

        log.info("[MediaReport] Report {} on media {} by {} against {} ({})",
                report.getId(), mediaId, reporterId, reported, reason.getCode());
        return report;
    }

    private boolean isInvolved(ProtectedMedia media, Long userId) {
        return media.isOwnedBy(userId) || conversationDirectory.isParticipant(media.getConversationId(), userId);
    }
}
