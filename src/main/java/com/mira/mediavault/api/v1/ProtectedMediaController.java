package com.mira.mediavault.api.v1;

import com.mira.mediavault.api.v1.dto.media.MediaReportRequest;
import com.mira.mediavault.api.v1.dto.media.ScreenshotPermissionRequest;
import com.mira.mediavault.api.v1.dto.media.ScreenshotReportRequest;
import com.mira.mediavault.api.v1.dto.media.SecurityEventResponse;
import com.mira.mediavault.api.v1.dto.media.ShareMediaRequest;
import com.mira.mediavault.domain.media.entity.MediaPermission;
import com.mira.mediavault.domain.media.entity.MediaReport;
import com.mira.mediavault.domain.media.enums.AccessDenialReason;
import com.mira.mediavault.domain.media.enums.MediaReportReason;
import com.mira.mediavault.domain.media.enums.SecurityEventType;
import com.mira.mediavault.domain.media.model.MediaInfo;
import com.mira.mediavault.domain.media.model.MediaOpenResult;
import com.mira.mediavault.domain.media.model.SharedMedia;
import com.mira.mediavault.domain.media.service.MediaPermissionService;
import com.mira.mediavault.domain.media.service.MediaReportService;
import com.mira.mediavault.domain.media.service.MediaSharingService;
import com.mira.mediavault.domain.media.service.MediaViewSessionService;
import com.mira.mediavault.domain.media.service.ScreenshotPermissionService;
import com.mira.mediavault.domain.media.service.SecurityEventService;
import com.mira.mediavault.exception.BusinessException;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * REST Controller for protected media.
 * Caller identity arrives in the X-User-Id header, set by the authenticating gateway.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/protected-media")
@RequiredArgsConstructor
public class ProtectedMediaController {

    static final String USER_HEADER = "X-User-Id";

    private final MediaSharingService sharingService;
    private final MediaViewSessionService viewSessionService;
    private final MediaPermissionService permissionService;
    private final ScreenshotPermissionService screenshotPermissionService;
    private final SecurityEventService securityEventService;
    private final MediaReportService reportService;

    /**
     * Share a protected media item into a conversation
     */
    @PostMapping
    public ResponseEntity<SharedMedia> share(
            @RequestHeader(USER_HEADER) Long userId,
            @Valid @RequestBody ShareMediaRequest request) {
        log.info("[ProtectedMediaController] Sharing media in conversation {} by user {}",
                request.getConversationId(), userId);

        SharedMedia shared = sharingService.share(userId, request);
        return ResponseEntity.status(HttpStatus.CREATED).body(shared);
    }

    /**
     * Media status for the chat bubble; does not count as a view
     */
    @GetMapping("/{mediaId}")
    public ResponseEntity<MediaInfo> describe(
            @RequestHeader(USER_HEADER) Long userId,
            @PathVariable Long mediaId) {
        return ResponseEntity.ok(viewSessionService.describe(mediaId, userId));
    }

    /**
     * Open a media item. Denials are normal outcomes and carry a reason code.
     */
    @PostMapping("/{mediaId}/open")
    public ResponseEntity<?> open(
            @RequestHeader(USER_HEADER) Long userId,
            @PathVariable Long mediaId) {
        MediaOpenResult result = viewSessionService.open(mediaId, userId);

        if (result.isGranted()) {
            return ResponseEntity.ok(result.grant());
        }

        AccessDenialReason reason = result.denial();
        Map<String, Object> response = new HashMap<>();
        response.put("status", "denied");
        response.put("reason", reason.getCode());
        response.put("mediaId", mediaId);

        HttpStatus status = reason.isTerminal() ? HttpStatus.GONE : HttpStatus.FORBIDDEN;
        return ResponseEntity.status(status).body(response);
    }

    /**
     * Expire a media item for every recipient
     */
    @PostMapping("/{mediaId}/close")
    public ResponseEntity<Map<String, Object>> close(
            @RequestHeader(USER_HEADER) Long userId,
            @PathVariable Long mediaId) {
        boolean closed = viewSessionService.close(mediaId, userId);

        Map<String, Object> response = new HashMap<>();
        response.put("status", closed ? "expired" : "already_expired");
        response.put("mediaId", mediaId);
        return ResponseEntity.ok(response);
    }

    @PutMapping("/{mediaId}/permissions/{recipientId}/screenshot")
    public ResponseEntity<Map<String, Object>> setScreenshotPermission(
            @RequestHeader(USER_HEADER) Long userId,
            @PathVariable Long mediaId,
            @PathVariable Long recipientId,
            @Valid @RequestBody ScreenshotPermissionRequest request) {
        MediaPermission permission = screenshotPermissionService.setScreenshotPermission(
                mediaId, recipientId, request.mode(), userId);

        Map<String, Object> response = new HashMap<>();
        response.put("status", "updated");
        response.put("recipientId", recipientId);
        response.put("canScreenshot", permission.isCanScreenshot());
        response.put("allowedUntil", permission.getAllowedUntil());
        return ResponseEntity.ok(response);
    }

    @DeleteMapping("/{mediaId}/permissions/{recipientId}")
    public ResponseEntity<Map<String, Object>> revokeAccess(
            @RequestHeader(USER_HEADER) Long userId,
            @PathVariable Long mediaId,
            @PathVariable Long recipientId) {
        boolean revoked = permissionService.revokeAccess(mediaId, recipientId, userId);

        Map<String, Object> response = new HashMap<>();
        response.put("status", revoked ? "revoked" : "already_revoked");
        response.put("recipientId", recipientId);
        return ResponseEntity.ok(response);
    }

    @PostMapping("/{mediaId}/screenshot-requests")
    public ResponseEntity<Map<String, Object>> requestScreenshotAccess(
            @RequestHeader(USER_HEADER) Long userId,
            @PathVariable Long mediaId) {
        screenshotPermissionService.requestAccess(mediaId, userId);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of("status", "requested"));
    }

    /**
     * Screenshot hook report from the device
     */
    @PostMapping("/{mediaId}/screenshots")
    public ResponseEntity<Map<String, Object>> reportScreenshot(
            @RequestHeader(USER_HEADER) Long userId,
            @PathVariable Long mediaId,
            @Valid @RequestBody ScreenshotReportRequest request) {
        if (request.taken()) {
            screenshotPermissionService.reportScreenshotTaken(mediaId, userId);
        } else {
            screenshotPermissionService.reportScreenshotAttempted(mediaId, userId);
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("status", "logged"));
    }

    /**
     * Owner-only audit trail
     */
    @GetMapping("/{mediaId}/security-events")
    public ResponseEntity<List<SecurityEventResponse>> getSecurityEvents(
            @RequestHeader(USER_HEADER) Long userId,
            @PathVariable Long mediaId,
            @RequestParam(required = false) String type) {
        SecurityEventType eventType = parseType(type);

        List<SecurityEventResponse> events = securityEventService.listForMedia(mediaId, userId, eventType).stream()
                .map(SecurityEventResponse::fromEntity)
                .toList();
        return ResponseEntity.ok(events);
    }

    @GetMapping("/{mediaId}/security-events/stats")
    public ResponseEntity<Map<String, Long>> getSecurityEventStats(
            @RequestHeader(USER_HEADER) Long userId,
            @PathVariable Long mediaId) {
        return ResponseEntity.ok(securityEventService.countByType(mediaId, userId));
    }

    @PostMapping("/{mediaId}/reports")
    public ResponseEntity<Map<String, Object>> report(
            @RequestHeader(USER_HEADER) Long userId,
            @PathVariable Long mediaId,
            @Valid @RequestBody MediaReportRequest request) {
        MediaReportReason reason;
        try {
            reason = MediaReportReason.fromCode(request.reason());
        } catch (IllegalArgumentException e) {
            throw new BusinessException("Unknown report reason: " + request.reason());
        }

        MediaReport report = reportService.report(mediaId, userId, request.reportedUserId(),
                reason, request.description());

        Map<String, Object> response = new HashMap<>();
        response.put("status", report.getStatus().getCode());
        response.put("reportId", report.getId());
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    private SecurityEventType parseType(String type) {
        if (type == null || type.isBlank()) {
            return null;
        }
        try {
            return SecurityEventType.fromCode(type);
        } catch (IllegalArgumentException e) {
            throw new BusinessException("Unknown event type: " + type);
        }
    }
}
