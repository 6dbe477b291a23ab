package com.mira.mediavault.domain.media.service;

import com.mira.mediavault.domain.media.entity.MediaPermission;
import com.mira.mediavault.domain.media.entity.ProtectedMedia;
import com.mira.mediavault.domain.media.entity.SecurityEvent;
import com.mira.mediavault.domain.media.enums.ScreenshotMode;
import com.mira.mediavault.domain.media.enums.SecurityEventType;
import com.mira.mediavault.domain.media.repository.MediaPermissionRepository;
import com.mira.mediavault.domain.media.repository.ProtectedMediaRepository;
import com.mira.mediavault.domain.media.repository.SecurityEventRepository;
import com.mira.mediavault.event.DomainEventListener.MediaSystemMessageEvent;
import com.mira.mediavault.exception.BusinessException;
import com.mira.mediavault.exception.DuplicateResourceException;
import com.mira.mediavault.exception.ResourceNotFoundException;
import com.mira.mediavault.exception.UnauthorizedActionException;
import com.mira.mediavault.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.List;
import java.util.Optional;

import static com.mira.mediavault.support.MediaFixtures.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MediaPermissionServiceTest {

    private static final Long MEDIA_ID = 200L;

    @Mock
    private MediaPermissionRepository permissionRepository;

    @Mock
    private ProtectedMediaRepository mediaRepository;

    @Mock
    private SecurityEventRepository eventRepository;

    @Mock
    private ApplicationEventPublisher eventPublisher;

    private MutableClock clock;
    private MediaPermissionService permissionService;
    private ProtectedMedia media;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        MediaRegistryService registryService = new MediaRegistryService(mediaRepository, eventPublisher, clock);
        SecurityEventService securityEventService = new SecurityEventService(eventRepository, mediaRepository, clock);
        MediaSystemMessagePublisher systemMessagePublisher = new MediaSystemMessagePublisher(eventPublisher, clock);

        permissionService = new MediaPermissionService(permissionRepository, registryService,
                securityEventService, systemMessagePublisher, clock);
        ReflectionTestUtils.setField(permissionService, "timedGrantMinutes", 10L);

        media = media(MEDIA_ID).build();
        lenient().when(permissionRepository.save(any(MediaPermission.class))).thenAnswer(inv -> inv.getArgument(0));
        lenient().when(eventRepository.save(any(SecurityEvent.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    @Test
    void createPermission_NewRecipient_AppliesDefaults() {
        when(permissionRepository.existsByMediaIdAndRecipientId(MEDIA_ID, RECIPIENT_ID)).thenReturn(false);
        when(permissionRepository.saveAndFlush(any(MediaPermission.class))).thenAnswer(inv -> inv.getArgument(0));

        MediaPermission permission = permissionService.createPermission(media, OWNER_ID, RECIPIENT_ID);

        assertTrue(permission.isCanView());
        assertFalse(permission.isCanScreenshot());
        assertFalse(permission.isRevoked());
        assertEquals(0, permission.getViewCount());
        assertNull(permission.getOpenedAt());
        assertNull(permission.getExpiresAt());
        assertEquals(T0, permission.getCreatedAt());
    }

    @Test
    void createPermission_ExistingPair_ThrowsDuplicate() {
        when(permissionRepository.existsByMediaIdAndRecipientId(MEDIA_ID, RECIPIENT_ID)).thenReturn(true);

        assertThrows(DuplicateResourceException.class,
                () -> permissionService.createPermission(media, OWNER_ID, RECIPIENT_ID));
        verify(permissionRepository, never()).saveAndFlush(any());
    }

    @Test
    void createPermission_ConcurrentInsertWins_ThrowsDuplicate() {
        when(permissionRepository.existsByMediaIdAndRecipientId(MEDIA_ID, RECIPIENT_ID)).thenReturn(false);
        when(permissionRepository.saveAndFlush(any(MediaPermission.class)))
                .thenThrow(new DataIntegrityViolationException("uk_media_permission_recipient"));

        assertThrows(DuplicateResourceException.class,
                () -> permissionService.createPermission(media, OWNER_ID, RECIPIENT_ID));
    }

    @Test
    void createPermission_OwnerAsRecipient_ThrowsException() {
        assertThrows(BusinessException.class, () -> permissionService.createPermission(media, OWNER_ID, OWNER_ID));
    }

    @Test
    void find_Missing_ThrowsNotFound() {
        when(permissionRepository.findByMediaIdAndRecipientId(MEDIA_ID, OUTSIDER_ID)).thenReturn(Optional.empty());

        assertThrows(ResourceNotFoundException.class, () -> permissionService.find(MEDIA_ID, OUTSIDER_ID));
    }

    @Test
    void grantScreenshot_On_GrantsWithoutBound() {
        MediaPermission permission = permission(1L, media, RECIPIENT_ID).build();
        when(mediaRepository.findById(MEDIA_ID)).thenReturn(Optional.of(media));
        when(permissionRepository.findForUpdate(MEDIA_ID, RECIPIENT_ID)).thenReturn(Optional.of(permission));

        permissionService.grantScreenshot(MEDIA_ID, RECIPIENT_ID, ScreenshotMode.ON, OWNER_ID);

        assertTrue(permission.isCanScreenshot());
        assertNull(permission.getAllowedUntil());
        clock.advanceSeconds(86_400);
        assertTrue(permission.isScreenshotAllowedAt(clock.now()));
    }

    @Test
    void grantScreenshot_OnForTenMinutes_SetsAllowedUntil() {
        MediaPermission permission = permission(1L, media, RECIPIENT_ID).build();
        when(mediaRepository.findById(MEDIA_ID)).thenReturn(Optional.of(media));
        when(permissionRepository.findForUpdate(MEDIA_ID, RECIPIENT_ID)).thenReturn(Optional.of(permission));

        permissionService.grantScreenshot(MEDIA_ID, RECIPIENT_ID, ScreenshotMode.ON_FOR_10_MIN, OWNER_ID);

        assertTrue(permission.isCanScreenshot());
        assertEquals(T0.plusMinutes(10), permission.getAllowedUntil());
        assertTrue(permission.isScreenshotAllowedAt(T0.plusMinutes(9)));
        assertFalse(permission.isScreenshotAllowedAt(T0.plusMinutes(10)));

        ArgumentCaptor<SecurityEvent> eventCaptor = ArgumentCaptor.forClass(SecurityEvent.class);
        verify(eventRepository).save(eventCaptor.capture());
        assertEquals(SecurityEventType.PERMISSION_GRANTED, eventCaptor.getValue().getEventType());
        assertEquals("ON_FOR_10_MIN", eventCaptor.getValue().getMetadata().get("mode"));
        assertEquals(RECIPIENT_ID, eventCaptor.getValue().getMetadata().get("recipientId"));

        ArgumentCaptor<MediaSystemMessageEvent> messageCaptor = ArgumentCaptor.forClass(MediaSystemMessageEvent.class);
        verify(eventPublisher).publishEvent(messageCaptor.capture());
        assertEquals("Screenshot access granted (10 min)", messageCaptor.getValue().content());
    }

    @Test
    void grantScreenshot_Off_ClearsGrantAndLogsRevocation() {
        MediaPermission permission = permission(1L, media, RECIPIENT_ID)
                .canScreenshot(true)
                .allowedUntil(T0.plusMinutes(5))
                .build();
        when(mediaRepository.findById(MEDIA_ID)).thenReturn(Optional.of(media));
        when(permissionRepository.findForUpdate(MEDIA_ID, RECIPIENT_ID)).thenReturn(Optional.of(permission));

        permissionService.grantScreenshot(MEDIA_ID, RECIPIENT_ID, ScreenshotMode.OFF, OWNER_ID);

        assertFalse(permission.isCanScreenshot());
        assertNull(permission.getAllowedUntil());

        ArgumentCaptor<SecurityEvent> eventCaptor = ArgumentCaptor.forClass(SecurityEvent.class);
        verify(eventRepository).save(eventCaptor.capture());
        assertEquals(SecurityEventType.PERMISSION_REVOKED, eventCaptor.getValue().getEventType());
    }

    @Test
    void grantScreenshot_NonOwner_ThrowsUnauthorizedWithoutTouchingRow() {
        when(mediaRepository.findById(MEDIA_ID)).thenReturn(Optional.of(media));

        assertThrows(UnauthorizedActionException.class,
                () -> permissionService.grantScreenshot(MEDIA_ID, RECIPIENT_ID, ScreenshotMode.ON, RECIPIENT_ID));
        verifyNoInteractions(permissionRepository, eventRepository, eventPublisher);
    }

    @Test
    void grantScreenshot_UnknownRecipient_ThrowsNotFound() {
        when(mediaRepository.findById(MEDIA_ID)).thenReturn(Optional.of(media));
        when(permissionRepository.findForUpdate(MEDIA_ID, OUTSIDER_ID)).thenReturn(Optional.empty());

        assertThrows(ResourceNotFoundException.class,
                () -> permissionService.grantScreenshot(MEDIA_ID, OUTSIDER_ID, ScreenshotMode.ON, OWNER_ID));
    }

    @Test
    void revoke_Twice_SecondCallChangesNothing() {
        MediaPermission permission = permission(1L, media, RECIPIENT_ID).build();
        when(permissionRepository.findForUpdate(MEDIA_ID, RECIPIENT_ID)).thenReturn(Optional.of(permission));

        assertTrue(permissionService.revoke(MEDIA_ID, RECIPIENT_ID));
        assertFalse(permissionService.revoke(MEDIA_ID, RECIPIENT_ID));

        assertTrue(permission.isRevoked());
        verify(permissionRepository, times(1)).save(permission);
    }

    @Test
    void revokeAll_CountsOnlyNewlyRevokedRows() {
        MediaPermission live = permission(1L, media, RECIPIENT_ID).build();
        MediaPermission alreadyRevoked = permission(2L, media, 3L).revoked(true).build();
        when(permissionRepository.findAllForUpdate(MEDIA_ID)).thenReturn(List.of(live, alreadyRevoked));

        assertEquals(1, permissionService.revokeAll(MEDIA_ID));
        assertTrue(live.isRevoked());
        assertTrue(alreadyRevoked.isRevoked());
    }

    @Test
    void revokeAccess_Owner_LogsAccessRevokedOnce() {
        MediaPermission permission = permission(1L, media, RECIPIENT_ID).build();
        when(mediaRepository.findById(MEDIA_ID)).thenReturn(Optional.of(media));
        when(permissionRepository.findForUpdate(MEDIA_ID, RECIPIENT_ID)).thenReturn(Optional.of(permission));

        assertTrue(permissionService.revokeAccess(MEDIA_ID, RECIPIENT_ID, OWNER_ID));
        assertFalse(permissionService.revokeAccess(MEDIA_ID, RECIPIENT_ID, OWNER_ID));

        ArgumentCaptor<SecurityEvent> eventCaptor = ArgumentCaptor.forClass(SecurityEvent.class);
        verify(eventRepository, times(1)).save(eventCaptor.capture());
        assertEquals(SecurityEventType.ACCESS_REVOKED, eventCaptor.getValue().getEventType());
        verify(eventPublisher, times(1)).publishEvent(any(MediaSystemMessageEvent.class));
    }

    @Test
    void revokeAccess_Recipient_ThrowsUnauthorized() {
        when(mediaRepository.findById(MEDIA_ID)).thenReturn(Optional.of(media));

        assertThrows(UnauthorizedActionException.class,
                () -> permissionService.revokeAccess(MEDIA_ID, RECIPIENT_ID, RECIPIENT_ID));
        verify(permissionRepository, never()).findForUpdate(any(), any());
    }
}
