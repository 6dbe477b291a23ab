package com.mira.mediavault.job;

import com.mira.mediavault.domain.media.entity.ProtectedMedia;
import com.mira.mediavault.domain.media.service.MediaRegistryService;
import com.mira.mediavault.domain.media.service.MediaViewSessionService;
import com.mira.mediavault.exception.ResourceNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.List;
import java.util.Map;

import static com.mira.mediavault.support.MediaFixtures.*;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class EphemeralMediaExpiryJobTest {

    @Mock
    private MediaRegistryService registryService;

    @Mock
    private MediaViewSessionService viewSessionService;

    @InjectMocks
    private EphemeralMediaExpiryJob expiryJob;

    @BeforeEach
    void setUp() {
        ReflectionTestUtils.setField(expiryJob, "batchSize", 50);
    }

    @Test
    void burnSpentMedia_ClosesEachItemAsOwner() {
        ProtectedMedia first = media(1L).viewOnce(true).build();
        ProtectedMedia second = media(2L).timerSeconds(5).build();
        when(registryService.findSpentEphemeralMedia(50)).thenReturn(List.of(first, second));

        expiryJob.burnSpentMedia();

        verify(viewSessionService).close(1L, OWNER_ID, Map.of("trigger", "sweep"));
        verify(viewSessionService).close(2L, OWNER_ID, Map.of("trigger", "sweep"));
    }

    @Test
    void burnSpentMedia_OneItemFails_ContinuesWithTheRest() {
        ProtectedMedia first = media(1L).viewOnce(true).build();
        ProtectedMedia second = media(2L).viewOnce(true).build();
        when(registryService.findSpentEphemeralMedia(50)).thenReturn(List.of(first, second));
        when(viewSessionService.close(1L, OWNER_ID, Map.of("trigger", "sweep")))
                .thenThrow(new ResourceNotFoundException("ProtectedMedia", 1L));

        expiryJob.burnSpentMedia();

        verify(viewSessionService).close(2L, OWNER_ID, Map.of("trigger", "sweep"));
    }

    @Test
    void burnSpentMedia_NothingSpent_DoesNothing() {
        when(registryService.findSpentEphemeralMedia(50)).thenReturn(List.of());

        expiryJob.burnSpentMedia();

        verify(viewSessionService, never()).close(anyLong(), anyLong(), anyMap());
    }
}
