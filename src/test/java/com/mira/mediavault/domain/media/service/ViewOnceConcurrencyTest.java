package com.mira.mediavault.domain.media.service;

import com.mira.mediavault.api.v1.dto.media.ShareMediaRequest;
import com.mira.mediavault.domain.media.enums.AccessDenialReason;
import com.mira.mediavault.domain.media.enums.MediaKind;
import com.mira.mediavault.domain.media.model.MediaOpenResult;
import com.mira.mediavault.integration.conversation.ConversationDirectory;
import com.mira.mediavault.integration.storage.MediaStorageService;
import com.mira.mediavault.support.TestClockConfig;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.mira.mediavault.support.MediaFixtures.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@Import(TestClockConfig.class)
class ViewOnceConcurrencyTest {

    private static final int VIEWERS = 8;

    @Autowired
    private MediaSharingService sharingService;

    @Autowired
    private MediaViewSessionService viewSessionService;

    @Autowired
    private MediaPermissionService permissionService;

    @MockBean
    private ConversationDirectory conversationDirectory;

    @MockBean
    private MediaStorageService storageService;

    @Test
    void open_ParallelOpensOfViewOnce_GrantExactlyOnce() throws Exception {
        when(conversationDirectory.findParticipants(CONVERSATION_ID)).thenReturn(Set.of(OWNER_ID, RECIPIENT_ID));

        ShareMediaRequest request = ShareMediaRequest.builder()
                .conversationId(CONVERSATION_ID)
                .objectKey("uploads/race.jpg")
                .kind(MediaKind.IMAGE)
                .viewOnce(true)
                .build();
        Long mediaId = sharingService.share(OWNER_ID, request).mediaId();

        ExecutorService executor = Executors.newFixedThreadPool(VIEWERS);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<MediaOpenResult>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < VIEWERS; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    return viewSessionService.open(mediaId, RECIPIENT_ID);
                }));
            }
            start.countDown();

            int granted = 0;
            for (Future<MediaOpenResult> future : futures) {
                MediaOpenResult result = future.get(30, TimeUnit.SECONDS);
                if (result.isGranted()) {
                    granted++;
                } else {
                    assertEquals(AccessDenialReason.VIEW_ONCE_CONSUMED, result.denial());
                }
            }
            assertEquals(1, granted);
        } finally {
            executor.shutdownNow();
        }

        assertEquals(1, permissionService.find(mediaId, RECIPIENT_ID).getViewCount());
    }
}
