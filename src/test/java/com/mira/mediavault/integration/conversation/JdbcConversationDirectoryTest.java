package com.mira.mediavault.integration.conversation;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class JdbcConversationDirectoryTest {

    @Mock
    private JdbcTemplate jdbcTemplate;

    @InjectMocks
    private JdbcConversationDirectory directory;

    @Test
    void isParticipant_MemberAndStranger() {
        when(jdbcTemplate.queryForList(anyString(), eq(Long.class), eq(10L))).thenReturn(List.of(1L, 2L));

        assertTrue(directory.isParticipant(10L, 2L));
        assertFalse(directory.isParticipant(10L, 99L));
    }

    @Test
    void findParticipants_NullConversation_ReturnsEmptyWithoutQuery() {
        assertTrue(directory.findParticipants(null).isEmpty());
        verifyNoInteractions(jdbcTemplate);
    }

    @Test
    void findDisplayName_BlankName_IsEmpty() {
        when(jdbcTemplate.queryForList(anyString(), eq(String.class), eq(2L))).thenReturn(Arrays.asList(" "));

        assertEquals(Optional.empty(), directory.findDisplayName(2L));
    }
}
