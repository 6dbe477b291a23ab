package com.mira.mediavault.integration.conversation;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Reads membership from the messaging core's tables in the shared database.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JdbcConversationDirectory implements ConversationDirectory {

    private static final String PARTICIPANTS_SQL =
            "SELECT user_id FROM conversation_participants WHERE conversation_id = ? ORDER BY user_id";

    private static final String DISPLAY_NAME_SQL =
            "SELECT name FROM users WHERE id = ?";

    private final JdbcTemplate jdbcTemplate;

    @Override
    public Set<Long> findParticipants(Long conversationId) {
        if (conversationId == null) {
            return Set.of();
        }
        List<Long> ids = jdbcTemplate.queryForList(PARTICIPANTS_SQL, Long.class, conversationId);
        return new LinkedHashSet<>(ids);
    }

    @Override
    public Optional<String> findDisplayName(Long userId) {
        List<String> names = jdbcTemplate.queryForList(DISPLAY_NAME_SQL, String.class, userId);
        return names.stream()
                .filter(name -> name != null && !name.isBlank())
                .findFirst();
    }
}
