package com.mira.mediavault.integration.conversation;

import java.util.Optional;
import java.util.Set;

/**
 * Read-only view of conversation membership and user display names.
 * Membership itself is owned by the messaging core.
 */
public interface ConversationDirectory {

    /**
     * @param conversationId conversation id
     * @return ids of all participants, empty if the conversation does not exist
     */
    Set<Long> findParticipants(Long conversationId);

    /**
     * @return true if the user participates in the conversation
     */
    default boolean isParticipant(Long conversationId, Long userId) {
        return userId != null && findParticipants(conversationId).contains(userId);
    }

    /**
     * Name shown in watermarks and system messages
     */
    Optional<String> findDisplayName(Long userId);
}
