package com.phillippitts.poseidon.exception;

/**
 * Thrown when an operation requires an active conversation session but the session is
 * idle or waiting for acknowledgement.
 */
public class SessionNotActiveException extends PoseidonException {

    private final String conversationId;

    public SessionNotActiveException(String conversationId) {
        super("Conversation session is not active: " + conversationId);
        this.conversationId = conversationId;
    }

    public String getConversationId() {
        return conversationId;
    }
}
