package com.phillippitts.poseidon.service.conversation;

import java.util.Objects;

/**
 * What the transport layer should send back to the user.
 *
 * @param outcome what happened
 * @param text    message text; empty when nothing should be sent
 */
public record ConversationReply(Outcome outcome, String text) {

    public enum Outcome {
        ACTIVATED,
        ALREADY_ACTIVE,
        REPORT,
        NOT_ACTIVE,
        BUSY,
        UNKNOWN_SPOT,
        ACKNOWLEDGED,
        IGNORED
    }

    public ConversationReply {
        Objects.requireNonNull(outcome, "outcome");
        text = text == null ? "" : text;
    }

    public static ConversationReply of(Outcome outcome, String text) {
        return new ConversationReply(outcome, text);
    }

    public static ConversationReply ignored() {
        return new ConversationReply(Outcome.IGNORED, "");
    }
}
