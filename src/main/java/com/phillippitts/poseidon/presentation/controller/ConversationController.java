package com.phillippitts.poseidon.presentation.controller;

import com.phillippitts.poseidon.service.conversation.ConversationReply;
import com.phillippitts.poseidon.service.conversation.ConversationService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;

/**
 * HTTP adapter for a chat transport: one route per inbound message type.
 *
 * <p>Every route answers with a {@link ConversationReply}; the transport relays its text.
 */
@RestController
@RequestMapping("/conversations/{conversationId}")
class ConversationController {

    private final ConversationService conversations;

    ConversationController(ConversationService conversations) {
        this.conversations = conversations;
    }

    @PostMapping("/trigger")
    ResponseEntity<ConversationReply> trigger(@PathVariable String conversationId) {
        return ResponseEntity.ok(conversations.onTriggerPhrase(conversationId));
    }

    @PostMapping(value = "/image", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    ResponseEntity<ConversationReply> image(@PathVariable String conversationId,
                                            @RequestPart("image") MultipartFile image,
                                            @RequestParam(value = "caption", required = false) String caption)
            throws IOException {
        if (image.isEmpty()) {
            throw new IllegalArgumentException("image must not be empty");
        }
        return ResponseEntity.ok(conversations.onImage(conversationId, image.getBytes(), caption));
    }

    @PostMapping(value = "/text", consumes = MediaType.APPLICATION_JSON_VALUE)
    ResponseEntity<ConversationReply> text(@PathVariable String conversationId,
                                           @Valid @RequestBody TextMessage message) {
        return ResponseEntity.ok(conversations.onMessage(conversationId, message.text()));
    }

    record TextMessage(@NotNull String text) {}
}
