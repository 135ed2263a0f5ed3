package com.phillippitts.poseidon.presentation.exception;

import com.phillippitts.poseidon.exception.SessionNotActiveException;
import com.phillippitts.poseidon.service.conversation.ConversationReply;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
    }

    @Test
    void sessionNotActiveReturnsRefusalWith409() {
        ResponseEntity<ConversationReply> response =
                handler.handleSessionNotActive(new SessionNotActiveException("chat-1"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().outcome()).isEqualTo(ConversationReply.Outcome.NOT_ACTIVE);
        assertThat(response.getBody().text()).isEqualTo(GlobalExceptionHandler.NOT_ACTIVE_REFUSAL);
    }

    @Test
    void badRequestReturns400WithDetails() {
        ResponseEntity<?> response = handler.handleBadRequest(new IllegalArgumentException("image must not be empty"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody()).isNotNull();
        String body = response.getBody().toString();
        assertThat(body).contains("IllegalArgumentException");
        assertThat(body).contains("image must not be empty");
        assertThat(body).contains("timestamp=");
    }

    @Test
    void unexpectedReturns500WithoutInternals() {
        ResponseEntity<?> response = handler.handleUnexpected(new IllegalStateException("api key sk-123 leaked"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody()).isNotNull();
        String body = response.getBody().toString();
        assertThat(body).contains("InternalServerError");
        assertThat(body).doesNotContain("sk-123");
        assertThat(body).doesNotContain("IllegalStateException");
    }
}
