package com.phillippitts.poseidon;

import com.phillippitts.poseidon.service.conversation.ConversationReply;
import com.phillippitts.poseidon.service.conversation.ConversationReply.Outcome;
import com.phillippitts.poseidon.service.conversation.ConversationService;
import com.phillippitts.poseidon.service.extraction.ExtractionBackend;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(
    properties = {
        "poseidon.backend.vision.enabled=false",   // no remote calls from tests
        "poseidon.backend.ocr.enabled=false",      // no native tesseract needed
        "poseidon.backend.direct-api.enabled=false"
    }
)
class PoseidonApplicationTests {

    @Autowired
    private ConversationService conversations;

    @Autowired
    private List<ExtractionBackend> backends;

    @Test
    void contextLoads() {
        assertThat(backends).hasSize(3);
    }

    @Test
    void disabledBackendsStillProduceSyntheticReport() {
        assertThat(conversations.onTriggerPhrase("it-1").outcome()).isEqualTo(Outcome.ACTIVATED);

        ConversationReply reply = conversations.onImage("it-1", new byte[]{1, 2, 3}, "uluwatu");

        assertThat(reply.outcome()).isEqualTo(Outcome.REPORT);
        assertThat(reply.text()).isNotBlank();
    }
}
