package com.phillippitts.poseidon.service.conversation;

import com.phillippitts.poseidon.config.properties.ConversationProperties;
import com.phillippitts.poseidon.config.properties.SessionProperties;
import com.phillippitts.poseidon.config.properties.SpotProperties;
import com.phillippitts.poseidon.domain.Coordinates;
import com.phillippitts.poseidon.domain.Provenance;
import com.phillippitts.poseidon.exception.SessionNotActiveException;
import com.phillippitts.poseidon.service.conversation.ConversationReply.Outcome;
import com.phillippitts.poseidon.service.reconcile.ReconciliationEngine;
import com.phillippitts.poseidon.service.session.SessionController;
import com.phillippitts.poseidon.service.session.SessionPhase;
import com.phillippitts.poseidon.testutil.RecordingReportConsumer;
import com.phillippitts.poseidon.testutil.Samples;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

class ConversationServiceTest {

    private static final String ID = "chat-7";
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T03:00:00Z"), ZoneOffset.UTC);

    private SessionController sessions;
    private RecordingReportConsumer reports;
    private AtomicInteger reconciles;
    private AtomicReference<Coordinates> lastSpot;
    private ConversationService service;

    @BeforeEach
    void setUp() {
        sessions = new SessionController(mock(TaskScheduler.class), CLOCK,
                new SessionProperties(Duration.ofMinutes(10)));
        reports = new RecordingReportConsumer();
        reconciles = new AtomicInteger();
        lastSpot = new AtomicReference<>();
        ReconciliationEngine engine = (image, spot, date) -> {
            reconciles.incrementAndGet();
            lastSpot.set(spot);
            return Samples.complete(Provenance.VISION_MODEL);
        };
        ConversationProperties props = new ConversationProperties(List.of("/surf", "Surf"), ZoneId.of("UTC"));
        service = new ConversationService(
                sessions,
                engine,
                new SpotDirectory(new SpotProperties(Map.of())),
                new CaptionParser(CLOCK, props),
                reports,
                props);
    }

    @Test
    void triggerActivatesThenReportsAlreadyWaiting() {
        assertThat(service.onTriggerPhrase(ID).outcome()).isEqualTo(Outcome.ACTIVATED);
        assertThat(service.onTriggerPhrase(ID).outcome()).isEqualTo(Outcome.ALREADY_ACTIVE);
        assertThat(sessions.phaseOf(ID)).isEqualTo(SessionPhase.ACTIVE);
    }

    @Test
    void imageWithoutActiveSessionIsRefused() {
        assertThatThrownBy(() -> service.onImage(ID, new byte[]{1}, "uluwatu"))
                .isInstanceOf(SessionNotActiveException.class);
        assertThat(reconciles.get()).isZero();
        assertThat(sessions.phaseOf(ID)).isEqualTo(SessionPhase.IDLE);
    }

    @Test
    void imageProducesReportAndAwaitsAcknowledgement() {
        service.onTriggerPhrase(ID);

        ConversationReply reply = service.onImage(ID, new byte[]{1}, "Uluwatu 2024-06-02");

        assertThat(reply.outcome()).isEqualTo(Outcome.REPORT);
        assertThat(reply.text()).isEqualTo("report:Uluwatu:2024-06-02");
        assertThat(lastSpot.get()).isEqualTo(SpotDirectory.BUILT_IN.get("uluwatu"));
        assertThat(sessions.phaseOf(ID)).isEqualTo(SessionPhase.AWAITING_ACKNOWLEDGEMENT);
    }

    @Test
    void missingDateMeansToday() {
        service.onTriggerPhrase(ID);

        service.onImage(ID, new byte[]{1}, "bingin");

        assertThat(reports.presented).singleElement()
                .satisfies(p -> assertThat(p.date()).isEqualTo(LocalDate.of(2024, 5, 1)));
    }

    @Test
    void unknownSpotRepliesWithoutReconcilingAndStaysActive() {
        service.onTriggerPhrase(ID);

        ConversationReply reply = service.onImage(ID, new byte[]{1}, "atlantis");

        assertThat(reply.outcome()).isEqualTo(Outcome.UNKNOWN_SPOT);
        assertThat(reply.text()).startsWith(ConversationService.UNKNOWN_SPOT).contains("uluwatu");
        assertThat(reconciles.get()).isZero();
        assertThat(sessions.phaseOf(ID)).isEqualTo(SessionPhase.ACTIVE);
        assertThat(sessions.isReconciling(ID)).isFalse();
    }

    @Test
    void presentationFailureReleasesSlotAndPropagates() {
        service.onTriggerPhrase(ID);
        reports.failWith = new IllegalStateException("renderer down");

        assertThatThrownBy(() -> service.onImage(ID, new byte[]{1}, "canggu"))
                .isInstanceOf(IllegalStateException.class);
        assertThat(sessions.phaseOf(ID)).isEqualTo(SessionPhase.ACTIVE);
        assertThat(sessions.isReconciling(ID)).isFalse();
    }

    @Test
    void textAcknowledgesOnlyWhileAwaiting() {
        assertThat(service.onText(ID, "great, thanks").outcome()).isEqualTo(Outcome.IGNORED);

        service.onTriggerPhrase(ID);
        service.onImage(ID, new byte[]{1}, "medewi");

        ConversationReply reply = service.onText(ID, "great, thanks");
        assertThat(reply.outcome()).isEqualTo(Outcome.ACKNOWLEDGED);
        assertThat(reply.text()).isEqualTo(ConversationService.THANKS);
        assertThat(sessions.phaseOf(ID)).isEqualTo(SessionPhase.IDLE);
    }

    @Test
    void messageRoutesTriggerPhrasesCaseInsensitively() {
        assertThat(service.onMessage(ID, "  SURF ").outcome()).isEqualTo(Outcome.ACTIVATED);
        assertThat(service.onMessage(ID, "/surf").outcome()).isEqualTo(Outcome.ALREADY_ACTIVE);
        assertThat(service.onMessage(ID, "hello").outcome()).isEqualTo(Outcome.IGNORED);
        assertThat(service.isTriggerPhrase(null)).isFalse();
    }
}
