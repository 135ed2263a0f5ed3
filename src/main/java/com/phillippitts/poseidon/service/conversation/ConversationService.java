package com.phillippitts.poseidon.service.conversation;

import com.phillippitts.poseidon.config.properties.ConversationProperties;
import com.phillippitts.poseidon.domain.Coordinates;
import com.phillippitts.poseidon.domain.ForecastSample;
import com.phillippitts.poseidon.exception.SessionNotActiveException;
import com.phillippitts.poseidon.exception.UnknownSpotException;
import com.phillippitts.poseidon.service.conversation.ConversationReply.Outcome;
import com.phillippitts.poseidon.service.reconcile.ReconciliationEngine;
import com.phillippitts.poseidon.service.session.Activation;
import com.phillippitts.poseidon.service.session.Admission;
import com.phillippitts.poseidon.service.session.SessionController;
import com.phillippitts.poseidon.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Inbound conversation operations called by the transport layer.
 *
 * <p>Coordinates the {@link SessionController} (may this conversation reconcile now?),
 * the {@link ReconciliationEngine} (what are the conditions?) and the {@link ReportConsumer}
 * (how are they shown?). The reconciliation slot is always released: on success by moving to
 * AWAITING_ACKNOWLEDGEMENT, otherwise by aborting back to ACTIVE.
 *
 * @since 1.0
 */
@Service
public class ConversationService {

    private static final Logger LOG = LogManager.getLogger(ConversationService.class);

    static final String READY = "Ready. Send a forecast screenshot with the spot name as caption, "
            + "optionally followed by a date (2024-05-01 or 01.05.2024).";
    static final String ALREADY_WAITING = "Already waiting for your screenshot.";
    static final String BUSY = "Still working on your previous screenshot, hang on.";
    static final String UNKNOWN_SPOT = "Spot not recognized. Known spots: ";
    static final String THANKS = "Thanks for the feedback!";

    private final SessionController sessions;
    private final ReconciliationEngine engine;
    private final SpotDirectory spots;
    private final CaptionParser captions;
    private final ReportConsumer reports;
    private final Set<String> triggerPhrases;

    public ConversationService(SessionController sessions,
                               ReconciliationEngine engine,
                               SpotDirectory spots,
                               CaptionParser captions,
                               ReportConsumer reports,
                               ConversationProperties properties) {
        this.sessions = Objects.requireNonNull(sessions, "sessions");
        this.engine = Objects.requireNonNull(engine, "engine");
        this.spots = Objects.requireNonNull(spots, "spots");
        this.captions = Objects.requireNonNull(captions, "captions");
        this.reports = Objects.requireNonNull(reports, "reports");
        this.triggerPhrases = properties.triggerPhrases().stream()
                .map(p -> p.strip().toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    /**
     * Trigger phrase: IDLE or AWAITING_ACKNOWLEDGEMENT → ACTIVE; idempotent while ACTIVE.
     */
    public ConversationReply onTriggerPhrase(String conversationId) {
        Activation activation = sessions.activate(conversationId);
        return activation == Activation.ACTIVATED
                ? ConversationReply.of(Outcome.ACTIVATED, READY)
                : ConversationReply.of(Outcome.ALREADY_ACTIVE, ALREADY_WAITING);
    }

    /**
     * Forecast screenshot with caption "spot [date]".
     *
     * @throws SessionNotActiveException if the conversation is not ACTIVE (no transition happens)
     */
    public ConversationReply onImage(String conversationId, byte[] image, String caption) {
        Admission admission = sessions.beginReconciliation(conversationId);
        if (admission == Admission.NOT_ACTIVE) {
            throw new SessionNotActiveException(conversationId);
        }
        if (admission == Admission.BUSY) {
            return ConversationReply.of(Outcome.BUSY, BUSY);
        }

        try {
            Caption parsed = captions.parse(caption);
            Coordinates spot = spots.lookup(parsed.spotName());
            LOG.info("Reconciling forecast for spot={} date={}",
                    LogSanitizer.singleLine(parsed.spotName(), 40), parsed.date());

            ForecastSample sample = engine.reconcile(image, spot, parsed.date());
            String text = reports.present(sample, parsed.spotName(), parsed.date());

            sessions.completeReconciliation(conversationId);
            return ConversationReply.of(Outcome.REPORT, text);
        } catch (UnknownSpotException e) {
            sessions.abortReconciliation(conversationId);
            LOG.info("Unknown spot in caption: {}", LogSanitizer.singleLine(e.getSpotName(), 40));
            return ConversationReply.of(Outcome.UNKNOWN_SPOT, UNKNOWN_SPOT + String.join(", ", spots.names()));
        } catch (RuntimeException e) {
            sessions.abortReconciliation(conversationId);
            throw e;
        }
    }

    /**
     * Free text: an acknowledgement while a report awaits feedback, otherwise ignored.
     */
    public ConversationReply onText(String conversationId, String text) {
        if (sessions.acknowledge(conversationId)) {
            LOG.debug("Acknowledgement received: {}", LogSanitizer.singleLine(text, 80));
            return ConversationReply.of(Outcome.ACKNOWLEDGED, THANKS);
        }
        return ConversationReply.ignored();
    }

    /**
     * Routes any text message: a configured trigger phrase activates, everything else is
     * handled by {@link #onText(String, String)}.
     */
    public ConversationReply onMessage(String conversationId, String text) {
        if (isTriggerPhrase(text)) {
            return onTriggerPhrase(conversationId);
        }
        return onText(conversationId, text);
    }

    boolean isTriggerPhrase(String text) {
        return text != null && triggerPhrases.contains(text.strip().toLowerCase(Locale.ROOT));
    }
}
