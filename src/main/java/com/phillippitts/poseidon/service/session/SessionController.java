package com.phillippitts.poseidon.service.session;

import com.phillippitts.poseidon.config.properties.SessionProperties;
import com.phillippitts.poseidon.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Per-conversation state machine gating when a reconciliation may run.
 *
 * <p><b>State Transitions:</b>
 * <pre>
 * IDLE → ACTIVE                      (activate)
 * ACTIVE → ACTIVE                    (activate, idempotent)
 * ACTIVE → AWAITING_ACKNOWLEDGEMENT  (completeReconciliation, arms expiry timer)
 * AWAITING_ACKNOWLEDGEMENT → IDLE    (acknowledge, or expiry timer)
 * AWAITING_ACKNOWLEDGEMENT → ACTIVE  (activate: acknowledgement plus new activation)
 * </pre>
 *
 * <p>While ACTIVE a single reconciliation slot is handed out by
 * {@link #beginReconciliation(String)}; a second image is refused as {@link Admission#BUSY}.
 *
 * <p><b>Thread Safety:</b> every transition runs inside {@link ConcurrentMap#compute}, which
 * serializes writers of the same conversation without blocking other conversations. No
 * network call ever happens inside a transition. Expiry timers are cancelled on every
 * transition out of AWAITING_ACKNOWLEDGEMENT; a timer that still fires after a newer
 * transition is recognized by its generation and ignored.
 *
 * <p>State is in memory only; a restart returns every conversation to IDLE.
 *
 * @since 1.0
 */
@Component
public class SessionController {

    private static final Logger LOG = LogManager.getLogger(SessionController.class);

    private final ConcurrentMap<String, SessionState> sessions = new ConcurrentHashMap<>();
    private final TaskScheduler scheduler;
    private final Clock clock;
    private final Duration expiry;

    public SessionController(@Qualifier("sessionScheduler") TaskScheduler scheduler,
                             Clock clock,
                             SessionProperties properties) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.expiry = Objects.requireNonNull(properties, "properties").expiry();
    }

    /**
     * Handles the trigger phrase.
     *
     * @param conversationId conversation key
     * @return {@link Activation#ALREADY_ACTIVE} if nothing changed
     */
    public Activation activate(String conversationId) {
        AtomicReference<Activation> result = new AtomicReference<>(Activation.ACTIVATED);
        sessions.compute(key(conversationId), (id, current) -> {
            SessionState s = current != null ? current : SessionState.idle(now());
            if (s.phase() == SessionPhase.ACTIVE) {
                result.set(Activation.ALREADY_ACTIVE);
                return s;
            }
            s.cancelTimer();
            logTransition(id, s.phase(), SessionPhase.ACTIVE);
            return s.transition(SessionPhase.ACTIVE, now());
        });
        return result.get();
    }

    /**
     * Claims the conversation's reconciliation slot.
     *
     * @return {@link Admission#ADMITTED} only if ACTIVE and no reconciliation is in flight
     */
    public Admission beginReconciliation(String conversationId) {
        AtomicReference<Admission> result = new AtomicReference<>(Admission.NOT_ACTIVE);
        sessions.computeIfPresent(key(conversationId), (id, s) -> {
            if (s.phase() != SessionPhase.ACTIVE) {
                return s;
            }
            if (s.reconciling()) {
                result.set(Admission.BUSY);
                return s;
            }
            result.set(Admission.ADMITTED);
            return s.withReconciling(true);
        });
        return result.get();
    }

    /**
     * Marks the report as delivered: ACTIVE → AWAITING_ACKNOWLEDGEMENT, arming the expiry timer.
     *
     * @return false if the conversation held no reconciliation slot
     */
    public boolean completeReconciliation(String conversationId) {
        AtomicReference<Boolean> done = new AtomicReference<>(false);
        sessions.computeIfPresent(key(conversationId), (id, s) -> {
            if (s.phase() != SessionPhase.ACTIVE || !s.reconciling()) {
                LOG.warn("completeReconciliation without a reconciliation in flight: conversation={} phase={}",
                        LogSanitizer.singleLine(id, 64), s.phase());
                return s;
            }
            SessionState next = s.transition(SessionPhase.AWAITING_ACKNOWLEDGEMENT, now());
            long generation = next.generation();
            ScheduledFuture<?> timer = scheduler.schedule(() -> expire(id, generation), now().plus(expiry));
            logTransition(id, s.phase(), next.phase());
            done.set(true);
            return next.withTimer(timer);
        });
        return done.get();
    }

    /**
     * Releases the reconciliation slot without delivering a report; the session stays ACTIVE.
     */
    public void abortReconciliation(String conversationId) {
        sessions.computeIfPresent(key(conversationId), (id, s) -> s.reconciling() ? s.withReconciling(false) : s);
    }

    /**
     * Handles free text: ends the wait for feedback.
     *
     * @return true if the session was AWAITING_ACKNOWLEDGEMENT and is now IDLE; false if ignored
     */
    public boolean acknowledge(String conversationId) {
        AtomicReference<Boolean> done = new AtomicReference<>(false);
        sessions.computeIfPresent(key(conversationId), (id, s) -> {
            if (s.phase() != SessionPhase.AWAITING_ACKNOWLEDGEMENT) {
                return s;
            }
            s.cancelTimer();
            logTransition(id, s.phase(), SessionPhase.IDLE);
            done.set(true);
            return s.transition(SessionPhase.IDLE, now());
        });
        return done.get();
    }

    /**
     * @return current phase; IDLE for unknown conversations
     */
    public SessionPhase phaseOf(String conversationId) {
        SessionState s = sessions.get(key(conversationId));
        return s == null ? SessionPhase.IDLE : s.phase();
    }

    /**
     * @return whether an image of this conversation is being reconciled right now
     */
    public boolean isReconciling(String conversationId) {
        SessionState s = sessions.get(key(conversationId));
        return s != null && s.reconciling();
    }

    // Package-private for tests: the expiry callback
    void expire(String conversationId, long generation) {
        sessions.computeIfPresent(conversationId, (id, s) -> {
            if (s.phase() != SessionPhase.AWAITING_ACKNOWLEDGEMENT || s.generation() != generation) {
                LOG.debug("Ignoring stale expiry timer for conversation {}", LogSanitizer.singleLine(id, 64));
                return s;
            }
            LOG.info("Session expired after {} without acknowledgement: conversation={}",
                    expiry, LogSanitizer.singleLine(id, 64));
            return s.transition(SessionPhase.IDLE, now());
        });
    }

    private Instant now() {
        return clock.instant();
    }

    private static String key(String conversationId) {
        if (conversationId == null || conversationId.isBlank()) {
            throw new IllegalArgumentException("conversationId must not be blank");
        }
        return conversationId;
    }

    private static void logTransition(String id, SessionPhase from, SessionPhase to) {
        LOG.info("Session transition: conversation={} {} -> {}", LogSanitizer.singleLine(id, 64), from, to);
    }
}
