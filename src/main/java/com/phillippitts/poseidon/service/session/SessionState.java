package com.phillippitts.poseidon.service.session;

import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.ScheduledFuture;

/**
 * Immutable snapshot of one conversation's session. Replaced wholesale on every transition.
 *
 * @param phase          current phase
 * @param lastTransition when the phase last changed
 * @param reconciling    an image is being processed (only while ACTIVE)
 * @param expiryTimer    pending expiry callback (only while AWAITING_ACKNOWLEDGEMENT)
 * @param generation     incremented on every transition; an expiry callback armed for an older
 *                       generation is stale and does nothing
 */
record SessionState(
        SessionPhase phase,
        Instant lastTransition,
        boolean reconciling,
        ScheduledFuture<?> expiryTimer,
        long generation
) {

    SessionState {
        Objects.requireNonNull(phase, "phase");
        Objects.requireNonNull(lastTransition, "lastTransition");
    }

    static SessionState idle(Instant now) {
        return new SessionState(SessionPhase.IDLE, now, false, null, 0L);
    }

    SessionState transition(SessionPhase next, Instant now) {
        return new SessionState(next, now, false, null, generation + 1);
    }

    SessionState withReconciling(boolean value) {
        return new SessionState(phase, lastTransition, value, expiryTimer, generation);
    }

    SessionState withTimer(ScheduledFuture<?> timer) {
        return new SessionState(phase, lastTransition, reconciling, timer, generation);
    }

    void cancelTimer() {
        if (expiryTimer != null) {
            expiryTimer.cancel(false);
        }
    }
}
