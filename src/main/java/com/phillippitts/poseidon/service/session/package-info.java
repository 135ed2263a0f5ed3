/**
 * Conversation session lifecycle: IDLE, ACTIVE, AWAITING_ACKNOWLEDGEMENT.
 */
package com.phillippitts.poseidon.service.session;
