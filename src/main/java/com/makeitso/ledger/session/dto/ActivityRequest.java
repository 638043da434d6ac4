package com.makeitso.ledger.session.dto;

import java.time.Instant;

/**
 * Body of POST /api/session/activity.
 *
 * occurredAt is optional; a client that buffered the event sends the original time.
 * A value ahead of the server clock is clamped to now.
 */
public record ActivityRequest(Instant occurredAt) {
}
