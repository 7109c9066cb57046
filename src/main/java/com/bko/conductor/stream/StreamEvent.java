package com.bko.conductor.stream;

import java.time.Instant;

/**
 * One buffered stream message. Ids increase per run so reconnecting clients can resume with {@code since}.
 */
public record StreamEvent(
        long id,
        Instant timestamp,
        StreamEventType type,
        Object data
) {
}
