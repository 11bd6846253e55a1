package io.pulse4j;

import io.pulse4j.core.FormattedMessage;

import java.time.Instant;

/**
 * Pure transformation from a fetched result to the message delivered for it.
 */
@FunctionalInterface
public interface MessageFormatter<R> {

    FormattedMessage format(R result, Instant generatedAt);
}
