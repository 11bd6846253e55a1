package io.pulse4j.core;

import java.util.Objects;

/**
 * Text payload handed to a {@link io.pulse4j.Sink}.
 */
public record FormattedMessage(String text, boolean markdown) {

    public FormattedMessage {
        Objects.requireNonNull(text, "text must not be null");
    }

    public static FormattedMessage markdown(String text) {
        return new FormattedMessage(text, true);
    }

    public static FormattedMessage plain(String text) {
        return new FormattedMessage(text, false);
    }
}
