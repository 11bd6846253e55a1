package io.pulse4j;

import io.pulse4j.core.DeliveryOutcome;
import io.pulse4j.core.FormattedMessage;

public interface Sink {

    /**
     * Deliver {@code message} to {@code channel}. A sink that is reachable but refuses the payload
     * returns {@link DeliveryOutcome#rejected(String)}; transport failures are thrown.
     */
    DeliveryOutcome deliver(String channel, FormattedMessage message) throws Exception;
}
