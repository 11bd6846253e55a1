package io.pulse4j.core;

/**
 * Result of handing a message to a sink.
 *
 * ok     : the sink accepted the payload
 * detail : sink response or rejection reason, may be null when accepted
 */
public record DeliveryOutcome(
        boolean ok,
        String detail
) {

    public static DeliveryOutcome delivered() {
        return new DeliveryOutcome(true, null);
    }

    public static DeliveryOutcome delivered(String detail) {
        return new DeliveryOutcome(true, detail);
    }

    public static DeliveryOutcome rejected(String detail) {
        return new DeliveryOutcome(false, detail);
    }
}
