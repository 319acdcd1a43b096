package com.rgp.domain.event;

import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Domain event for ledger and guarantee state changes.
 * venueId is null for pool-wide events, month is 0 when not applicable.
 */
@Value
public class GuaranteeEvent {
    GuaranteeEventType type;
    String venueId;
    String party;
    BigInteger amount;
    int month;
    Instant timestamp;

    public static GuaranteeEvent of(GuaranteeEventType type, String venueId, String party,
                                    BigInteger amount, Instant timestamp) {
        return new GuaranteeEvent(type, venueId, party, amount, 0, timestamp);
    }

    public static GuaranteeEvent forMonth(GuaranteeEventType type, String venueId, String party,
                                          BigInteger amount, int month, Instant timestamp) {
        return new GuaranteeEvent(type, venueId, party, amount, month, timestamp);
    }
}
