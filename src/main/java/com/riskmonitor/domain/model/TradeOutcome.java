package com.riskmonitor.domain.model;

import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Value;

/**
 * A closed position, input to the performance aggregates.
 */
@Value
@Builder
public class TradeOutcome {

    String symbol;
    String side;
    double pnl;

    /** Return on the position in percent. */
    double pnlPct;

    double durationMinutes;
    LocalDateTime openTime;
    LocalDateTime closeTime;
}
