package com.riskmonitor.domain.model;

import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Value;

/**
 * Account state captured with one decision cycle of the trader.
 *
 * <p>The monitor only needs the balance, margin usage and timestamp for its risk math;
 * available balance, unrealized P&L and the cycle outcome feed the live-state and
 * error-rate fields of the snapshot.
 */
@Value
@Builder
public class BalanceRecord {

    LocalDateTime timestamp;

    double totalBalance;

    double availableBalance;

    double unrealizedPnl;

    /** Margin used as a percentage of total balance (0-100). */
    double marginUsedPct;

    int positionCount;

    /** Whether the decision cycle that produced this record completed without error. */
    @Builder.Default
    boolean success = true;
}
