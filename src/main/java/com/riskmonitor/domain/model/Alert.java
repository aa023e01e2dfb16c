package com.riskmonitor.domain.model;

import com.riskmonitor.domain.enums.AlertLevel;
import com.riskmonitor.domain.enums.AlertType;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Value;

/**
 * A raised monitoring alert.
 *
 * <p>Instances are immutable so the same value can be handed to several handlers
 * concurrently. Resolving produces a new instance with {@code resolvedAt} stamped;
 * a resolved alert never reopens.
 */
@Value
@Builder(toBuilder = true)
public class Alert {

    /** Rule key plus epoch-second bucket, e.g. {@code margin_usage_1718000000}. */
    String id;

    String traderId;

    AlertType type;

    AlertLevel level;

    String title;

    String message;

    LocalDateTime raisedAt;

    /** Null while the alert is open. */
    LocalDateTime resolvedAt;

    public boolean isResolved() {
        return resolvedAt != null;
    }

    /**
     * Returns true if this alert is open and shares the deduplication key of {@code other}.
     */
    public boolean blocks(Alert other) {
        return !isResolved() && type == other.getType() && level == other.getLevel();
    }

    public Alert resolve(LocalDateTime at) {
        return toBuilder().resolvedAt(at).build();
    }
}
