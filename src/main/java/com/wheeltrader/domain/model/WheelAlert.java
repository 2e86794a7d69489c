package com.wheeltrader.domain.model;

import com.wheeltrader.domain.enums.DecisionSeverity;
import com.wheeltrader.domain.enums.WheelCondition;
import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/** A reportable condition raised while running the wheel. {@code slotId} is null for account-wide ones. */
@Value
@Builder
public class WheelAlert {

    WheelCondition condition;
    Integer slotId;
    String message;
    Map<String, Object> context;
    DecisionSeverity severity;
    Instant timestamp;

    public static WheelAlert of(
            WheelCondition condition, Integer slotId, String message, Map<String, Object> context, Instant timestamp) {
        return WheelAlert.builder()
                .condition(condition)
                .slotId(slotId)
                .message(message)
                .context(context != null ? context : Map.of())
                .severity(condition.getSeverity())
                .timestamp(timestamp)
                .build();
    }
}
