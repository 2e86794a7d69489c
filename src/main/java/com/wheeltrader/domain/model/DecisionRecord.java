package com.wheeltrader.domain.model;

import com.wheeltrader.domain.enums.DecisionOutcome;
import com.wheeltrader.domain.enums.DecisionSeverity;
import com.wheeltrader.domain.enums.DecisionSource;
import com.wheeltrader.domain.enums.DecisionType;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;
import lombok.Builder;
import lombok.Data;

/**
 * Structured decision log entry.
 *
 * <p>Every non-HOLD decision, order transition and reportable condition is captured with
 * enough snapshot data in {@code dataContext} to reconstruct the decision offline.
 */
@Data
@Builder
public class DecisionRecord {

    private Instant timestamp;

    private long cycleId;

    private DecisionSource source;

    /** Slot the decision relates to; null for account-wide entries. */
    private Integer slotId;

    /** Intent id, broker order id or contract id, whichever the entry is about. */
    private String sourceId;

    private DecisionType decisionType;

    private DecisionOutcome outcome;

    private String reasoning;

    private Map<String, Object> dataContext;

    private DecisionSeverity severity;

    private LocalDate sessionDate;
}
