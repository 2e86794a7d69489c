package com.wheeltrader.api.dto.response;

import com.wheeltrader.domain.enums.BrokerConnectionState;
import com.wheeltrader.domain.enums.MarketPhase;
import com.wheeltrader.domain.enums.SidePreference;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Getter;

/**
 * Aggregated wheel status returned by GET /api/wheel/status.
 *
 * <p>Portfolio and policy figures are those of the last completed cycle and are null before
 * the first cycle has run.
 */
@Getter
@Builder
public class WheelStatusResponse {

    private final String underlying;
    private final MarketPhase marketPhase;
    private final BrokerConnectionState brokerState;

    private final long cycleCount;
    private final boolean cyclePending;
    private final Long lastCycleId;
    private final Instant lastCycleAt;

    // Portfolio as of the last cycle
    private final BigDecimal cashBalance;
    private final Long sharesHeld;
    private final Integer targetShares;
    private final BigDecimal underlyingPrice;

    // Policy the last cycle decided under
    private final BigDecimal allocationBias;
    private final SidePreference sidePreference;
    private final BigDecimal targetDelta;
    private final Boolean nearestFirst;

    private final BigDecimal lastCyclePremium;
    private final int workingOrderCount;
    private final long haltedSlotCount;

    private final List<SlotStatusResponse> slots;
}
