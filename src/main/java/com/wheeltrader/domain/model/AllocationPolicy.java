package com.wheeltrader.domain.model;

import com.wheeltrader.domain.enums.SidePreference;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Tunables derived from the allocation bias for one cycle.
 *
 * <p>{@code expirationPreference} runs from 0 (fund the farthest slots first) to 1 (fund the
 * nearest first); {@code nearestFirst} is its thresholded form used to order slot funding.
 */
@Value
@Builder
public class AllocationPolicy {

    BigDecimal bias;
    SidePreference sidePreference;
    BigDecimal targetDelta;
    BigDecimal expirationPreference;
    boolean nearestFirst;
}
