package com.wheeltrader.domain.model;

import com.wheeltrader.domain.enums.OptionSide;
import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.Builder;
import lombok.Value;

/**
 * Contract chosen for a new short leg, with the economics reported alongside the decision.
 *
 * <p>{@code premium} is mid times the contract multiplier. {@code collateral} is
 * strike times multiplier for puts (cash) and the multiplier itself for calls (shares).
 */
@Value
@Builder
public class TargetContract {

    OptionContract contract;
    BigDecimal targetDelta;
    BigDecimal limitPrice;
    BigDecimal premium;
    BigDecimal collateral;

    public OptionSide getSide() {
        return contract.getSide();
    }

    public BigDecimal getStrike() {
        return contract.getStrike();
    }

    public LocalDate getExpiration() {
        return contract.getExpiration();
    }

    public String getContractId() {
        return contract.getContractId();
    }
}
