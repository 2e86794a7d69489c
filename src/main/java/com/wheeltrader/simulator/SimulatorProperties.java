package com.wheeltrader.simulator;

import java.math.BigDecimal;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/** Paper-trading account and market model, bound from {@code wheel.simulator}. */
@Getter
@Setter
@ConfigurationProperties(prefix = "wheel.simulator")
public class SimulatorProperties {

    private BigDecimal startingCash = new BigDecimal("50000");
    private long startingShares = 0;

    private BigDecimal spot = new BigDecimal("12.00");

    /** Flat volatility every listed contract is priced with. */
    private double volatility = 0.45;

    private BigDecimal strikeStep = new BigDecimal("0.50");

    /** Listed strikes on each side of spot. */
    private int strikesEachSide = 10;

    private BigDecimal halfSpread = new BigDecimal("0.03");
    private long openInterest = 500;

    /** When false the chain carries no delta and the wheel computes it from the mid. */
    private boolean provideDelta = true;

    /** Weekly expirations listed ahead of today. */
    private int weeks = 8;

    /** When false orders rest until repriced, cancelled or matched explicitly. */
    private boolean autoMatch = true;
}
