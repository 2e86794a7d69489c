package com.wheeltrader.delta;

import com.wheeltrader.domain.enums.DeltaStatus;
import java.math.BigDecimal;
import lombok.Value;

/** One delta observation for a live leg. {@code delta} is null when the reading is STALE. */
@Value
public class DeltaReading {

    BigDecimal delta;
    DeltaStatus status;
    String source;

    public static DeltaReading stale(String why) {
        return new DeltaReading(null, DeltaStatus.STALE, why);
    }
}
