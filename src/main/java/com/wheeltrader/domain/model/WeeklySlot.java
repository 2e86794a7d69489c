package com.wheeltrader.domain.model;

import java.time.LocalDate;
import lombok.Value;

/** A slot id paired with the Friday it targets. */
@Value
public class WeeklySlot {

    int slotId;
    LocalDate targetExpiration;
}
