package com.wheeltrader.domain.model;

import com.wheeltrader.domain.enums.OptionSide;
import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.Builder;
import lombok.Value;

/**
 * An option position as the broker reports it. Quantity is signed: negative for short.
 * Share holdings are not positions here; they arrive through {@link AccountBalances}.
 */
@Value
@Builder
public class BrokerPosition {

    String contractId;
    String underlying;
    OptionSide side;
    BigDecimal strike;
    LocalDate expiration;
    int quantity;
    BigDecimal averagePrice;
}
