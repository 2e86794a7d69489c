package com.wheeltrader.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/** Cash and share balances of the account as reported by the broker. */
@Value
@Builder
public class AccountBalances {

    BigDecimal cash;
    long sharesHeld;
}
