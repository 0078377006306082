package com.signaltrader.exchange;

import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class AccountSnapshot {

    BigDecimal totalEquity;
    BigDecimal availableBalance;
    Instant asOf;
}
