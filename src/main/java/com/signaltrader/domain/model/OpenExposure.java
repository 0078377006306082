package com.signaltrader.domain.model;

import java.math.BigDecimal;
import lombok.Value;

/** Margin committed to one open position, tracked inside {@link AccountState}. */
@Value(staticConstructor = "of")
public class OpenExposure {

    String symbol;
    BigDecimal margin;
}
