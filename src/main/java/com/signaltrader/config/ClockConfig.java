package com.signaltrader.config;

import java.time.Clock;
import java.time.ZoneId;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Single time source for the pipeline. Trading days roll over at midnight in
 * {@code signaltrader.account.zone}; tests substitute a fixed clock.
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock tradingClock(TradingProperties tradingProperties) {
        return Clock.system(ZoneId.of(tradingProperties.getAccount().getZone()));
    }
}
