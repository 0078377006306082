package com.signaltrader.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

/**
 * HTTP client for the exchange REST API and remote model signal sources.
 * Timeouts are bounded so a hung call surfaces as a transient error.
 */
@Configuration
public class RestClientConfig {

    @Bean
    public RestTemplate restTemplate(TradingProperties tradingProperties) {
        TradingProperties.Binance binance = tradingProperties.getExchange().getBinance();
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) binance.getConnectTimeout().toMillis());
        requestFactory.setReadTimeout((int) binance.getReadTimeout().toMillis());
        return new RestTemplate(requestFactory);
    }
}
