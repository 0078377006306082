package com.signaltrader.signal;

import com.signaltrader.config.TradingProperties;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

/** Creates signal source instances from their {@code signaltrader.sources[*]} declarations. */
@Component
public class SignalSourceFactory {

    private final RestTemplate restTemplate;

    public SignalSourceFactory(RestTemplate restTemplate) {
        this.restTemplate = restTemplate;
    }

    public SignalSource create(TradingProperties.Source config) {
        if (config.getId() == null || config.getId().isBlank()) {
            throw new IllegalArgumentException("Signal source without id");
        }
        if (config.getType() == null) {
            throw new IllegalArgumentException("Signal source " + config.getId() + " has no type");
        }
        return switch (config.getType()) {
            case RSI -> new RsiSignalSource(
                    config.getId(), config.getPeriod(), config.getOversold(), config.getOverbought());
            case MA_CROSSOVER -> new MovingAverageCrossSignalSource(
                    config.getId(), config.getFastPeriod(), config.getSlowPeriod(), config.getSensitivity());
            case REMOTE_MODEL -> new RemoteModelSignalSource(config.getId(), config.getUrl(), restTemplate);
        };
    }
}
