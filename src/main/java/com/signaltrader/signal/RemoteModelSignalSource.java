package com.signaltrader.signal;

import com.signaltrader.domain.enums.Direction;
import com.signaltrader.domain.model.Candle;
import com.signaltrader.domain.model.MarketContext;
import com.signaltrader.domain.model.SignalScore;
import com.signaltrader.exception.SignalUnavailableException;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Asks an external model service for an opinion over HTTP.
 *
 * <p>Request: {@code POST url} with {@code {symbol, lastPrice, volatility, closes}}.
 * Response: {@code {direction, confidence}}; a missing direction or {@code NONE}
 * means no opinion. Transport failures raise {@link SignalUnavailableException}.
 */
public class RemoteModelSignalSource implements SignalSource {

    private static final Logger log = LoggerFactory.getLogger(RemoteModelSignalSource.class);

    private final String id;
    private final String url;
    private final RestTemplate restTemplate;

    public RemoteModelSignalSource(String id, String url, RestTemplate restTemplate) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("Remote model source " + id + " needs a url");
        }
        this.id = id;
        this.url = url;
        this.restTemplate = restTemplate;
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public Optional<SignalScore> score(String symbol, MarketContext marketContext) {
        List<BigDecimal> closes = marketContext.getCandles().stream()
                .map(Candle::getClose)
                .toList();
        Map<String, Object> request = Map.of(
                "symbol", symbol,
                "lastPrice", marketContext.getLastPrice(),
                "volatility", marketContext.getVolatility(),
                "closes", closes);

        RemoteScore response;
        try {
            response = restTemplate.postForObject(url, request, RemoteScore.class);
        } catch (RestClientException e) {
            throw new SignalUnavailableException(id, "model call failed: " + e.getMessage(), e);
        }

        if (response == null || response.getDirection() == null || "NONE".equalsIgnoreCase(response.getDirection())) {
            return Optional.empty();
        }
        Direction direction;
        try {
            direction = Direction.valueOf(response.getDirection().toUpperCase());
        } catch (IllegalArgumentException e) {
            log.warn("Source {} returned unknown direction '{}'", id, response.getDirection());
            return Optional.empty();
        }
        double confidence = response.getConfidence() != null ? response.getConfidence() : Double.NaN;
        return Optional.of(SignalScore.of(direction, confidence));
    }

    @Data
    @NoArgsConstructor
    public static class RemoteScore {
        private String direction;
        private Double confidence;
    }
}
