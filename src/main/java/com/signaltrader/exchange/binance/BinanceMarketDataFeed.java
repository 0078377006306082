package com.signaltrader.exchange.binance;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.signaltrader.config.TradingProperties;
import com.signaltrader.domain.model.Candle;
import com.signaltrader.exception.ExchangeErrorType;
import com.signaltrader.exception.ExchangeException;
import com.signaltrader.exchange.MarketDataFeed;
import java.math.BigDecimal;
import java.net.URI;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Unauthenticated Binance USD-M futures market data: last price and klines.
 * Used in both paper and live mode, so paper trading runs against real prices.
 */
@Component
public class BinanceMarketDataFeed implements MarketDataFeed {

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final BinanceErrorMapper errorMapper;
    private final String baseUrl;

    public BinanceMarketDataFeed(
            RestTemplate restTemplate, ObjectMapper objectMapper, TradingProperties tradingProperties) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.errorMapper = new BinanceErrorMapper(objectMapper);
        this.baseUrl = tradingProperties.getExchange().getBinance().getBaseUrl();
    }

    @Override
    public BigDecimal getLastPrice(String symbol) {
        JsonNode node = get("ticker " + symbol, "/fapi/v1/ticker/price?symbol=" + symbol);
        if (!node.hasNonNull("price")) {
            throw new ExchangeException(ExchangeErrorType.UNKNOWN, "Ticker response for " + symbol + " has no price");
        }
        return new BigDecimal(node.get("price").asText());
    }

    /** Klines are arrays: [openTime, open, high, low, close, volume, closeTime, ...]. */
    @Override
    public List<Candle> getCandles(String symbol, String interval, int limit) {
        JsonNode rows = get(
                "klines " + symbol,
                "/fapi/v1/klines?symbol=" + symbol + "&interval=" + interval + "&limit=" + limit);
        List<Candle> candles = new ArrayList<>(rows.size());
        for (JsonNode row : rows) {
            candles.add(Candle.builder()
                    .openTime(Instant.ofEpochMilli(row.get(0).asLong()))
                    .open(new BigDecimal(row.get(1).asText()))
                    .high(new BigDecimal(row.get(2).asText()))
                    .low(new BigDecimal(row.get(3).asText()))
                    .close(new BigDecimal(row.get(4).asText()))
                    .volume(new BigDecimal(row.get(5).asText()))
                    .closeTime(Instant.ofEpochMilli(row.get(6).asLong()))
                    .build());
        }
        return candles;
    }

    private JsonNode get(String operation, String pathAndQuery) {
        try {
            String body = restTemplate.getForObject(URI.create(baseUrl + pathAndQuery), String.class);
            return objectMapper.readTree(body);
        } catch (RestClientException e) {
            throw errorMapper.map(operation, e);
        } catch (Exception e) {
            throw new ExchangeException(ExchangeErrorType.UNKNOWN, operation + " returned malformed JSON", e);
        }
    }
}
