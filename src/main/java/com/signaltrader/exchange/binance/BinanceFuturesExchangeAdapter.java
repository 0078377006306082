package com.signaltrader.exchange.binance;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.signaltrader.config.TradingProperties;
import com.signaltrader.domain.enums.OrderStatus;
import com.signaltrader.domain.enums.OrderType;
import com.signaltrader.domain.model.Candle;
import com.signaltrader.domain.model.Position;
import com.signaltrader.exception.ExchangeErrorType;
import com.signaltrader.exception.ExchangeException;
import com.signaltrader.exchange.AccountSnapshot;
import com.signaltrader.exchange.ClosePositionResult;
import com.signaltrader.exchange.ExchangeAdapter;
import com.signaltrader.exchange.MarketDataFeed;
import com.signaltrader.exchange.OrderRequest;
import com.signaltrader.exchange.OrderStatusReport;
import java.math.BigDecimal;
import java.net.URI;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Live adapter for Binance USD-M perpetual futures over the signed REST API.
 *
 * <p>Every order is sent with {@code newClientOrderId} and {@code newOrderRespType=RESULT},
 * and looked up with {@code origClientOrderId}. Error codes -2013/-2011 on lookup or cancel
 * mean the exchange never saw the order.
 *
 * <p>Leverage ceilings come from {@code /fapi/v1/leverageBracket} and are cached with Caffeine.
 */
@Component
@ConditionalOnProperty(name = "signaltrader.exchange.mode", havingValue = "LIVE")
public class BinanceFuturesExchangeAdapter implements ExchangeAdapter {

    private static final Logger log = LoggerFactory.getLogger(BinanceFuturesExchangeAdapter.class);

    private static final String API_KEY_HEADER = "X-MBX-APIKEY";

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final MarketDataFeed marketDataFeed;
    private final BinanceErrorMapper errorMapper;
    private final BinanceRequestSigner signer;
    private final TradingProperties.Binance binance;
    private final Clock clock;
    private final Cache<String, Integer> maxLeverageCache;

    public BinanceFuturesExchangeAdapter(
            RestTemplate restTemplate,
            ObjectMapper objectMapper,
            MarketDataFeed marketDataFeed,
            TradingProperties tradingProperties,
            Clock clock) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.marketDataFeed = marketDataFeed;
        this.binance = tradingProperties.getExchange().getBinance();
        this.clock = clock;
        this.errorMapper = new BinanceErrorMapper(objectMapper);
        if (binance.getApiKey() == null || binance.getSecretKey() == null) {
            throw new IllegalStateException(
                    "LIVE mode requires signaltrader.exchange.binance.api-key and secret-key");
        }
        this.signer = new BinanceRequestSigner(binance.getSecretKey());
        this.maxLeverageCache = Caffeine.newBuilder()
                .expireAfterWrite(binance.getLeverageCacheTtl())
                .maximumSize(500)
                .build();
    }

    // ========================
    // ACCOUNT & MARKET DATA
    // ========================

    @Override
    public AccountSnapshot getBalance() {
        JsonNode account = signed(HttpMethod.GET, "/fapi/v2/account", new LinkedHashMap<>(), "account");
        BigDecimal wallet = decimal(account, "totalWalletBalance");
        BigDecimal unrealized = decimal(account, "totalUnrealizedProfit");
        return AccountSnapshot.builder()
                .totalEquity(wallet.add(unrealized))
                .availableBalance(decimal(account, "availableBalance"))
                .asOf(clock.instant())
                .build();
    }

    @Override
    public BigDecimal getTicker(String symbol) {
        return marketDataFeed.getLastPrice(symbol);
    }

    @Override
    public List<Candle> getRecentCandles(String symbol, String interval, int limit) {
        return marketDataFeed.getCandles(symbol, interval, limit);
    }

    // ========================
    // ORDERS
    // ========================

    @Override
    public String placeOrder(OrderRequest request) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("symbol", request.getSymbol());
        params.put("side", request.getSide().name());
        params.put("type", request.getType().name());
        params.put("quantity", request.getQuantity().stripTrailingZeros().toPlainString());
        if (request.getType() == OrderType.LIMIT) {
            params.put("price", request.getPrice().stripTrailingZeros().toPlainString());
            params.put("timeInForce", "GTC");
        }
        if (request.isReduceOnly()) {
            params.put("reduceOnly", "true");
        }
        params.put("newClientOrderId", request.getClientOrderId());
        params.put("newOrderRespType", "RESULT");

        JsonNode response =
                signed(HttpMethod.POST, "/fapi/v1/order", params, "placeOrder " + request.getClientOrderId());
        String orderId = response.path("orderId").asText();
        log.info(
                "Binance order placed: {} {} {} qty={} clientOrderId={} orderId={}",
                request.getSide(),
                request.getType(),
                request.getSymbol(),
                request.getQuantity().toPlainString(),
                request.getClientOrderId(),
                orderId);
        return orderId;
    }

    @Override
    public OrderStatusReport getOrderStatus(String symbol, String clientOrderId) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("symbol", symbol);
        params.put("origClientOrderId", clientOrderId);
        try {
            return toReport(signed(HttpMethod.GET, "/fapi/v1/order", params, "getOrderStatus " + clientOrderId));
        } catch (BinanceApiException e) {
            if (e.isOrderNotFound()) {
                return OrderStatusReport.notFound(symbol, clientOrderId);
            }
            throw e;
        }
    }

    @Override
    public void cancelOrder(String symbol, String clientOrderId) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("symbol", symbol);
        params.put("origClientOrderId", clientOrderId);
        try {
            signed(HttpMethod.DELETE, "/fapi/v1/order", params, "cancelOrder " + clientOrderId);
        } catch (BinanceApiException e) {
            if (!e.isOrderNotFound()) {
                throw e;
            }
            log.info("Cancel of {} ignored: order unknown or already final", clientOrderId);
        }
    }

    @Override
    public ClosePositionResult closePosition(Position position) {
        String clientOrderId = "st-x-" + position.getId().replace("-", "").substring(0, 24);
        OrderRequest request = OrderRequest.builder()
                .clientOrderId(clientOrderId)
                .symbol(position.getSymbol())
                .side(position.getSide().opposite())
                .type(OrderType.MARKET)
                .quantity(position.getQuantity())
                .reduceOnly(true)
                .build();

        // a previous attempt may already have flattened the position
        OrderStatusReport existing = getOrderStatus(position.getSymbol(), clientOrderId);
        if (!existing.exists()) {
            placeOrder(request);
            existing = getOrderStatus(position.getSymbol(), clientOrderId);
        }
        if (existing.getStatus() != OrderStatus.FILLED) {
            throw new ExchangeException(
                    ExchangeErrorType.TRANSIENT,
                    "Close order " + clientOrderId + " for " + position.getSymbol() + " is " + existing.getStatus());
        }
        return ClosePositionResult.builder()
                .orderId(existing.getOrderId())
                .exitPrice(existing.getAveragePrice())
                .quantity(existing.getFilledQuantity())
                .fee(existing.getFee())
                .build();
    }

    @Override
    public boolean hasOpenPosition(Position position) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("symbol", position.getSymbol());
        JsonNode risks =
                signed(HttpMethod.GET, "/fapi/v2/positionRisk", params, "positionRisk " + position.getSymbol());
        for (JsonNode risk : risks) {
            int sign = decimal(risk, "positionAmt").signum();
            if (position.getSide().isLong() ? sign > 0 : sign < 0) {
                return true;
            }
        }
        return false;
    }

    @Override
    public void setLeverage(String symbol, int leverage) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("symbol", symbol);
        params.put("leverage", String.valueOf(leverage));
        signed(HttpMethod.POST, "/fapi/v1/leverage", params, "setLeverage " + symbol);
    }

    @Override
    public Optional<Integer> getMaxLeverage(String symbol) {
        Integer cached = maxLeverageCache.getIfPresent(symbol);
        if (cached != null) {
            return Optional.of(cached);
        }
        Map<String, String> params = new LinkedHashMap<>();
        params.put("symbol", symbol);
        JsonNode brackets = signed(HttpMethod.GET, "/fapi/v1/leverageBracket", params, "leverageBracket " + symbol);
        JsonNode entry = brackets.isArray() ? brackets.path(0) : brackets;
        JsonNode first = entry.path("brackets").path(0);
        if (first.isMissingNode() || !first.has("initialLeverage")) {
            return Optional.empty();
        }
        int maxLeverage = first.get("initialLeverage").asInt();
        maxLeverageCache.put(symbol, maxLeverage);
        return Optional.of(maxLeverage);
    }

    // ========================
    // INTERNALS
    // ========================

    private JsonNode signed(HttpMethod method, String path, Map<String, String> params, String operation) {
        params.put("recvWindow", String.valueOf(binance.getRecvWindowMs()));
        params.put("timestamp", String.valueOf(clock.millis()));
        URI uri = URI.create(binance.getBaseUrl() + path + "?" + signer.signedQuery(params));

        HttpHeaders headers = new HttpHeaders();
        headers.set(API_KEY_HEADER, binance.getApiKey());
        try {
            String body = restTemplate
                    .exchange(uri, method, new HttpEntity<>(headers), String.class)
                    .getBody();
            return objectMapper.readTree(body == null ? "{}" : body);
        } catch (RestClientException e) {
            throw errorMapper.map(operation, e);
        } catch (Exception e) {
            throw new ExchangeException(ExchangeErrorType.UNKNOWN, operation + " returned malformed JSON", e);
        }
    }

    private OrderStatusReport toReport(JsonNode node) {
        return OrderStatusReport.builder()
                .orderId(node.path("orderId").asText())
                .clientOrderId(node.path("clientOrderId").asText())
                .symbol(node.path("symbol").asText())
                .status(mapStatus(node.path("status").asText()))
                .filledQuantity(decimal(node, "executedQty"))
                .averagePrice(decimal(node, "avgPrice"))
                .build();
    }

    static OrderStatus mapStatus(String binanceStatus) {
        return switch (binanceStatus) {
            case "NEW" -> OrderStatus.NEW;
            case "PARTIALLY_FILLED" -> OrderStatus.PARTIALLY_FILLED;
            case "FILLED" -> OrderStatus.FILLED;
            case "CANCELED" -> OrderStatus.CANCELED;
            case "REJECTED" -> OrderStatus.REJECTED;
            case "EXPIRED", "EXPIRED_IN_MATCH" -> OrderStatus.EXPIRED;
            default -> throw new ExchangeException(
                    ExchangeErrorType.UNKNOWN, "Unrecognised Binance order status: " + binanceStatus);
        };
    }

    private static BigDecimal decimal(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? BigDecimal.ZERO : new BigDecimal(value.asText());
    }
}
