package com.signaltrader.exchange.paper;

import com.signaltrader.config.TradingProperties;
import com.signaltrader.domain.enums.OrderSide;
import com.signaltrader.domain.enums.OrderStatus;
import com.signaltrader.domain.enums.OrderType;
import com.signaltrader.domain.model.AccountState;
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
import com.signaltrader.ledger.AccountStateService;
import com.signaltrader.pnl.PnLCalculator;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Simulated exchange that fills orders against live market prices.
 *
 * <p>Fill model:
 * <ul>
 *   <li><b>MARKET:</b> fills immediately at last price moved against the taker by
 *       {@code signaltrader.exchange.paper.slippage-bps}</li>
 *   <li><b>LIMIT:</b> fills at the limit price once the last price crosses it, checked on
 *       placement and on every status lookup; otherwise rests as NEW until cancelled</li>
 * </ul>
 * Fees use the configured taker rate. Balances are the ledger-derived account state.
 */
@Component
@ConditionalOnProperty(name = "signaltrader.exchange.mode", havingValue = "PAPER", matchIfMissing = true)
public class PaperExchangeAdapter implements ExchangeAdapter {

    private static final Logger log = LoggerFactory.getLogger(PaperExchangeAdapter.class);

    private static final BigDecimal BPS = new BigDecimal("10000");

    private final MarketDataFeed marketDataFeed;
    private final AccountStateService accountStateService;
    private final PnLCalculator pnLCalculator;
    private final TradingProperties tradingProperties;
    private final Clock clock;

    private final Map<String, PaperOrder> ordersByClientId = new ConcurrentHashMap<>();
    private final AtomicLong orderSequence = new AtomicLong(0);

    public PaperExchangeAdapter(
            MarketDataFeed marketDataFeed,
            AccountStateService accountStateService,
            PnLCalculator pnLCalculator,
            TradingProperties tradingProperties,
            Clock clock) {
        this.marketDataFeed = marketDataFeed;
        this.accountStateService = accountStateService;
        this.pnLCalculator = pnLCalculator;
        this.tradingProperties = tradingProperties;
        this.clock = clock;
    }

    @Override
    public AccountSnapshot getBalance() {
        AccountState state = accountStateService.current();
        return AccountSnapshot.builder()
                .totalEquity(state.getEquity())
                .availableBalance(state.getAvailableMargin())
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

    @Override
    public String placeOrder(OrderRequest request) {
        if (request.getQuantity() == null || request.getQuantity().signum() <= 0) {
            throw new ExchangeException(ExchangeErrorType.INVALID_REQUEST, "Quantity must be positive");
        }
        if (request.getType() == OrderType.LIMIT && (request.getPrice() == null || request.getPrice().signum() <= 0)) {
            throw new ExchangeException(ExchangeErrorType.INVALID_REQUEST, "LIMIT order requires a positive price");
        }

        String orderId = "PAPER-" + orderSequence.incrementAndGet();
        PaperOrder order = new PaperOrder(orderId, request);
        if (ordersByClientId.putIfAbsent(request.getClientOrderId(), order) != null) {
            throw new ExchangeException(
                    ExchangeErrorType.INVALID_REQUEST, "Duplicate client order id " + request.getClientOrderId());
        }

        BigDecimal lastPrice = marketDataFeed.getLastPrice(request.getSymbol());
        if (request.getType() == OrderType.MARKET) {
            order.fill(applySlippage(request.getSide(), lastPrice));
        } else {
            tryFillLimit(order, lastPrice);
        }
        log.info(
                "Paper order {} {} {} {} qty={} -> {}",
                orderId,
                request.getClientOrderId(),
                request.getSide(),
                request.getSymbol(),
                request.getQuantity().toPlainString(),
                order.status);
        return orderId;
    }

    @Override
    public OrderStatusReport getOrderStatus(String symbol, String clientOrderId) {
        PaperOrder order = ordersByClientId.get(clientOrderId);
        if (order == null) {
            return OrderStatusReport.notFound(symbol, clientOrderId);
        }
        if (order.status == OrderStatus.NEW) {
            tryFillLimit(order, marketDataFeed.getLastPrice(symbol));
        }
        return order.toReport();
    }

    @Override
    public void cancelOrder(String symbol, String clientOrderId) {
        PaperOrder order = ordersByClientId.get(clientOrderId);
        if (order == null) {
            throw new ExchangeException(ExchangeErrorType.INVALID_REQUEST, "Unknown order " + clientOrderId);
        }
        synchronized (order) {
            if (order.status == OrderStatus.NEW) {
                order.status = OrderStatus.CANCELED;
            }
        }
    }

    @Override
    public ClosePositionResult closePosition(Position position) {
        BigDecimal exitPrice =
                applySlippage(position.getSide().opposite(), marketDataFeed.getLastPrice(position.getSymbol()));
        String orderId = "PAPER-" + orderSequence.incrementAndGet();
        return ClosePositionResult.builder()
                .orderId(orderId)
                .exitPrice(exitPrice)
                .quantity(position.getQuantity())
                .fee(pnLCalculator.takerFee(exitPrice, position.getQuantity()))
                .build();
    }

    /** The simulator liquidates a position once the last price reaches its liquidation price. */
    @Override
    public boolean hasOpenPosition(Position position) {
        BigDecimal lastPrice = marketDataFeed.getLastPrice(position.getSymbol());
        int cmp = lastPrice.compareTo(position.getLiquidationPrice());
        boolean liquidated = position.getSide().isLong() ? cmp <= 0 : cmp >= 0;
        return !liquidated;
    }

    private void tryFillLimit(PaperOrder order, BigDecimal lastPrice) {
        BigDecimal limit = order.request.getPrice();
        boolean crossed = order.request.getSide() == OrderSide.BUY
                ? lastPrice.compareTo(limit) <= 0
                : lastPrice.compareTo(limit) >= 0;
        if (crossed) {
            order.fill(limit);
        }
    }

    private BigDecimal applySlippage(OrderSide side, BigDecimal price) {
        BigDecimal fraction = BigDecimal.valueOf(tradingProperties.getExchange().getPaper().getSlippageBps())
                .divide(BPS, 10, RoundingMode.HALF_UP);
        BigDecimal factor = side == OrderSide.BUY ? BigDecimal.ONE.add(fraction) : BigDecimal.ONE.subtract(fraction);
        return price.multiply(factor).setScale(PnLCalculator.SCALE, RoundingMode.HALF_UP);
    }

    private final class PaperOrder {

        private final String orderId;
        private final OrderRequest request;
        private OrderStatus status = OrderStatus.NEW;
        private BigDecimal filledQuantity = BigDecimal.ZERO;
        private BigDecimal averagePrice;
        private BigDecimal fee;

        private PaperOrder(String orderId, OrderRequest request) {
            this.orderId = orderId;
            this.request = request;
        }

        private synchronized void fill(BigDecimal price) {
            if (status != OrderStatus.NEW) {
                return;
            }
            status = OrderStatus.FILLED;
            filledQuantity = request.getQuantity();
            averagePrice = price;
            fee = pnLCalculator.takerFee(price, filledQuantity);
        }

        private synchronized OrderStatusReport toReport() {
            return OrderStatusReport.builder()
                    .orderId(orderId)
                    .clientOrderId(request.getClientOrderId())
                    .symbol(request.getSymbol())
                    .status(status)
                    .filledQuantity(filledQuantity)
                    .averagePrice(averagePrice)
                    .fee(fee)
                    .build();
        }
    }
}
