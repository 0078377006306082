package com.signaltrader.oms;

import com.signaltrader.config.TradingProperties;
import com.signaltrader.domain.enums.OrderStatus;
import com.signaltrader.domain.enums.OrderType;
import com.signaltrader.domain.enums.RejectionReason;
import com.signaltrader.domain.model.ExecutionResult;
import com.signaltrader.domain.model.Position;
import com.signaltrader.event.TradingEventPublisher;
import com.signaltrader.exception.BusinessException;
import com.signaltrader.exception.ErrorCode;
import com.signaltrader.exception.ExchangeException;
import com.signaltrader.exception.LedgerWriteException;
import com.signaltrader.exception.OrderExecutionException;
import com.signaltrader.exception.TradingHaltedException;
import com.signaltrader.exchange.ExchangeAdapter;
import com.signaltrader.exchange.OrderRequest;
import com.signaltrader.exchange.OrderStatusReport;
import com.signaltrader.ledger.AccountStateService;
import com.signaltrader.pnl.PnLCalculator;
import com.signaltrader.position.PositionLifecycleManager;
import com.signaltrader.risk.RiskDecision;
import com.signaltrader.risk.TradingCircuitBreaker;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Submits the entry order for an approved {@link RiskDecision} and hands the fill to the
 * {@link PositionLifecycleManager}.
 *
 * <p>Submission pipeline:
 * <ol>
 *   <li>In-flight guard: at most one entry order per symbol at a time</li>
 *   <li>Leverage applied on the exchange for the symbol</li>
 *   <li>Submit with Resilience4j retry and exponential random backoff. Only retryable
 *       {@link ExchangeException}s are retried, and none once an emergency stop is active</li>
 *   <li>Before every resubmission the order is looked up by client order id; an order the
 *       exchange already knows is never sent again</li>
 *   <li>Fill polling until the order is terminal or the fill timeout passes; on timeout the
 *       order is cancelled and queried once more, and any fill so far is kept</li>
 * </ol>
 *
 * <p>A partial fill is a success. A fatal failure records an {@code execution_failed}
 * rejection, publishes EXECUTION_ERROR and throws {@link OrderExecutionException}.
 */
@Service
public class OrderExecutionEngine {

    private static final Logger log = LoggerFactory.getLogger(OrderExecutionEngine.class);

    private static final int SCALE = 8;

    private final ExchangeAdapter exchangeAdapter;
    private final PositionLifecycleManager positionLifecycleManager;
    private final AccountStateService accountStateService;
    private final TradingCircuitBreaker circuitBreaker;
    private final TradingEventPublisher tradingEventPublisher;
    private final ClientOrderIdGenerator clientOrderIdGenerator;
    private final PnLCalculator pnLCalculator;
    private final TradingProperties tradingProperties;
    private final RetryConfig retryConfig;

    private final Set<String> inFlightSymbols = ConcurrentHashMap.newKeySet();

    public OrderExecutionEngine(
            ExchangeAdapter exchangeAdapter,
            PositionLifecycleManager positionLifecycleManager,
            AccountStateService accountStateService,
            TradingCircuitBreaker circuitBreaker,
            TradingEventPublisher tradingEventPublisher,
            ClientOrderIdGenerator clientOrderIdGenerator,
            PnLCalculator pnLCalculator,
            TradingProperties tradingProperties) {
        this.exchangeAdapter = exchangeAdapter;
        this.positionLifecycleManager = positionLifecycleManager;
        this.accountStateService = accountStateService;
        this.circuitBreaker = circuitBreaker;
        this.tradingEventPublisher = tradingEventPublisher;
        this.clientOrderIdGenerator = clientOrderIdGenerator;
        this.pnLCalculator = pnLCalculator;
        this.tradingProperties = tradingProperties;
        this.retryConfig = buildRetryConfig(tradingProperties.getExecution());
    }

    // ========================
    // EXECUTION
    // ========================

    /**
     * Executes the entry order of {@code decision} and opens the position.
     *
     * @throws OrderExecutionException when the order could not be placed or never filled
     * @throws BusinessException with CONFLICT when an entry order for the symbol is already in flight
     */
    public ExecutionResult execute(RiskDecision decision) {
        if (decision.isRejected()) {
            throw new IllegalArgumentException("Cannot execute a rejected decision for " + decision.getSymbol());
        }

        String symbol = decision.getSymbol();
        if (!inFlightSymbols.add(symbol)) {
            throw new BusinessException(ErrorCode.CONFLICT, "An entry order for " + symbol + " is already in flight");
        }

        String clientOrderId = clientOrderIdGenerator.next(symbol);
        try {
            OrderRequest request = buildRequest(decision, clientOrderId);
            log.info(
                    "Placing {} {} {} qty={} cid={}",
                    request.getType(),
                    request.getSide(),
                    symbol,
                    request.getQuantity().toPlainString(),
                    clientOrderId);

            ensureNotHalted(symbol);
            exchangeAdapter.setLeverage(symbol, decision.getLeverage().intValue());

            String orderId = submitWithRetry(request);
            OrderStatusReport report = awaitFill(request, orderId);
            if (!report.hasFill()) {
                throw fatal(
                        decision,
                        clientOrderId,
                        "Order " + clientOrderId + " ended " + report.getStatus() + " without a fill",
                        null);
            }

            ExecutionResult result = toResult(decision, request, report, orderId);
            Position position = positionLifecycleManager.openPosition(decision, result);
            log.info(
                    "Entry filled for {}: qty={}/{} @ {} (slippage {}), position {}",
                    symbol,
                    result.getFilledQuantity().toPlainString(),
                    result.getRequestedQuantity().toPlainString(),
                    result.getFilledPrice().toPlainString(),
                    result.getSlippage().toPlainString(),
                    position.getId());
            return result.toBuilder().positionId(position.getId()).build();
        } catch (TradingHaltedException e) {
            throw fatal(decision, clientOrderId, "Entry aborted by emergency stop: " + e.getMessage(), e);
        } catch (ExchangeException e) {
            throw fatal(
                    decision,
                    clientOrderId,
                    "Entry order failed (" + e.getErrorType() + "): " + e.getMessage(),
                    e);
        } finally {
            inFlightSymbols.remove(symbol);
        }
    }

    public boolean isInFlight(String symbol) {
        return inFlightSymbols.contains(symbol);
    }

    // ========================
    // SUBMISSION WITH RETRY
    // ========================

    /**
     * Places the order, retrying retryable errors. Every attempt after the first begins with
     * a status lookup so that an order which reached the exchange on an earlier, failed
     * attempt is adopted instead of duplicated.
     */
    private String submitWithRetry(OrderRequest request) {
        String symbol = request.getSymbol();
        String clientOrderId = request.getClientOrderId();
        AtomicInteger attempts = new AtomicInteger(0);

        Retry retry = Retry.of("entry-" + clientOrderId, retryConfig);
        retry.getEventPublisher()
                .onRetry(event -> log.warn(
                        "Submit attempt {} for {} failed, retrying in {}ms: {}",
                        event.getNumberOfRetryAttempts(),
                        clientOrderId,
                        event.getWaitInterval().toMillis(),
                        event.getLastThrowable().getMessage()));

        Supplier<String> attempt = () -> {
            ensureNotHalted(symbol);
            if (attempts.getAndIncrement() > 0) {
                OrderStatusReport existing = exchangeAdapter.getOrderStatus(symbol, clientOrderId);
                if (existing.exists()) {
                    log.info(
                            "Order {} already on exchange ({}), not resubmitting",
                            clientOrderId,
                            existing.getStatus());
                    return existing.getOrderId();
                }
                ensureNotHalted(symbol);
            }
            return exchangeAdapter.placeOrder(request);
        };

        return Retry.decorateSupplier(retry, attempt).get();
    }

    private RetryConfig buildRetryConfig(TradingProperties.Execution execution) {
        IntervalFunction backoff = IntervalFunction.ofExponentialRandomBackoff(
                Math.max(1L, execution.getInitialBackoff().toMillis()),
                execution.getBackoffMultiplier(),
                execution.getBackoffJitter(),
                Math.max(1L, execution.getMaxBackoff().toMillis()));
        return RetryConfig.custom()
                .maxAttempts(Math.max(1, execution.getMaxAttempts()))
                .intervalFunction(backoff)
                .retryOnException(this::isRetryable)
                .build();
    }

    private boolean isRetryable(Throwable throwable) {
        return throwable instanceof ExchangeException exchangeException
                && exchangeException.isRetryable()
                && !circuitBreaker.isHalted();
    }

    private void ensureNotHalted(String symbol) {
        if (circuitBreaker.isHalted()) {
            throw new TradingHaltedException("Emergency stop active, not submitting entry for " + symbol);
        }
    }

    // ========================
    // FILL TRACKING
    // ========================

    private OrderStatusReport awaitFill(OrderRequest request, String orderId) {
        TradingProperties.Execution execution = tradingProperties.getExecution();
        long deadline = System.nanoTime() + execution.getFillTimeout().toNanos();
        OrderStatusReport last = null;

        while (true) {
            last = pollStatus(request, last);
            if (last != null && last.getStatus().isTerminal()) {
                return last;
            }
            if (System.nanoTime() >= deadline) {
                break;
            }
            sleep(execution.getFillPollInterval());
        }

        log.warn(
                "Order {} ({}) not terminal after {}, cancelling",
                request.getClientOrderId(),
                orderId,
                execution.getFillTimeout());
        try {
            exchangeAdapter.cancelOrder(request.getSymbol(), request.getClientOrderId());
        } catch (ExchangeException e) {
            log.warn("Cancel of {} failed: {}", request.getClientOrderId(), e.getMessage());
        }
        OrderStatusReport finalReport = exchangeAdapter.getOrderStatus(request.getSymbol(), request.getClientOrderId());
        log.info(
                "Order {} after cancel: {} filled={}",
                request.getClientOrderId(),
                finalReport.getStatus(),
                finalReport.getFilledQuantity());
        return finalReport;
    }

    private OrderStatusReport pollStatus(OrderRequest request, OrderStatusReport previous) {
        try {
            return exchangeAdapter.getOrderStatus(request.getSymbol(), request.getClientOrderId());
        } catch (ExchangeException e) {
            if (!e.isRetryable()) {
                throw e;
            }
            log.warn("Status poll for {} failed: {}", request.getClientOrderId(), e.getMessage());
            return previous;
        }
    }

    // ========================
    // INTERNALS
    // ========================

    private OrderRequest buildRequest(RiskDecision decision, String clientOrderId) {
        OrderType type = tradingProperties.getExecution().getOrderType();
        return OrderRequest.builder()
                .clientOrderId(clientOrderId)
                .symbol(decision.getSymbol())
                .side(decision.getSide())
                .type(type)
                .quantity(decision.getQuantity())
                .price(type == OrderType.LIMIT ? decision.getEntryPriceHint() : null)
                .reduceOnly(false)
                .build();
    }

    private ExecutionResult toResult(
            RiskDecision decision, OrderRequest request, OrderStatusReport report, String orderId) {
        BigDecimal filledPrice = report.getAveragePrice();
        BigDecimal filledQuantity = report.getFilledQuantity();
        BigDecimal expected = decision.getEntryPriceHint();
        BigDecimal slippage = filledPrice.subtract(expected).divide(expected, SCALE, RoundingMode.HALF_UP);
        BigDecimal fee =
                report.getFee() != null ? report.getFee() : pnLCalculator.takerFee(filledPrice, filledQuantity);

        return ExecutionResult.builder()
                .success(true)
                .orderId(report.getOrderId() != null ? report.getOrderId() : orderId)
                .clientOrderId(request.getClientOrderId())
                .requestedQuantity(request.getQuantity())
                .filledQuantity(filledQuantity)
                .filledPrice(filledPrice)
                .slippage(slippage)
                .fee(fee)
                .partialFill(filledQuantity.compareTo(request.getQuantity()) < 0
                        || report.getStatus() == OrderStatus.PARTIALLY_FILLED)
                .build();
    }

    private OrderExecutionException fatal(
            RiskDecision decision, String clientOrderId, String message, Throwable cause) {
        log.error("Execution failed for {} (cid={}): {}", decision.getSymbol(), clientOrderId, message);
        try {
            accountStateService.recordRejection(decision.getIntent(), RejectionReason.EXECUTION_FAILED, message);
        } catch (LedgerWriteException e) {
            log.error("Failed to record execution failure for {}: {}", decision.getSymbol(), e.getMessage());
        }
        tradingEventPublisher.publishExecutionError(this, decision.getSymbol(), clientOrderId, message);
        return cause == null
                ? new OrderExecutionException(decision.getSymbol(), clientOrderId, message)
                : new OrderExecutionException(decision.getSymbol(), clientOrderId, message, cause);
    }

    private void sleep(Duration duration) {
        try {
            Thread.sleep(Math.max(1L, duration.toMillis()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TradingHaltedException("Interrupted while waiting for fill");
        }
    }
}
