package com.signaltrader.api.controller;

import com.signaltrader.api.dto.request.CircuitBreakerResetRequest;
import com.signaltrader.api.dto.request.EmergencyStopRequest;
import com.signaltrader.api.dto.response.AccountSummaryResponse;
import com.signaltrader.domain.enums.CircuitBreakerState;
import com.signaltrader.domain.enums.ExitReason;
import com.signaltrader.domain.model.AccountState;
import com.signaltrader.domain.model.Position;
import com.signaltrader.domain.model.Trade;
import com.signaltrader.exception.BusinessException;
import com.signaltrader.exception.ErrorCode;
import com.signaltrader.ledger.AccountStateService;
import com.signaltrader.position.PositionLifecycleManager;
import com.signaltrader.reporting.PerformanceCalculator;
import com.signaltrader.reporting.PerformanceReport;
import com.signaltrader.risk.CircuitBreakerStatus;
import com.signaltrader.risk.EmergencyStopResult;
import com.signaltrader.risk.EmergencyStopService;
import com.signaltrader.risk.TradingCircuitBreaker;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Operator endpoints for account state, positions, performance, the circuit breaker and
 * the emergency stop.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>GET /api/account -- equity, margin and daily PnL from the ledger-derived state</li>
 *   <li>GET /api/positions -- open positions</li>
 *   <li>POST /api/positions/{id}/close -- close one position at market</li>
 *   <li>GET /api/performance -- performance metrics over closed trades</li>
 *   <li>GET /api/circuit-breaker -- breaker state and limits</li>
 *   <li>POST /api/circuit-breaker/reset -- re-arm the breaker</li>
 *   <li>POST /api/emergency-stop -- halt trading, optionally closing every position</li>
 * </ul>
 */
@RestController
@RequestMapping("/api")
public class OperatorController {

    private static final Logger log = LoggerFactory.getLogger(OperatorController.class);

    private final AccountStateService accountStateService;
    private final PositionLifecycleManager positionLifecycleManager;
    private final PerformanceCalculator performanceCalculator;
    private final TradingCircuitBreaker tradingCircuitBreaker;
    private final EmergencyStopService emergencyStopService;

    public OperatorController(
            AccountStateService accountStateService,
            PositionLifecycleManager positionLifecycleManager,
            PerformanceCalculator performanceCalculator,
            TradingCircuitBreaker tradingCircuitBreaker,
            EmergencyStopService emergencyStopService) {
        this.accountStateService = accountStateService;
        this.positionLifecycleManager = positionLifecycleManager;
        this.performanceCalculator = performanceCalculator;
        this.tradingCircuitBreaker = tradingCircuitBreaker;
        this.emergencyStopService = emergencyStopService;
    }

    @GetMapping("/account")
    public ResponseEntity<AccountSummaryResponse> getAccount() {
        AccountState state = accountStateService.current();
        return ResponseEntity.ok(AccountSummaryResponse.builder()
                .equity(state.getEquity())
                .availableMargin(state.getAvailableMargin())
                .equityAtDayStart(state.getEquityAtDayStart())
                .tradingDay(state.getTradingDay())
                .dailyRealizedPnl(state.getDailyRealizedPnl())
                .consecutiveLosses(state.getConsecutiveLosses())
                .openPositionCount(state.getOpenPositionCount())
                .closedTradeCount(state.getClosedTradeCount())
                .lastSequenceId(state.getLastSequenceId())
                .pendingLedgerWrites(positionLifecycleManager.getPendingWriteCount())
                .circuitBreakerState(tradingCircuitBreaker.currentState())
                .build());
    }

    @GetMapping("/positions")
    public ResponseEntity<List<Position>> getOpenPositions() {
        return ResponseEntity.ok(positionLifecycleManager.getOpenPositions());
    }

    /**
     * Closes a position with exit reason MANUAL. Responds 409 when the exchange close failed
     * or the trade could not be written yet; the position monitor keeps retrying the write.
     */
    @PostMapping("/positions/{id}/close")
    public ResponseEntity<Trade> closePosition(@PathVariable("id") String positionId) {
        log.info("Manual close requested for position {}", positionId);
        Trade trade = positionLifecycleManager
                .closePosition(positionId, ExitReason.MANUAL)
                .orElseThrow(() -> new BusinessException(
                        ErrorCode.CONFLICT,
                        "Position " + positionId + " was not closed",
                        Map.of(
                                "positionId",
                                positionId,
                                "pendingLedgerWrite",
                                positionLifecycleManager.hasPendingWrites(positionId))));
        return ResponseEntity.ok(trade);
    }

    @GetMapping("/performance")
    public ResponseEntity<PerformanceReport> getPerformance() {
        return ResponseEntity.ok(performanceCalculator.calculate());
    }

    @GetMapping("/circuit-breaker")
    public ResponseEntity<CircuitBreakerStatus> getCircuitBreaker() {
        return ResponseEntity.ok(tradingCircuitBreaker.status());
    }

    @PostMapping("/circuit-breaker/reset")
    public ResponseEntity<Map<String, Object>> resetCircuitBreaker(
            @Valid @RequestBody CircuitBreakerResetRequest request) {
        log.warn("Circuit breaker reset requested by {}", request.getOperator());
        CircuitBreakerState state = emergencyStopService.deactivate(request.getOperator());
        return ResponseEntity.ok(Map.of("state", state));
    }

    @PostMapping("/emergency-stop")
    public ResponseEntity<EmergencyStopResult> emergencyStop(@Valid @RequestBody EmergencyStopRequest request) {
        log.error("EMERGENCY STOP REQUESTED: {} (closePositions={})", request.getReason(), request.isClosePositions());
        return ResponseEntity.ok(emergencyStopService.activate(request.getReason(), request.isClosePositions()));
    }
}
