package com.signaltrader.risk;

import com.signaltrader.domain.enums.OrderSide;
import com.signaltrader.domain.enums.RejectionReason;
import com.signaltrader.domain.model.TradeIntent;
import java.math.BigDecimal;
import java.util.List;
import java.util.stream.Collectors;
import lombok.Builder;
import lombok.Getter;

/**
 * Sized and priced version of a trade intent, or a rejection.
 *
 * <p>{@code positionSize} is the collateral to commit, {@code notional = positionSize * leverage}
 * and {@code quantity = notional / entryPriceHint}. For an approved decision
 * {@code |stopLoss - entry| < |liquidation - entry|} always holds.
 */
@Getter
@Builder
public class RiskDecision {

    private final TradeIntent intent;
    private final String symbol;
    private final OrderSide side;

    private final BigDecimal positionSize;
    private final BigDecimal notional;
    private final BigDecimal quantity;
    private final BigDecimal leverage;
    private final BigDecimal entryPriceHint;
    private final BigDecimal stopLossPrice;
    private final BigDecimal takeProfitPrice;
    private final BigDecimal liquidationPrice;

    private final boolean rejected;
    private final RejectionReason rejectionReason;

    @Builder.Default
    private final List<RiskViolation> violations = List.of();

    public static RiskDecision rejected(TradeIntent intent, List<RiskViolation> violations) {
        return RiskDecision.builder()
                .intent(intent)
                .symbol(intent.getSymbol())
                .rejected(true)
                .rejectionReason(violations.get(0).getReason())
                .violations(List.copyOf(violations))
                .build();
    }

    public static RiskDecision rejected(TradeIntent intent, RejectionReason reason, String message) {
        return rejected(intent, List.of(RiskViolation.of(reason, message)));
    }

    public String getRejectionDetail() {
        return violations.stream().map(RiskViolation::toString).collect(Collectors.joining("; "));
    }
}
