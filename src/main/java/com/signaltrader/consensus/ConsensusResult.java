package com.signaltrader.consensus;

import com.signaltrader.domain.enums.HoldReason;
import com.signaltrader.domain.model.TradeIntent;
import lombok.Builder;
import lombok.Getter;

/**
 * Either a {@link TradeIntent} or a hold with its reason, plus the numbers behind it.
 */
@Getter
@Builder
public class ConsensusResult {

    private final String symbol;
    private final TradeIntent intent;
    private final HoldReason holdReason;
    private final double netScore;
    private final int respondingSources;
    private final int configuredSources;

    public boolean isHold() {
        return intent == null;
    }

    public static ConsensusResult hold(
            String symbol, HoldReason reason, double netScore, int respondingSources, int configuredSources) {
        return ConsensusResult.builder()
                .symbol(symbol)
                .holdReason(reason)
                .netScore(netScore)
                .respondingSources(respondingSources)
                .configuredSources(configuredSources)
                .build();
    }

    public static ConsensusResult trade(
            TradeIntent intent, double netScore, int respondingSources, int configuredSources) {
        return ConsensusResult.builder()
                .symbol(intent.getSymbol())
                .intent(intent)
                .netScore(netScore)
                .respondingSources(respondingSources)
                .configuredSources(configuredSources)
                .build();
    }

    @Override
    public String toString() {
        String label = isHold() ? "HOLD(" + holdReason + ")" : intent.getDirection().name();
        return String.format(
                "%s %s score=%.4f quorum=%d/%d", label, symbol, netScore, respondingSources, configuredSources);
    }
}
