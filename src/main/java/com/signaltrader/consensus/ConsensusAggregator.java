package com.signaltrader.consensus;

import com.signaltrader.config.TradingProperties;
import com.signaltrader.domain.enums.Direction;
import com.signaltrader.domain.enums.HoldReason;
import com.signaltrader.domain.model.Signal;
import com.signaltrader.domain.model.TradeIntent;
import com.signaltrader.signal.SignalSourceRegistry;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Folds the signals of one cycle into a single trade intent.
 *
 * <pre>
 * net_score = sum(weight_i * confidence_i * sign_i) / sum(weight_i)
 * </pre>
 * Both sums run over responding sources only; a source that did not respond has weight 0
 * in numerator and denominator alike. HOLD signals add their weight to the denominator
 * and nothing to the numerator.
 *
 * <p>Hold when the responding share of configured sources is below
 * {@code signaltrader.consensus.min-quorum}, or when {@code |net_score|} does not exceed
 * {@code signaltrader.consensus.threshold}. Otherwise the intent's direction is the sign of
 * the score and its aggregate confidence is {@code |net_score|}.
 *
 * <p>Only the first signal per source id counts; signals from unregistered sources are ignored.
 */
@Service
public class ConsensusAggregator {

    private static final Logger log = LoggerFactory.getLogger(ConsensusAggregator.class);

    private final SignalSourceRegistry signalSourceRegistry;
    private final TradingProperties tradingProperties;
    private final Clock clock;

    public ConsensusAggregator(
            SignalSourceRegistry signalSourceRegistry, TradingProperties tradingProperties, Clock clock) {
        this.signalSourceRegistry = signalSourceRegistry;
        this.tradingProperties = tradingProperties;
        this.clock = clock;
    }

    public ConsensusResult aggregate(String symbol, List<Signal> signals) {
        int configured = signalSourceRegistry.size();

        Map<String, Signal> bySource = new LinkedHashMap<>();
        for (Signal signal : signals) {
            if (!symbol.equals(signal.getSymbol()) || signalSourceRegistry.weightOf(signal.getSourceId()) <= 0) {
                log.warn(
                        "Ignoring signal from {} for {} in {} cycle", signal.getSourceId(), signal.getSymbol(), symbol);
                continue;
            }
            bySource.putIfAbsent(signal.getSourceId(), signal);
        }
        int responding = bySource.size();

        if (configured == 0 || (double) responding / configured < tradingProperties.getConsensus().getMinQuorum()) {
            ConsensusResult hold =
                    ConsensusResult.hold(symbol, HoldReason.INSUFFICIENT_QUORUM, 0.0, responding, configured);
            log.info("Consensus {}", hold);
            return hold;
        }

        double weightedSum = 0.0;
        double totalWeight = 0.0;
        for (Signal signal : bySource.values()) {
            double weight = signalSourceRegistry.weightOf(signal.getSourceId());
            weightedSum += weight * signal.getConfidence() * signal.getDirection().sign();
            totalWeight += weight;
        }
        if (totalWeight <= 0.0) {
            return ConsensusResult.hold(symbol, HoldReason.NO_SIGNALS, 0.0, responding, configured);
        }

        double netScore = weightedSum / totalWeight;
        double threshold = tradingProperties.getConsensus().getThreshold();
        if (Math.abs(netScore) <= threshold) {
            ConsensusResult hold =
                    ConsensusResult.hold(symbol, HoldReason.BELOW_THRESHOLD, netScore, responding, configured);
            log.info("Consensus {}", hold);
            return hold;
        }

        TradeIntent intent = TradeIntent.builder()
                .symbol(symbol)
                .direction(netScore > 0 ? Direction.BUY : Direction.SELL)
                .aggregateConfidence(Math.abs(netScore))
                .contributingSignalCount(responding)
                .timestamp(clock.instant())
                .build();
        ConsensusResult result = ConsensusResult.trade(intent, netScore, responding, configured);
        log.info("Consensus {}", result);
        return result;
    }
}
