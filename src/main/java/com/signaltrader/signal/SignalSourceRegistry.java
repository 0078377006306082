package com.signaltrader.signal;

import com.signaltrader.config.TradingProperties;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * The configured set of signal sources and their weights.
 *
 * <p>The number of configured sources is the quorum denominator, so disabled sources
 * are not registered at all. Source ids must be unique and weights positive.
 */
@Component
public class SignalSourceRegistry {

    private static final Logger log = LoggerFactory.getLogger(SignalSourceRegistry.class);

    private final List<RegisteredSource> sources;

    @Autowired
    public SignalSourceRegistry(TradingProperties tradingProperties, SignalSourceFactory signalSourceFactory) {
        List<RegisteredSource> built = new ArrayList<>();
        for (TradingProperties.Source config : tradingProperties.getSources()) {
            if (!config.isEnabled()) {
                log.info("Signal source {} disabled", config.getId());
                continue;
            }
            built.add(RegisteredSource.of(signalSourceFactory.create(config), config.getWeight()));
        }
        this.sources = validate(built);
        if (sources.isEmpty()) {
            log.warn("No signal sources configured; every cycle will hold");
        } else {
            log.info(
                    "Registered {} signal sources: {}",
                    sources.size(),
                    sources.stream().map(RegisteredSource::getId).toList());
        }
    }

    public SignalSourceRegistry(List<RegisteredSource> sources) {
        this.sources = validate(new ArrayList<>(sources));
    }

    public List<RegisteredSource> getSources() {
        return sources;
    }

    public int size() {
        return sources.size();
    }

    /** Weight of the source with this id, or 0 for an unknown id. */
    public double weightOf(String sourceId) {
        return sources.stream()
                .filter(source -> source.getId().equals(sourceId))
                .mapToDouble(RegisteredSource::getWeight)
                .findFirst()
                .orElse(0.0);
    }

    private static List<RegisteredSource> validate(List<RegisteredSource> candidates) {
        Set<String> ids = new HashSet<>();
        for (RegisteredSource source : candidates) {
            if (!ids.add(source.getId())) {
                throw new IllegalStateException("Duplicate signal source id: " + source.getId());
            }
            if (!(source.getWeight() > 0)) {
                throw new IllegalStateException("Signal source " + source.getId() + " must have a positive weight");
            }
        }
        return List.copyOf(candidates);
    }
}
