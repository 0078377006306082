package com.signaltrader.oms;

import java.time.Clock;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Generates client order ids, the idempotency key for order submission.
 *
 * <p>Format: {@code st-{symbol_4}-{epochMillisBase36}-{seq_4}}, e.g. "st-btcu-lq3x9k2a-0007".
 * At most 36 characters, within the exchange limit. The timestamp part keeps ids unique
 * across restarts, where the sequence starts again at zero; the sequence keeps them unique
 * within one millisecond.
 */
@Component
public class ClientOrderIdGenerator {

    private static final Logger log = LoggerFactory.getLogger(ClientOrderIdGenerator.class);

    private static final String PREFIX = "st-";
    private static final int MAX_SEQUENCE = 10000;

    private final Clock clock;
    private final AtomicInteger sequence = new AtomicInteger(0);

    public ClientOrderIdGenerator(Clock clock) {
        this.clock = clock;
    }

    public String next(String symbol) {
        int seq = sequence.incrementAndGet() % MAX_SEQUENCE;
        String id = String.format(
                "%s%s-%s-%04d", PREFIX, symbolPrefix(symbol), Long.toString(clock.millis(), 36), seq);
        log.debug("Generated client order id: {}", id);
        return id;
    }

    private static String symbolPrefix(String symbol) {
        if (symbol == null || symbol.isEmpty()) {
            return "gen";
        }
        return symbol.substring(0, Math.min(4, symbol.length())).toLowerCase(Locale.ROOT);
    }
}
