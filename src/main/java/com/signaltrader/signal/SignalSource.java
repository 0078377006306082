package com.signaltrader.signal;

import com.signaltrader.domain.model.MarketContext;
import com.signaltrader.domain.model.SignalScore;
import java.util.Optional;

/**
 * An independent producer of directional opinions.
 *
 * <p>Implementations may be slow, may throw, or may return an empty Optional to
 * express no opinion. The collector bounds each call with a timeout and drops
 * failures for the current cycle only.
 */
public interface SignalSource {

    String getId();

    Optional<SignalScore> score(String symbol, MarketContext marketContext);
}
