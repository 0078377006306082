package com.signaltrader.domain.model;

import com.signaltrader.domain.enums.Direction;
import lombok.Value;

/** Raw output of a signal source before it is stamped with source id, symbol and time. */
@Value(staticConstructor = "of")
public class SignalScore {

    Direction direction;
    double confidence;

    /** A score is usable only with a direction and a finite confidence in [0, 1]. */
    public boolean isWellFormed() {
        return direction != null && !Double.isNaN(confidence) && confidence >= 0.0 && confidence <= 1.0;
    }
}
