package com.signaltrader.signal;

import lombok.Value;

/** A signal source together with its consensus weight. */
@Value(staticConstructor = "of")
public class RegisteredSource {

    SignalSource source;
    double weight;

    public String getId() {
        return source.getId();
    }
}
