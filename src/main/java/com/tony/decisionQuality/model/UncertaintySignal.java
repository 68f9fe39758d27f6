package com.tony.decisionQuality.model;

import lombok.Value;

@Value
public class UncertaintySignal {
    SignalType signalType;
    String reasonCode; // courte explication
    boolean triggered;
}
