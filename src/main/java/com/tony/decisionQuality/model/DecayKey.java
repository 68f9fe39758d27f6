package com.tony.decisionQuality.model;

public record DecayKey(String market, String reasonCode) {

    public static DecayKey of(DecayModelParams params) {
        return new DecayKey(params.getMarket(), params.getReasonCode());
    }
}
