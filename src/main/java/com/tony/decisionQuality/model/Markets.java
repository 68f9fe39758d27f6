package com.tony.decisionQuality.model;

import java.util.List;

public final class Markets {
    public static final String ONE_X_TWO = "one_x_two";
    public static final String OVER_UNDER_25 = "over_under_25";
    public static final String GG_NG = "gg_ng";

    public static final List<String> CANONICAL = List.of(ONE_X_TWO, OVER_UNDER_25, GG_NG);

    private Markets() {
    }
}
