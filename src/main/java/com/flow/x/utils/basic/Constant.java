package com.flow.x.utils.basic;

import java.util.List;

public final class Constant {
    private Constant() {
        throw new UnsupportedOperationException("Not supported");
    }

    public static final String SOURCE = "S";
    public static final String SINK = "T";
    public static final String SEPARATOR = "|";
    public static final String MODE = "mode";
    public static final String MODE_MIN_COST = "min_cost_max_flow";
    public static final List<String> DAYS = List.of(
            "Monday", "Tuesday", "Wednesday", "Thursday", "Friday", "Saturday", "Sunday");
}
