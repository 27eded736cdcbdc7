package com.agonyforge.perpscanner;

import java.math.BigDecimal;

public final class DecimalConstants {
    public static final int PERCENT_SCALE = 8;
    public static final BigDecimal ONE_HUNDRED = BigDecimal.valueOf(100);

    private DecimalConstants() {
        // this method intentionally left blank
    }
}
