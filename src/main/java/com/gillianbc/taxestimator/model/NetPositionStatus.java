package com.gillianbc.taxestimator.model;

import java.math.BigDecimal;

public enum NetPositionStatus {
    REFUND("Refund"),
    OWED("Owed"),
    BALANCED("Balanced");

    private final String label;

    NetPositionStatus(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public static NetPositionStatus of(BigDecimal netPosition) {
        int sign = netPosition.signum();
        return sign > 0 ? REFUND : sign < 0 ? OWED : BALANCED;
    }
}
