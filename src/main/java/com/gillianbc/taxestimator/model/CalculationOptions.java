package com.gillianbc.taxestimator.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.LocalDate;

@Getter
@Builder
@ToString
public class CalculationOptions {

    /**
     * Date the calculation is made as of; null means today according to the service clock.
     */
    private final LocalDate asOfDate;
    /**
     * Name of the band table to tax with; null means the tax year's default table.
     */
    private final String bandTable;
    /**
     * When false, income is treated as received only up to the end of the previous PAYE period.
     */
    @Builder.Default
    private final boolean includeCurrentPeriod = true;

    public static CalculationOptions defaults() {
        return builder().build();
    }

    public static CalculationOptions asOf(LocalDate asOfDate) {
        return builder().asOfDate(asOfDate).build();
    }
}
