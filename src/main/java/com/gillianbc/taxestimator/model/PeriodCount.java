package com.gillianbc.taxestimator.model;

import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;

/**
 * Equivalent number of PAYE periods between two dates: the fraction of the first period plus
 * the whole periods that follow it.
 */
@Getter
@ToString
public class PeriodCount {

    private final BigDecimal periods;
    private final BigDecimal firstPeriodFraction;
    private final int wholePeriodsAfter;
    private final PayePeriod startPeriod;

    public PeriodCount(BigDecimal firstPeriodFraction, int wholePeriodsAfter, PayePeriod startPeriod) {
        this.firstPeriodFraction = firstPeriodFraction;
        this.wholePeriodsAfter = wholePeriodsAfter;
        this.startPeriod = startPeriod;
        this.periods = firstPeriodFraction.add(BigDecimal.valueOf(wholePeriodsAfter));
    }
}
