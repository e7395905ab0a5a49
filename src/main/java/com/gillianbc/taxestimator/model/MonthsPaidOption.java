package com.gillianbc.taxestimator.model;

import lombok.Getter;
import lombok.ToString;

/**
 * A plausible answer to "how many months have you been paid so far", e.g. 9 (through Dec), Apr-Dec.
 */
@Getter
@ToString
public class MonthsPaidOption {

    private final int value;
    private final String label;
    private final String periodRange;

    public MonthsPaidOption(int value, String label, String periodRange) {
        this.value = value;
        this.label = label;
        this.periodRange = periodRange;
    }
}
