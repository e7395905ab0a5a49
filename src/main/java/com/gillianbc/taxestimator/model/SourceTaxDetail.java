package com.gillianbc.taxestimator.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;

/**
 * Per-source share of allowance and tax, attributed in source order.
 */
@Getter
@Builder
@ToString
public class SourceTaxDetail {

    private final String name;
    private final BigDecimal income;
    private final BigDecimal allowanceUsed;
    private final BigDecimal taxableIncome;
    private final BigDecimal taxDue;
    private final BigDecimal taxPaid;
    /**
     * taxPaid - taxDue; positive means this source has been over-taxed.
     */
    private final BigDecimal difference;
    private final String notes;
}
