package com.gillianbc.taxestimator.model;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

import java.math.BigDecimal;
import java.util.List;

/**
 * Complete outcome of one calculation. Monetary values are rounded to 2dp.
 */
@Getter
@Builder
@ToString
public class CalculationResult {

    private final BigDecimal totalIncome;
    private final BigDecimal personalAllowance;
    private final BigDecimal totalDeductions;
    private final BigDecimal taxableIncomeBeforeDeductions;
    private final BigDecimal taxableIncomeAfterDeductions;
    private final BigDecimal taxDueOnIncome;
    private final BigDecimal totalAdditionalTaxableIncome;
    /**
     * Taxable income after deductions plus all taxable-income adjustments.
     */
    private final BigDecimal finalTaxableIncome;
    private final BigDecimal totalAdjustmentTax;
    private final BigDecimal finalTaxDue;
    private final BigDecimal taxPaid;
    /**
     * taxPaid - finalTaxDue; positive is a refund, negative is owed.
     */
    private final BigDecimal netPosition;
    private final NetPositionStatus netPositionStatus;
    private final String bandTable;
    @Singular
    private final List<IncomeProjection> sources;
    @Singular
    private final List<SourceTaxDetail> sourceDetails;
    @Singular
    private final List<String> steps;
}
