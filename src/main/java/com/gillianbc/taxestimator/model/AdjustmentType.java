package com.gillianbc.taxestimator.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum AdjustmentType {
    UNDERPAYMENT(AdjustmentKind.DIRECT_TAX),
    UNTAXED_INTEREST(AdjustmentKind.TAXABLE_INCOME),
    BENEFIT_IN_KIND(AdjustmentKind.TAXABLE_INCOME),
    STATE_BENEFITS(AdjustmentKind.TAXABLE_INCOME),
    OTHER(AdjustmentKind.DIRECT_TAX);

    private final AdjustmentKind kind;

    public boolean isTaxableIncome() {
        return kind == AdjustmentKind.TAXABLE_INCOME;
    }
}
