package com.gillianbc.taxestimator.model;

public enum AdjustmentKind {
    /** Amount is tax, added straight to the final figure. */
    DIRECT_TAX,
    /** Amount is extra taxable income, taxed at the marginal position reached so far. */
    TAXABLE_INCOME
}
