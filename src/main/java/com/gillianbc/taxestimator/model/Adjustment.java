package com.gillianbc.taxestimator.model;

import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Supplementary item that adds to the tax bill, either directly (e.g. an underpayment carried forward)
 * or as extra taxable income (e.g. untaxed interest, a benefit in kind).
 * <p>
 * Taxable-income amounts must be non-negative because they stack upwards through the bands. A negative
 * direct-tax amount is a credit against the bill.
 */
@Getter
@ToString
public class Adjustment {

    private final String description;
    private final BigDecimal amount;
    private final AdjustmentType type;

    public Adjustment(String description, BigDecimal amount, AdjustmentType type) {
        this.description = Objects.requireNonNull(description, "description must not be null");
        this.amount = Objects.requireNonNull(amount, "amount must not be null");
        this.type = Objects.requireNonNull(type, "type must not be null");
        if (type.isTaxableIncome() && amount.signum() < 0) {
            throw new IllegalArgumentException("taxable income adjustment " + description + " must be >= 0");
        }
    }

    public static Adjustment of(String description, String amount, AdjustmentType type) {
        return new Adjustment(description, new BigDecimal(amount), type);
    }

    public AdjustmentKind getKind() {
        return type.getKind();
    }
}
