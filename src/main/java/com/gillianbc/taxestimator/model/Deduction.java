package com.gillianbc.taxestimator.model;

import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Flat reduction applied once to aggregate taxable income.
 */
@Getter
@ToString
public class Deduction {

    private final String description;
    private final BigDecimal amount;
    private final DeductionCategory category;

    public Deduction(String description, BigDecimal amount, DeductionCategory category) {
        this.description = Objects.requireNonNull(description, "description must not be null");
        this.amount = Objects.requireNonNull(amount, "amount must not be null");
        this.category = Objects.requireNonNull(category, "category must not be null");
        if (amount.signum() < 0) {
            throw new IllegalArgumentException("deduction " + description + " must be >= 0");
        }
    }

    public static Deduction of(String description, String amount, DeductionCategory category) {
        return new Deduction(description, new BigDecimal(amount), category);
    }
}
