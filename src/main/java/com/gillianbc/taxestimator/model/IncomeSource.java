package com.gillianbc.taxestimator.model;

import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Objects;
import java.util.Optional;

/**
 * One income stream for the year. Regular sources (salary, pension) are projected to a full-year figure;
 * one-off sources are taken at face value.
 */
@Getter
@ToString
public class IncomeSource {

    private final String id;
    private final String name;
    private final BigDecimal incomeToDate;
    private final boolean regular;
    /**
     * Employment start; null means the start of the tax year. Only used for regular sources.
     */
    private final LocalDate startDate;
    /**
     * Employment end; null means the end of the tax year. Only used for regular sources.
     */
    private final LocalDate endDate;
    @Getter(AccessLevel.NONE)
    private final Integer periodsPaid;
    @Getter(AccessLevel.NONE)
    private final BigDecimal projectedIncome;
    @Getter(AccessLevel.NONE)
    private final BigDecimal taxPaid;

    @Builder
    public IncomeSource(String id,
                        String name,
                        BigDecimal incomeToDate,
                        boolean regular,
                        LocalDate startDate,
                        LocalDate endDate,
                        Integer periodsPaid,
                        BigDecimal projectedIncome,
                        BigDecimal taxPaid) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.id = id == null ? name : id;
        this.incomeToDate = Objects.requireNonNull(incomeToDate, "incomeToDate must not be null");
        if (incomeToDate.signum() < 0) {
            throw new IllegalArgumentException("incomeToDate for " + name + " must be >= 0");
        }
        if (periodsPaid != null && periodsPaid < 0) {
            throw new IllegalArgumentException("periodsPaid for " + name + " must be >= 0");
        }
        this.regular = regular;
        this.startDate = startDate;
        this.endDate = endDate;
        this.periodsPaid = periodsPaid;
        this.projectedIncome = projectedIncome;
        this.taxPaid = taxPaid;
    }

    public static IncomeSource regular(String name, String incomeToDate, LocalDate startDate) {
        return builder().name(name).incomeToDate(new BigDecimal(incomeToDate)).regular(true).startDate(startDate).build();
    }

    public static IncomeSource oneOff(String name, String amount) {
        return builder().name(name).incomeToDate(new BigDecimal(amount)).regular(false).build();
    }

    /**
     * Number of pay periods already paid, when the caller knows it. Zero counts as unknown.
     */
    public Optional<Integer> getPeriodsPaid() {
        return Optional.ofNullable(periodsPaid).filter(p -> p > 0);
    }

    /**
     * Full-year figure supplied by the user, which replaces any projection.
     */
    public Optional<BigDecimal> getProjectedIncome() {
        return Optional.ofNullable(projectedIncome);
    }

    /**
     * Tax actually deducted so far, as entered by the user.
     */
    public Optional<BigDecimal> getTaxPaid() {
        return Optional.ofNullable(taxPaid);
    }
}
