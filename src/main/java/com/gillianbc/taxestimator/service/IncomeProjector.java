package com.gillianbc.taxestimator.service;

import com.gillianbc.taxestimator.model.IncomeProjection;
import com.gillianbc.taxestimator.model.IncomeSource;
import com.gillianbc.taxestimator.model.PeriodCount;
import com.gillianbc.taxestimator.model.ProjectionBasis;
import com.gillianbc.taxestimator.model.TaxYearConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Objects;
import java.util.Optional;

/**
 * Turns income received so far into a full-year figure per source.
 * <p>
 * A regular source is projected as {@code incomeToDate / periodsWorked * totalPeriods}, where both
 * period counts are PAYE periods and the first period may be fractional. A user-supplied projection
 * always wins, and one-off income is never projected.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IncomeProjector {

    private final PayPeriodCalendar calendar;

    public IncomeProjection project(IncomeSource source, LocalDate asOfDate, TaxYearConfig taxYear) {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(asOfDate, "asOfDate must not be null");
        Objects.requireNonNull(taxYear, "taxYear must not be null");

        if (!source.isRegular()) {
            return baseProjection(source, ProjectionBasis.ONE_OFF, source.getIncomeToDate())
                    .calculation("One-off payment: " + Amounts.gbp(source.getIncomeToDate()) + " (actual)")
                    .build();
        }
        Optional<BigDecimal> override = source.getProjectedIncome();
        if (override.isPresent()) {
            return baseProjection(source, ProjectionBasis.USER_OVERRIDE, override.get())
                    .calculation("User override: " + Amounts.gbp(override.get()))
                    .build();
        }
        return projectRegular(source, asOfDate, taxYear);
    }

    private IncomeProjection projectRegular(IncomeSource source, LocalDate asOfDate, TaxYearConfig taxYear) {
        LocalDate yearStart = taxYear.getStartDate();
        LocalDate start = calendar.clampToYearStart(source.getStartDate(), yearStart);
        LocalDate end = source.getEndDate() == null ? taxYear.getEndDate() : source.getEndDate();
        PeriodCount total = calendar.totalPeriodsInRange(start, end, yearStart);
        BigDecimal incomeToDate = source.getIncomeToDate();

        BigDecimal periodsWorked;
        BigDecimal firstPeriodFraction;
        String periodNote;
        Optional<Integer> periodsPaid = source.getPeriodsPaid();
        if (periodsPaid.isPresent()) {
            // Whole periods as stated by the user; no fractional first period
            periodsWorked = BigDecimal.valueOf(periodsPaid.get());
            firstPeriodFraction = BigDecimal.ONE;
            periodNote = periodsPaid.get() + " months paid";
        } else {
            if (!asOfDate.isAfter(start)) {
                return unprojected(source, total, "income not yet started as of " + asOfDate);
            }
            // A finished source stops accruing periods at its end date
            LocalDate workedUntil = asOfDate.isAfter(end) ? end : asOfDate;
            PeriodCount worked = calendar.equivalentPeriodsWorked(start, workedUntil, yearStart);
            periodsWorked = worked.getPeriods();
            firstPeriodFraction = worked.getFirstPeriodFraction();
            periodNote = "auto-calculated";
        }
        if (periodsWorked.signum() <= 0 || total.getPeriods().signum() <= 0) {
            return unprojected(source, total, "no whole-year period count available");
        }

        BigDecimal monthlyRate = incomeToDate.divide(periodsWorked, Amounts.MATH_CONTEXT);
        BigDecimal projected = Amounts.money(monthlyRate.multiply(total.getPeriods(), Amounts.MATH_CONTEXT));
        int startPeriodNumber = total.getStartPeriod().getPeriodNumber();

        StringBuilder calculation = new StringBuilder()
                .append(Amounts.gbp(incomeToDate)).append(" ÷ ")
                .append(Amounts.periods(periodsWorked).toPlainString()).append(" periods");
        if (firstPeriodFraction.compareTo(BigDecimal.ONE) < 0) {
            int fullPeriods = periodsWorked.subtract(firstPeriodFraction).intValue();
            calculation.append(" (").append(Amounts.percent(firstPeriodFraction, 1))
                    .append(" of Period ").append(startPeriodNumber)
                    .append(" + ").append(fullPeriods).append(" full periods)");
        }
        calculation.append(" × ").append(Amounts.periods(total.getPeriods()).toPlainString())
                .append(" total periods = ").append(Amounts.gbp(projected))
                .append(" (").append(periodNote).append(")");

        return baseProjection(source, ProjectionBasis.PROJECTED, projected)
                .periodsWorked(Amounts.periods(periodsWorked))
                .totalPeriods(Amounts.periods(total.getPeriods()))
                .monthlyRate(Amounts.money(monthlyRate))
                .firstPeriodFraction(Amounts.periods(firstPeriodFraction))
                .startPeriodNumber(startPeriodNumber)
                .calculation(calculation.toString())
                .build();
    }

    private IncomeProjection unprojected(IncomeSource source, PeriodCount total, String reason) {
        log.debug("Using income to date for {} without projection: {}", source.getName(), reason);
        return baseProjection(source, ProjectionBasis.UNPROJECTED, source.getIncomeToDate())
                .periodsWorked(BigDecimal.ZERO.setScale(3))
                .totalPeriods(Amounts.periods(total.getPeriods()))
                .monthlyRate(Amounts.money(source.getIncomeToDate()))
                .firstPeriodFraction(Amounts.periods(total.getFirstPeriodFraction()))
                .startPeriodNumber(total.getStartPeriod().getPeriodNumber())
                .calculation("Income to date used unprojected: " + Amounts.gbp(source.getIncomeToDate())
                        + " (" + reason + ")")
                .build();
    }

    private static IncomeProjection.IncomeProjectionBuilder baseProjection(IncomeSource source,
                                                                           ProjectionBasis basis,
                                                                           BigDecimal income) {
        return IncomeProjection.builder()
                .sourceName(source.getName())
                .incomeToDate(source.getIncomeToDate())
                .regular(source.isRegular())
                .basis(basis)
                .projectedOrActual(income);
    }
}
