package com.gillianbc.taxestimator.service;

import com.gillianbc.taxestimator.model.MonthsPaidOption;
import com.gillianbc.taxestimator.model.PayePeriod;
import com.gillianbc.taxestimator.model.PeriodCount;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.format.TextStyle;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * PAYE period arithmetic. A period runs from the 6th of one month to the 5th of the next;
 * period 1 starts in the month the tax year starts and period 12 ends on the last day of the year.
 */
@Service
public class PayPeriodCalendar {

    public static final int PERIOD_START_DAY = 6;
    public static final int PERIODS_PER_YEAR = 12;

    /**
     * Returns the PAYE period containing {@code date}. Dates on the 1st-5th belong to the period
     * that began on the 6th of the previous month. The number is clamped to 1-12.
     */
    public PayePeriod periodOf(LocalDate date, LocalDate yearStart) {
        Objects.requireNonNull(date, "date must not be null");
        Objects.requireNonNull(yearStart, "yearStart must not be null");
        LocalDate periodStart = date.getDayOfMonth() >= PERIOD_START_DAY
                ? date.withDayOfMonth(PERIOD_START_DAY)
                : date.minusMonths(1).withDayOfMonth(PERIOD_START_DAY);
        int periodNumber = clamp(monthOffset(yearStart, periodStart) + 1);
        return period(periodNumber, periodStart);
    }

    /**
     * Start, end and length of period {@code periodNumber}, clamped to 1-12.
     */
    public PayePeriod periodDatesFor(int periodNumber, LocalDate yearStart) {
        Objects.requireNonNull(yearStart, "yearStart must not be null");
        int clamped = clamp(periodNumber);
        LocalDate periodStart = YearMonth.from(yearStart).plusMonths(clamped - 1L).atDay(PERIOD_START_DAY);
        return period(clamped, periodStart);
    }

    /**
     * Periods worked from {@code start} up to and including the period containing {@code asOfDate}.
     * The first period counts only the share of its days actually worked.
     */
    public PeriodCount equivalentPeriodsWorked(LocalDate start, LocalDate asOfDate, LocalDate yearStart) {
        Objects.requireNonNull(asOfDate, "asOfDate must not be null");
        LocalDate effectiveStart = clampToYearStart(start, yearStart);
        PayePeriod startPeriod = periodOf(effectiveStart, yearStart);
        PayePeriod asOfPeriod = periodOf(asOfDate, yearStart);
        int wholePeriodsAfter = Math.max(0, asOfPeriod.getPeriodNumber() - startPeriod.getPeriodNumber());
        return new PeriodCount(firstPeriodFraction(effectiveStart, startPeriod), wholePeriodsAfter, startPeriod);
    }

    /**
     * Periods in the whole employment window, with both ends clamped to the tax year.
     */
    public PeriodCount totalPeriodsInRange(LocalDate start, LocalDate end, LocalDate yearStart) {
        LocalDate effectiveStart = clampToYearStart(start, yearStart);
        LocalDate yearEnd = yearEnd(yearStart);
        LocalDate effectiveEnd = end == null || end.isAfter(yearEnd) ? yearEnd : end;
        PayePeriod startPeriod = periodOf(effectiveStart, yearStart);
        PayePeriod endPeriod = periodOf(effectiveEnd, yearStart);
        int wholePeriodsAfter = Math.max(0, endPeriod.getPeriodNumber() - startPeriod.getPeriodNumber());
        return new PeriodCount(firstPeriodFraction(effectiveStart, startPeriod), wholePeriodsAfter, startPeriod);
    }

    /**
     * The date income is counted up to: today, or the 5th that closed the previous period when the
     * current period's pay has not arrived yet.
     */
    public LocalDate asOfDate(boolean includeCurrentPeriod, LocalDate today, LocalDate yearStart) {
        Objects.requireNonNull(today, "today must not be null");
        if (includeCurrentPeriod) {
            return today;
        }
        return periodOf(today, yearStart).getStartDate().minusDays(1);
    }

    /**
     * Candidate answers for "months paid so far". Pay usually lands at the end of the calendar month,
     * so the latest candidate counts calendar months (April = 1) rather than PAYE periods; the other
     * candidate assumes this month's pay has not arrived yet.
     */
    public List<MonthsPaidOption> monthsPaidOptions(LocalDate start, LocalDate today, LocalDate yearStart) {
        Objects.requireNonNull(today, "today must not be null");
        PayePeriod startPeriod = periodOf(clampToYearStart(start, yearStart), yearStart);
        int currentMonth = clamp(monthOffset(yearStart, today) + 1);
        int maxMonths = currentMonth - startPeriod.getPeriodNumber() + 1;

        List<MonthsPaidOption> options = new ArrayList<>();
        if (maxMonths < 1) {
            return options;
        }
        String startMonth = monthName(startPeriod.getPeriodNumber(), yearStart);
        if (maxMonths > 1) {
            options.add(monthsPaidOption(maxMonths - 1, startMonth, monthName(currentMonth - 1, yearStart)));
        }
        options.add(monthsPaidOption(maxMonths, startMonth, monthName(currentMonth, yearStart)));
        return options;
    }

    /**
     * End of the last period covered by {@code monthsPaid} months of pay, but never after today.
     */
    public LocalDate asOfDateForMonthsPaid(int monthsPaid, LocalDate start, LocalDate today, LocalDate yearStart) {
        if (monthsPaid < 1) {
            throw new IllegalArgumentException("monthsPaid must be >= 1");
        }
        Objects.requireNonNull(today, "today must not be null");
        PayePeriod startPeriod = periodOf(clampToYearStart(start, yearStart), yearStart);
        LocalDate endDate = periodDatesFor(startPeriod.getPeriodNumber() + monthsPaid - 1, yearStart).getEndDate();
        return endDate.isBefore(today) ? endDate : today;
    }

    /**
     * Nobody can have worked periods before the year began; null also means the year start.
     */
    public LocalDate clampToYearStart(LocalDate date, LocalDate yearStart) {
        Objects.requireNonNull(yearStart, "yearStart must not be null");
        return date == null || date.isBefore(yearStart) ? yearStart : date;
    }

    public LocalDate yearEnd(LocalDate yearStart) {
        return yearStart.plusYears(1).minusDays(1);
    }

    private static BigDecimal firstPeriodFraction(LocalDate effectiveStart, PayePeriod startPeriod) {
        if (effectiveStart.getDayOfMonth() == PERIOD_START_DAY) {
            return BigDecimal.ONE;
        }
        long daysWorked = daysInclusive(effectiveStart, startPeriod.getEndDate());
        return BigDecimal.valueOf(daysWorked)
                .divide(BigDecimal.valueOf(startPeriod.getLengthDays()), Amounts.MATH_CONTEXT);
    }

    private static PayePeriod period(int periodNumber, LocalDate periodStart) {
        LocalDate periodEnd = periodStart.plusMonths(1).withDayOfMonth(PERIOD_START_DAY - 1);
        return new PayePeriod(periodNumber, periodStart, periodEnd, (int) daysInclusive(periodStart, periodEnd));
    }

    private static MonthsPaidOption monthsPaidOption(int months, String startMonth, String throughMonth) {
        String label = months + " month" + (months != 1 ? "s" : "") + " (through " + throughMonth + ")";
        return new MonthsPaidOption(months, label, startMonth + "-" + throughMonth);
    }

    private static String monthName(int periodNumber, LocalDate yearStart) {
        return YearMonth.from(yearStart).plusMonths(periodNumber - 1L).getMonth()
                .getDisplayName(TextStyle.SHORT, Locale.ENGLISH);
    }

    private static int monthOffset(LocalDate yearStart, LocalDate date) {
        return (int) ChronoUnit.MONTHS.between(YearMonth.from(yearStart), YearMonth.from(date));
    }

    private static long daysInclusive(LocalDate start, LocalDate end) {
        return ChronoUnit.DAYS.between(start, end) + 1;
    }

    private static int clamp(int periodNumber) {
        return Math.max(1, Math.min(PERIODS_PER_YEAR, periodNumber));
    }
}
