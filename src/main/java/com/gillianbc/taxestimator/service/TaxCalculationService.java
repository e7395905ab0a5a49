package com.gillianbc.taxestimator.service;

import com.gillianbc.taxestimator.model.Adjustment;
import com.gillianbc.taxestimator.model.BandTable;
import com.gillianbc.taxestimator.model.CalculationOptions;
import com.gillianbc.taxestimator.model.CalculationResult;
import com.gillianbc.taxestimator.model.Deduction;
import com.gillianbc.taxestimator.model.IncomeProjection;
import com.gillianbc.taxestimator.model.IncomeSource;
import com.gillianbc.taxestimator.model.NetPositionStatus;
import com.gillianbc.taxestimator.model.SourceTaxDetail;
import com.gillianbc.taxestimator.model.TaxBand;
import com.gillianbc.taxestimator.model.TaxYearConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Estimates the in-year tax position from partial-year income.
 * <p>
 * Each call recomputes everything from the inputs and returns the figures along with the
 * step-by-step derivation behind them. Nothing is retained between calls.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TaxCalculationService {

    private final TaxYearConfig taxYear;
    private final Clock clock;
    private final PayPeriodCalendar calendar;
    private final IncomeProjector projector;
    private final PersonalAllowanceCalculator allowanceCalculator;
    private final TaxBandCalculator bandCalculator;
    private final SequentialAllocator allocator;

    /**
     * Wires the default components by hand, for use outside a Spring context.
     */
    public static TaxCalculationService create(TaxYearConfig taxYear, Clock clock) {
        PayPeriodCalendar calendar = new PayPeriodCalendar();
        TaxBandCalculator bandCalculator = new TaxBandCalculator();
        return new TaxCalculationService(taxYear, clock, calendar, new IncomeProjector(calendar),
                new PersonalAllowanceCalculator(), bandCalculator, new SequentialAllocator(bandCalculator));
    }

    public CalculationResult calculate(List<IncomeSource> sources,
                                       List<Deduction> deductions,
                                       List<Adjustment> adjustments) {
        return calculate(sources, deductions, adjustments, CalculationOptions.defaults());
    }

    public CalculationResult calculate(List<IncomeSource> sources,
                                       List<Deduction> deductions,
                                       List<Adjustment> adjustments,
                                       CalculationOptions options) {
        Objects.requireNonNull(sources, "sources must not be null");
        Objects.requireNonNull(deductions, "deductions must not be null");
        Objects.requireNonNull(adjustments, "adjustments must not be null");
        Objects.requireNonNull(options, "options must not be null");

        BandTable table = taxYear.bandTable(options.getBandTable());
        LocalDate today = options.getAsOfDate() == null ? LocalDate.now(clock) : options.getAsOfDate();
        LocalDate asOfDate = calendar.asOfDate(options.isIncludeCurrentPeriod(), today, taxYear.getStartDate());

        CalculationResult.CalculationResultBuilder result = CalculationResult.builder().bandTable(table.getName());
        List<String> steps = new ArrayList<>();

        // Step 1: total income
        steps.add("=== STEP 1: Calculate Total Income ===");
        BigDecimal totalIncome = BigDecimal.ZERO;
        List<BigDecimal> incomes = new ArrayList<>(sources.size());
        for (IncomeSource source : sources) {
            IncomeProjection projection = projector.project(source, asOfDate, taxYear);
            result.source(projection);
            incomes.add(projection.getProjectedOrActual());
            totalIncome = totalIncome.add(projection.getProjectedOrActual());
            steps.add(source.getName() + ": " + projection.getCalculation());
        }
        steps.add("Total Income: " + Amounts.gbp(totalIncome));
        steps.add("");

        // Step 2: personal allowance
        steps.add("=== STEP 2: Calculate Personal Allowance ===");
        BigDecimal personalAllowance = allowanceCalculator.allowance(totalIncome, taxYear);
        describeAllowance(totalIncome, personalAllowance, steps);
        steps.add("");

        // Step 3: per-source attribution
        steps.add("=== STEP 3: Allocate PA and Tax Per Source ===");
        steps.add("Using " + table.getRegion() + " tax bands");
        List<SourceTaxDetail> sourceDetails = allocator.allocate(sources, incomes, personalAllowance, table);
        for (SourceTaxDetail detail : sourceDetails) {
            steps.add(detail.getName() + ":");
            steps.add("  Income: " + Amounts.gbp(detail.getIncome()));
            steps.add("  PA Used: " + Amounts.gbp(detail.getAllowanceUsed()));
            steps.add("  Taxable: " + Amounts.gbp(detail.getTaxableIncome()));
            steps.add("  Tax Due: " + Amounts.gbp(detail.getTaxDue()));
            steps.add("  Tax Paid: " + Amounts.gbp(detail.getTaxPaid()));
            steps.add("  Difference: " + Amounts.gbp(detail.getDifference()) + " (" + detail.getNotes() + ")");
        }
        result.sourceDetails(sourceDetails);
        steps.add("");

        // Step 4: deductions
        steps.add("=== STEP 4: Apply Deductions ===");
        // Negative when income is below the allowance; only the post-deduction figure is floored
        BigDecimal taxableBeforeDeductions = totalIncome.subtract(personalAllowance);
        BigDecimal totalDeductions = BigDecimal.ZERO;
        for (Deduction deduction : deductions) {
            totalDeductions = totalDeductions.add(deduction.getAmount());
            steps.add(deduction.getDescription() + ": -" + Amounts.gbp(deduction.getAmount()));
        }
        if (deductions.isEmpty()) {
            steps.add("No deductions");
        } else {
            steps.add("Total Deductions: " + Amounts.gbp(totalDeductions));
        }
        BigDecimal taxableAfterDeductions = taxableBeforeDeductions.subtract(totalDeductions).max(BigDecimal.ZERO);
        steps.add("Taxable Income (after deductions): " + Amounts.gbp(taxableAfterDeductions));
        steps.add("");

        // Step 5: tax on income
        steps.add("=== STEP 5: Calculate Tax on Income ===");
        BigDecimal taxDueOnIncome = bandCalculator.taxDue(taxableAfterDeductions, table);
        steps.add("Region (" + table.getRegion() + ") tax due on " + Amounts.gbp(taxableAfterDeductions)
                + ": " + Amounts.gbp(taxDueOnIncome));
        steps.add("");

        // Step 6: adjustments stack on top of everything above
        steps.add("=== STEP 6: Additional Tax Owed ===");
        AdjustmentState adjusted = AdjustmentState.start(taxableAfterDeductions);
        for (Adjustment adjustment : adjustments) {
            if (adjustment.getType().isTaxableIncome()) {
                BigDecimal tax = bandCalculator.incrementalTax(adjusted.position, adjustment.getAmount(), table);
                TaxBand marginal = bandCalculator.marginalBand(adjusted.position, table);
                steps.add(adjustment.getDescription() + ": " + Amounts.gbp(adjustment.getAmount())
                        + " taxable income → " + Amounts.gbp(tax) + " tax (at ~"
                        + Amounts.percent(marginal.getRate(), 0) + " marginal rate)");
                adjusted = adjusted.withTaxableIncome(adjustment.getAmount(), tax);
            } else {
                steps.add(adjustment.getDescription() + ": " + signed(adjustment.getAmount()) + " (direct tax)");
                adjusted = adjusted.withDirectTax(adjustment.getAmount());
            }
        }
        if (adjustments.isEmpty()) {
            steps.add("No additional tax owed");
        } else {
            steps.add("Total Additional Tax: " + Amounts.gbp(adjusted.tax));
        }
        steps.add("");

        // Step 7: summary
        steps.add("=== STEP 7: Final Summary ===");
        BigDecimal finalTaxDue = taxDueOnIncome.add(adjusted.tax);
        BigDecimal taxPaid = sourceDetails.stream()
                .map(SourceTaxDetail::getTaxPaid)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal netPosition = taxPaid.subtract(finalTaxDue);
        NetPositionStatus status = NetPositionStatus.of(Amounts.money(netPosition));

        steps.add("Total Income: " + Amounts.gbp(totalIncome));
        steps.add("Personal Allowance: " + Amounts.gbp(personalAllowance));
        steps.add("Taxable Income (before deductions): " + Amounts.gbp(taxableBeforeDeductions));
        steps.add("Deductions: -" + Amounts.gbp(totalDeductions));
        steps.add("Taxable Income (after deductions): " + Amounts.gbp(taxableAfterDeductions));
        if (adjusted.additionalIncome.signum() > 0) {
            steps.add("Additional Taxable Income: +" + Amounts.gbp(adjusted.additionalIncome));
            steps.add("Final Taxable Income: " + Amounts.gbp(adjusted.position));
        }
        steps.add("Tax Due on Income: " + Amounts.gbp(taxDueOnIncome));
        steps.add("Additional Tax Owed: " + signed(adjusted.tax));
        steps.add("Final Tax Due: " + Amounts.gbp(finalTaxDue));
        steps.add("Total Tax Paid: " + Amounts.gbp(taxPaid));
        steps.add("Net Position: " + Amounts.gbp(netPosition) + " (" + status.getLabel() + ")");

        if (log.isDebugEnabled()) {
            steps.forEach(step -> log.debug("{}", step));
        }
        log.info("Tax estimate as of {} ({} bands): income {}, tax due {}, paid {}, net {} ({})",
                asOfDate, table.getName(), Amounts.money(totalIncome), Amounts.money(finalTaxDue),
                Amounts.money(taxPaid), Amounts.money(netPosition), status);

        return result
                .totalIncome(Amounts.money(totalIncome))
                .personalAllowance(Amounts.money(personalAllowance))
                .totalDeductions(Amounts.money(totalDeductions))
                .taxableIncomeBeforeDeductions(Amounts.money(taxableBeforeDeductions))
                .taxableIncomeAfterDeductions(Amounts.money(taxableAfterDeductions))
                .taxDueOnIncome(Amounts.money(taxDueOnIncome))
                .totalAdditionalTaxableIncome(Amounts.money(adjusted.additionalIncome))
                .finalTaxableIncome(Amounts.money(adjusted.position))
                .totalAdjustmentTax(Amounts.money(adjusted.tax))
                .finalTaxDue(Amounts.money(finalTaxDue))
                .taxPaid(Amounts.money(taxPaid))
                .netPosition(Amounts.money(netPosition))
                .netPositionStatus(status)
                .steps(steps)
                .build();
    }

    private void describeAllowance(BigDecimal totalIncome, BigDecimal personalAllowance, List<String> steps) {
        if (totalIncome.compareTo(taxYear.getTaperThreshold()) <= 0) {
            steps.add("Income " + Amounts.gbp(totalIncome) + " ≤ " + Amounts.gbp(taxYear.getTaperThreshold()));
            steps.add("Full Personal Allowance: " + Amounts.gbp(personalAllowance));
        } else if (totalIncome.compareTo(taxYear.getTaperLimit()) >= 0) {
            steps.add("Income " + Amounts.gbp(totalIncome) + " ≥ " + Amounts.gbp(taxYear.getTaperLimit()));
            steps.add("Personal Allowance fully withdrawn: " + Amounts.gbp(BigDecimal.ZERO));
        } else {
            BigDecimal reduction = allowanceCalculator.taperReduction(totalIncome, taxYear);
            steps.add("Income " + Amounts.gbp(totalIncome) + " exceeds " + Amounts.gbp(taxYear.getTaperThreshold()));
            steps.add("Excess: " + Amounts.gbp(totalIncome.subtract(taxYear.getTaperThreshold())));
            steps.add("Reduction (£1 per £2): " + Amounts.gbp(reduction));
            steps.add("Personal Allowance: " + Amounts.gbp(taxYear.getPersonalAllowance()) + " - "
                    + Amounts.gbp(reduction) + " = " + Amounts.gbp(personalAllowance));
        }
    }

    private static String signed(BigDecimal amount) {
        return amount.signum() < 0 ? "-" + Amounts.gbp(amount.negate()) : "+" + Amounts.gbp(amount);
    }

    /**
     * Running totals while adjustments are applied: taxable position reached, extra taxable income
     * added and adjustment tax accumulated.
     */
    private static final class AdjustmentState {

        private final BigDecimal position;
        private final BigDecimal additionalIncome;
        private final BigDecimal tax;

        private AdjustmentState(BigDecimal position, BigDecimal additionalIncome, BigDecimal tax) {
            this.position = position;
            this.additionalIncome = additionalIncome;
            this.tax = tax;
        }

        static AdjustmentState start(BigDecimal taxableIncome) {
            return new AdjustmentState(taxableIncome, BigDecimal.ZERO, BigDecimal.ZERO);
        }

        AdjustmentState withTaxableIncome(BigDecimal amount, BigDecimal incrementalTax) {
            return new AdjustmentState(position.add(amount), additionalIncome.add(amount), tax.add(incrementalTax));
        }

        AdjustmentState withDirectTax(BigDecimal amount) {
            return new AdjustmentState(position, additionalIncome, tax.add(amount));
        }
    }
}
