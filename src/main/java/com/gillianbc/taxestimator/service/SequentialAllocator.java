package com.gillianbc.taxestimator.service;

import com.gillianbc.taxestimator.model.BandTable;
import com.gillianbc.taxestimator.model.IncomeSource;
import com.gillianbc.taxestimator.model.SourceTaxDetail;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Attributes allowance and tax to each source in the order given, the way HMRC works through
 * a person's employments: the first source takes the allowance and the lowest bands, later
 * sources are taxed from wherever the earlier ones left off.
 * <p>
 * The attribution depends on source order; the total tax on the same incomes does not.
 */
@Service
@RequiredArgsConstructor
public class SequentialAllocator {

    public static final String NOTE_USER_OVERRIDE = "User override";
    public static final String NOTE_ACTUAL_TAX = "Actual tax deducted";
    public static final String NOTE_BALANCED_PAYE = "Balanced PAYE (ongoing)";
    public static final String NOTE_NO_TAX_INFO = "No tax information provided";

    private final TaxBandCalculator bandCalculator;

    public List<SourceTaxDetail> allocate(List<IncomeSource> sources,
                                          List<BigDecimal> incomes,
                                          BigDecimal allowance,
                                          BandTable table) {
        Objects.requireNonNull(sources, "sources must not be null");
        Objects.requireNonNull(incomes, "incomes must not be null");
        Objects.requireNonNull(allowance, "allowance must not be null");
        if (sources.size() != incomes.size()) {
            throw new IllegalArgumentException("expected one income per source, got "
                    + incomes.size() + " for " + sources.size() + " sources");
        }

        List<SourceTaxDetail> details = new ArrayList<>(sources.size());
        AllocationState state = AllocationState.start(allowance);
        for (int i = 0; i < sources.size(); i++) {
            IncomeSource source = sources.get(i);
            BigDecimal income = incomes.get(i);

            BigDecimal allowanceUsed = state.allowanceRemaining.min(income).max(BigDecimal.ZERO);
            BigDecimal taxable = income.subtract(allowanceUsed);
            BigDecimal taxDue = bandCalculator.taxOnSlice(taxable, state.bandPosition, table);
            state = state.consume(allowanceUsed, taxable);

            details.add(detail(source, income, allowanceUsed, taxable, taxDue));
        }
        return details;
    }

    private static SourceTaxDetail detail(IncomeSource source,
                                          BigDecimal income,
                                          BigDecimal allowanceUsed,
                                          BigDecimal taxable,
                                          BigDecimal taxDue) {
        BigDecimal taxPaid;
        String notes;
        Optional<BigDecimal> entered = source.getTaxPaid();
        if (entered.isPresent()) {
            taxPaid = entered.get();
            notes = source.isRegular() ? NOTE_USER_OVERRIDE : NOTE_ACTUAL_TAX;
        } else if (source.isRegular()) {
            taxPaid = balancedPayeTaxPaid(taxDue);
            notes = NOTE_BALANCED_PAYE;
        } else {
            taxPaid = BigDecimal.ZERO;
            notes = NOTE_NO_TAX_INFO;
        }
        return SourceTaxDetail.builder()
                .name(source.getName())
                .income(Amounts.money(income))
                .allowanceUsed(Amounts.money(allowanceUsed))
                .taxableIncome(Amounts.money(taxable))
                .taxDue(Amounts.money(taxDue))
                .taxPaid(Amounts.money(taxPaid))
                .difference(Amounts.money(taxPaid.subtract(taxDue)))
                .notes(notes)
                .build();
    }

    /**
     * Default for an ongoing PAYE source with no tax figure entered: assume payroll has withheld
     * exactly what is due, so the source neither adds to nor reduces the net position.
     * This understates any real over- or under-deduction.
     */
    static BigDecimal balancedPayeTaxPaid(BigDecimal taxDue) {
        return taxDue;
    }

    /**
     * Allowance still unclaimed and how far up the bands earlier sources have reached.
     */
    private static final class AllocationState {

        private final BigDecimal allowanceRemaining;
        private final BigDecimal bandPosition;

        private AllocationState(BigDecimal allowanceRemaining, BigDecimal bandPosition) {
            this.allowanceRemaining = allowanceRemaining;
            this.bandPosition = bandPosition;
        }

        static AllocationState start(BigDecimal allowance) {
            return new AllocationState(allowance, BigDecimal.ZERO);
        }

        AllocationState consume(BigDecimal allowanceUsed, BigDecimal taxable) {
            return new AllocationState(allowanceRemaining.subtract(allowanceUsed),
                    bandPosition.add(taxable.max(BigDecimal.ZERO)));
        }
    }
}
