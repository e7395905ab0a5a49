package com.gillianbc.taxestimator.service;

import com.gillianbc.taxestimator.model.BandTable;
import com.gillianbc.taxestimator.model.IncomeSource;
import com.gillianbc.taxestimator.model.SourceTaxDetail;
import com.gillianbc.taxestimator.model.TaxYearConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class SequentialAllocatorTest {

    private static final BigDecimal ALLOWANCE = new BigDecimal("12570");
    private static final LocalDate YEAR_START = LocalDate.of(2025, 4, 6);

    private final BandTable standard = TaxYearConfig.standard2025().defaultTable();
    private final SequentialAllocator allocator = new SequentialAllocator(new TaxBandCalculator());

    @Test
    @DisplayName("First source takes the allowance; the second is taxed from where the first stopped")
    void allocate_twoSources_inOrder() {
        List<SourceTaxDetail> details = allocator.allocate(
                List.of(IncomeSource.regular("Job A", "0", YEAR_START), IncomeSource.regular("Job B", "0", YEAR_START)),
                amounts("20000", "15000"), ALLOWANCE, standard);

        SourceTaxDetail first = details.get(0);
        assertEquals(new BigDecimal("12570.00"), first.getAllowanceUsed());
        assertEquals(new BigDecimal("7430.00"), first.getTaxableIncome());
        assertEquals(new BigDecimal("1486.00"), first.getTaxDue());

        SourceTaxDetail second = details.get(1);
        assertEquals(new BigDecimal("0.00"), second.getAllowanceUsed());
        assertEquals(new BigDecimal("15000.00"), second.getTaxableIncome());
        assertEquals(new BigDecimal("3000.00"), second.getTaxDue());
    }

    @Test
    @DisplayName("Reordering sources moves the attribution but not the total")
    void allocate_reordered_sameTotal() {
        List<IncomeSource> sources = List.of(
                IncomeSource.regular("Job A", "0", YEAR_START), IncomeSource.regular("Job B", "0", YEAR_START));

        List<SourceTaxDetail> forward = allocator.allocate(sources, amounts("20000", "15000"), ALLOWANCE, standard);
        List<SourceTaxDetail> reversed = allocator.allocate(
                List.of(sources.get(1), sources.get(0)), amounts("15000", "20000"), ALLOWANCE, standard);

        assertEquals(new BigDecimal("486.00"), reversed.get(0).getTaxDue());
        assertEquals(new BigDecimal("4000.00"), reversed.get(1).getTaxDue());
        assertEquals(totalTax(forward), totalTax(reversed));
        assertEquals(new BigDecimal("4486.00"), totalTax(forward));
    }

    @Test
    @DisplayName("Per-source tax crossing into the higher band adds up to tax on the combined income")
    void allocate_crossesBands_reconcilesWithAggregate() {
        List<SourceTaxDetail> details = allocator.allocate(
                List.of(IncomeSource.regular("Job A", "0", YEAR_START), IncomeSource.regular("Job B", "0", YEAR_START)),
                amounts("30000", "60000"), ALLOWANCE, standard);

        assertEquals(new BigDecimal("3486.00"), details.get(0).getTaxDue());
        assertEquals(new BigDecimal("19946.00"), details.get(1).getTaxDue());
        assertEquals(Amounts.money(new TaxBandCalculator().taxDue(new BigDecimal("77430"), standard)), totalTax(details));
    }

    @Test
    @DisplayName("When income is below the allowance, allowance used equals total income")
    void allocate_incomeBelowAllowance_usesOnlyIncome() {
        List<SourceTaxDetail> details = allocator.allocate(
                List.of(IncomeSource.oneOff("Interest", "0"), IncomeSource.oneOff("Prize", "0")),
                amounts("5000", "3000"), ALLOWANCE, standard);

        BigDecimal used = details.get(0).getAllowanceUsed().add(details.get(1).getAllowanceUsed());
        assertEquals(new BigDecimal("8000.00"), used);
        assertEquals(new BigDecimal("0.00"), totalTax(details));
    }

    @Test
    @DisplayName("Regular source defaults to balanced PAYE; one-off without tax entered pays nothing")
    void allocate_taxPaidDefaults() {
        List<SourceTaxDetail> details = allocator.allocate(
                List.of(IncomeSource.regular("Salary", "0", YEAR_START), IncomeSource.oneOff("Bonus", "0")),
                amounts("30000", "5000"), ALLOWANCE, standard);

        SourceTaxDetail salary = details.get(0);
        assertEquals(salary.getTaxDue(), salary.getTaxPaid());
        assertEquals(new BigDecimal("0.00"), salary.getDifference());
        assertEquals(SequentialAllocator.NOTE_BALANCED_PAYE, salary.getNotes());

        SourceTaxDetail bonus = details.get(1);
        assertEquals(new BigDecimal("1000.00"), bonus.getTaxDue());
        assertEquals(new BigDecimal("0.00"), bonus.getTaxPaid());
        assertEquals(new BigDecimal("-1000.00"), bonus.getDifference());
        assertEquals(SequentialAllocator.NOTE_NO_TAX_INFO, bonus.getNotes());
    }

    @Test
    @DisplayName("Entered tax paid wins over the defaults")
    void allocate_enteredTaxPaid_wins() {
        IncomeSource salary = IncomeSource.builder()
                .name("Salary").incomeToDate(BigDecimal.ZERO).regular(true).taxPaid(new BigDecimal("4000")).build();
        IncomeSource bonus = IncomeSource.builder()
                .name("Bonus").incomeToDate(BigDecimal.ZERO).regular(false).taxPaid(new BigDecimal("1200")).build();

        List<SourceTaxDetail> details = allocator.allocate(
                List.of(salary, bonus), amounts("30000", "5000"), ALLOWANCE, standard);

        assertEquals(new BigDecimal("514.00"), details.get(0).getDifference());
        assertEquals(SequentialAllocator.NOTE_USER_OVERRIDE, details.get(0).getNotes());
        assertEquals(new BigDecimal("200.00"), details.get(1).getDifference());
        assertEquals(SequentialAllocator.NOTE_ACTUAL_TAX, details.get(1).getNotes());
    }

    @Test
    @DisplayName("One income is required per source")
    void allocate_mismatchedSizes_throws() {
        assertThrows(IllegalArgumentException.class, () -> allocator.allocate(
                List.of(IncomeSource.oneOff("Bonus", "0")), amounts("1", "2"), ALLOWANCE, standard));
    }

    private static List<BigDecimal> amounts(String... values) {
        return java.util.Arrays.stream(values).map(BigDecimal::new).toList();
    }

    private static BigDecimal totalTax(List<SourceTaxDetail> details) {
        return details.stream().map(SourceTaxDetail::getTaxDue).reduce(new BigDecimal("0.00"), BigDecimal::add);
    }
}
