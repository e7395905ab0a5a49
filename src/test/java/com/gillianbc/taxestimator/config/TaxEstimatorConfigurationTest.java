package com.gillianbc.taxestimator.config;

import com.gillianbc.taxestimator.model.BandTable;
import com.gillianbc.taxestimator.model.CalculationOptions;
import com.gillianbc.taxestimator.model.CalculationResult;
import com.gillianbc.taxestimator.model.IncomeSource;
import com.gillianbc.taxestimator.model.TaxYearConfig;
import com.gillianbc.taxestimator.service.TaxCalculationService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest
class TaxEstimatorConfigurationTest {

    @Autowired
    private TaxYearConfig taxYear;

    @Autowired
    private TaxCalculationService service;

    @Autowired
    private Clock clock;

    @Test
    @DisplayName("Configured tax year matches the 2025/26 figures")
    void taxYear_boundFromConfiguration() {
        TaxYearConfig expected = TaxYearConfig.standard2025();

        assertEquals(expected.getStartDate(), taxYear.getStartDate());
        assertEquals(expected.getEndDate(), taxYear.getEndDate());
        assertEquals(0, expected.getPersonalAllowance().compareTo(taxYear.getPersonalAllowance()));
        assertEquals(0, expected.getTaperThreshold().compareTo(taxYear.getTaperThreshold()));
        assertEquals(0, expected.getTaperLimit().compareTo(taxYear.getTaperLimit()));
        assertEquals(TaxYearConfig.STANDARD_TABLE, taxYear.getDefaultBandTable());
    }

    @Test
    @DisplayName("Both band tables are bound, each ending with an unbounded band")
    void bandTables_boundFromConfiguration() {
        BandTable standard = taxYear.bandTable(TaxYearConfig.STANDARD_TABLE);
        BandTable scottish = taxYear.bandTable(TaxYearConfig.SCOTTISH_TABLE);

        assertEquals("rUK", standard.getRegion());
        assertEquals(3, standard.getBands().size());
        assertTrue(standard.topBand().isUnbounded());
        assertEquals(6, scottish.getBands().size());
        assertEquals("Starter Rate", scottish.getBands().get(0).getName());
        assertTrue(scottish.topBand().isUnbounded());
    }

    @Test
    @DisplayName("Clock runs in the configured UK zone")
    void clock_usesConfiguredZone() {
        assertEquals(ZoneId.of("Europe/London"), clock.getZone());
    }

    @Test
    @DisplayName("Service wired from configuration produces the expected estimate")
    void service_wiredFromConfiguration() {
        IncomeSource salary = IncomeSource.builder()
                .name("Salary")
                .incomeToDate(BigDecimal.ZERO)
                .regular(true)
                .projectedIncome(new BigDecimal("50000"))
                .build();

        CalculationResult result = service.calculate(List.of(salary), List.of(), List.of(),
                CalculationOptions.asOf(LocalDate.of(2025, 10, 20)));

        assertEquals(new BigDecimal("7486.00"), result.getTaxDueOnIncome());
    }
}
