package com.gillianbc.taxestimator.service;

import com.gillianbc.taxestimator.model.TaxYearConfig;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Tax-free allowance for a person's total income, withdrawn by £1 for every £2 above the taper threshold.
 */
@Service
public class PersonalAllowanceCalculator {

    private static final BigDecimal TWO = BigDecimal.valueOf(2);

    public BigDecimal allowance(BigDecimal totalIncome, TaxYearConfig taxYear) {
        Objects.requireNonNull(totalIncome, "totalIncome must not be null");
        Objects.requireNonNull(taxYear, "taxYear must not be null");
        if (totalIncome.compareTo(taxYear.getTaperThreshold()) <= 0) {
            return taxYear.getPersonalAllowance();
        }
        if (totalIncome.compareTo(taxYear.getTaperLimit()) >= 0) {
            return BigDecimal.ZERO;
        }
        return taxYear.getPersonalAllowance().subtract(taperReduction(totalIncome, taxYear)).max(BigDecimal.ZERO);
    }

    /**
     * Amount by which the allowance is cut: half the income above the taper threshold.
     */
    public BigDecimal taperReduction(BigDecimal totalIncome, TaxYearConfig taxYear) {
        BigDecimal excess = totalIncome.subtract(taxYear.getTaperThreshold()).max(BigDecimal.ZERO);
        return excess.divide(TWO);
    }
}
