package com.gillianbc.taxestimator.service;

import com.gillianbc.taxestimator.model.BandTable;
import com.gillianbc.taxestimator.model.TaxBand;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Progressive tax over a band table. Every operation can start part way up the bands, which is what
 * lets sources and adjustments be taxed one after another at the rates they actually reach.
 * <p>
 * Results are unrounded so that adjoining slices add up exactly; callers round when reporting.
 */
@Service
public class TaxBandCalculator {

    /**
     * Tax on {@code amount} of taxable income sitting on top of {@code startingPosition} already taxed.
     */
    public BigDecimal taxOnSlice(BigDecimal amount, BigDecimal startingPosition, BandTable table) {
        Objects.requireNonNull(amount, "amount must not be null");
        Objects.requireNonNull(startingPosition, "startingPosition must not be null");
        Objects.requireNonNull(table, "table must not be null");
        if (startingPosition.signum() < 0) {
            throw new IllegalArgumentException("startingPosition must be >= 0");
        }
        if (amount.signum() <= 0) {
            return BigDecimal.ZERO;
        }

        BigDecimal tax = BigDecimal.ZERO;
        BigDecimal remaining = amount;
        BigDecimal position = startingPosition;
        for (TaxBand band : table.getBands()) {
            if (remaining.signum() <= 0) {
                break;
            }
            BigDecimal room = band.roomAbove(position);
            BigDecimal inBand = room == null ? remaining : remaining.min(room);
            if (inBand.signum() > 0) {
                tax = tax.add(inBand.multiply(band.getRate()));
                remaining = remaining.subtract(inBand);
                position = position.add(inBand);
            }
        }
        return tax;
    }

    /**
     * Tax on the whole of {@code taxableIncome}; zero for non-positive income.
     */
    public BigDecimal taxDue(BigDecimal taxableIncome, BandTable table) {
        Objects.requireNonNull(taxableIncome, "taxableIncome must not be null");
        if (taxableIncome.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        return taxOnSlice(taxableIncome, BigDecimal.ZERO, table);
    }

    /**
     * Extra tax caused by adding {@code additionalIncome} on top of {@code existingTaxableIncome}.
     * Evaluated as the difference of two full calculations so it spans band boundaries correctly.
     */
    public BigDecimal incrementalTax(BigDecimal existingTaxableIncome, BigDecimal additionalIncome, BandTable table) {
        Objects.requireNonNull(existingTaxableIncome, "existingTaxableIncome must not be null");
        Objects.requireNonNull(additionalIncome, "additionalIncome must not be null");
        if (additionalIncome.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        BigDecimal taxWithout = taxDue(existingTaxableIncome, table);
        BigDecimal taxWith = taxDue(existingTaxableIncome.add(additionalIncome), table);
        return taxWith.subtract(taxWithout);
    }

    /**
     * Band the next pound above {@code position} falls into. At an exact limit this is the higher band.
     */
    public TaxBand marginalBand(BigDecimal position, BandTable table) {
        Objects.requireNonNull(position, "position must not be null");
        Objects.requireNonNull(table, "table must not be null");
        for (TaxBand band : table.getBands()) {
            if (band.contains(position)) {
                return band;
            }
        }
        return table.topBand();
    }

    public BigDecimal marginalRate(BigDecimal position, BandTable table) {
        Objects.requireNonNull(position, "position must not be null");
        if (position.signum() < 0) {
            return BigDecimal.ZERO;
        }
        return marginalBand(position, table).getRate();
    }
}
