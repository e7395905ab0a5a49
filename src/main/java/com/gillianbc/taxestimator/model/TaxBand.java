package com.gillianbc.taxestimator.model;

import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * One step of a progressive rate schedule: income up to the cumulative {@code limit}
 * is taxed at {@code rate}. The top band of a table has no limit.
 */
@Getter
@ToString
public class TaxBand {

    private final String name;
    /**
     * Cumulative upper limit of taxable income for this band, or null for the unbounded top band.
     */
    private final BigDecimal limit;
    private final BigDecimal rate;

    public TaxBand(String name, BigDecimal limit, BigDecimal rate) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.rate = Objects.requireNonNull(rate, "rate must not be null");
        if (rate.signum() < 0) {
            throw new IllegalArgumentException("rate for band " + name + " must be >= 0");
        }
        if (limit != null && limit.signum() <= 0) {
            throw new IllegalArgumentException("limit for band " + name + " must be > 0");
        }
        this.limit = limit;
    }

    public static TaxBand upTo(String limit, String rate, String name) {
        return new TaxBand(name, new BigDecimal(limit), new BigDecimal(rate));
    }

    public static TaxBand above(String rate, String name) {
        return new TaxBand(name, null, new BigDecimal(rate));
    }

    public boolean isUnbounded() {
        return limit == null;
    }

    /**
     * True when income at {@code position} still falls inside this band.
     */
    public boolean contains(BigDecimal position) {
        return isUnbounded() || position.compareTo(limit) < 0;
    }

    /**
     * Amount of this band still free above {@code position}, never negative.
     * Returns null for the unbounded band.
     */
    public BigDecimal roomAbove(BigDecimal position) {
        if (isUnbounded()) {
            return null;
        }
        return limit.subtract(position).max(BigDecimal.ZERO);
    }
}
