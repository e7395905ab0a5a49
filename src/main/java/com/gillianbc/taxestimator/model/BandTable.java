package com.gillianbc.taxestimator.model;

import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;

/**
 * Ordered progressive rate schedule. Limits are strictly increasing and the last band is unbounded,
 * so the bands partition [0, infinity) with no gaps.
 */
@Getter
@ToString
public class BandTable {

    private final String name;
    private final String region;
    private final List<TaxBand> bands;

    public BandTable(String name, String region, List<TaxBand> bands) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.region = Objects.requireNonNull(region, "region must not be null");
        Objects.requireNonNull(bands, "bands must not be null");
        if (bands.isEmpty()) {
            throw new IllegalArgumentException("band table " + name + " must contain at least one band");
        }
        BigDecimal previousLimit = BigDecimal.ZERO;
        for (int i = 0; i < bands.size(); i++) {
            TaxBand band = Objects.requireNonNull(bands.get(i), "band table " + name + " contains null");
            boolean last = i == bands.size() - 1;
            if (band.isUnbounded() != last) {
                throw new IllegalArgumentException("band table " + name
                        + " must end with exactly one unbounded band, found " + band.getName() + " at position " + i);
            }
            if (!last) {
                if (band.getLimit().compareTo(previousLimit) <= 0) {
                    throw new IllegalArgumentException("band table " + name
                            + " limits must be strictly increasing at " + band.getName());
                }
                previousLimit = band.getLimit();
            }
        }
        this.bands = List.copyOf(bands);
    }

    public TaxBand topBand() {
        return bands.get(bands.size() - 1);
    }
}
