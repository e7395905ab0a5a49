package com.gillianbc.taxestimator.model;

import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable allowance and rate tables for a single tax year.
 */
@Getter
@ToString
public class TaxYearConfig {

    public static final String STANDARD_TABLE = "standard";
    public static final String SCOTTISH_TABLE = "scottish";

    private final LocalDate startDate;
    private final LocalDate endDate;
    private final BigDecimal personalAllowance;
    // Income above which the allowance is withdrawn at £1 for every £2
    private final BigDecimal taperThreshold;
    // Income at or above which no allowance remains
    private final BigDecimal taperLimit;
    private final String defaultBandTable;
    private final Map<String, BandTable> bandTables;

    public TaxYearConfig(LocalDate startDate,
                         LocalDate endDate,
                         BigDecimal personalAllowance,
                         BigDecimal taperThreshold,
                         BigDecimal taperLimit,
                         String defaultBandTable,
                         List<BandTable> bandTables) {
        this.startDate = Objects.requireNonNull(startDate, "startDate must not be null");
        this.endDate = Objects.requireNonNull(endDate, "endDate must not be null");
        this.personalAllowance = Objects.requireNonNull(personalAllowance, "personalAllowance must not be null");
        this.taperThreshold = Objects.requireNonNull(taperThreshold, "taperThreshold must not be null");
        this.taperLimit = Objects.requireNonNull(taperLimit, "taperLimit must not be null");
        this.defaultBandTable = Objects.requireNonNull(defaultBandTable, "defaultBandTable must not be null");
        Objects.requireNonNull(bandTables, "bandTables must not be null");
        if (!endDate.isAfter(startDate)) {
            throw new IllegalArgumentException("endDate must be after startDate");
        }
        if (personalAllowance.signum() < 0) {
            throw new IllegalArgumentException("personalAllowance must be >= 0");
        }
        if (taperThreshold.signum() < 0 || taperLimit.compareTo(taperThreshold) < 0) {
            throw new IllegalArgumentException("taper range must satisfy 0 <= taperThreshold <= taperLimit");
        }
        Map<String, BandTable> tables = new LinkedHashMap<>();
        for (BandTable table : bandTables) {
            if (tables.put(table.getName(), table) != null) {
                throw new IllegalArgumentException("duplicate band table " + table.getName());
            }
        }
        if (!tables.containsKey(defaultBandTable)) {
            throw new IllegalArgumentException("default band table " + defaultBandTable + " is not configured");
        }
        this.bandTables = Collections.unmodifiableMap(tables);
    }

    /**
     * Resolves a band table by name; a null name selects the default table.
     *
     * @throws IllegalArgumentException if no table with that name is configured
     */
    public BandTable bandTable(String name) {
        String key = name == null ? defaultBandTable : name;
        BandTable table = bandTables.get(key);
        if (table == null) {
            throw new IllegalArgumentException("unknown band table " + key + ", expected one of " + bandTables.keySet());
        }
        return table;
    }

    public BandTable defaultTable() {
        return bandTable(null);
    }

    /**
     * The 2025/26 year: England, Wales and Northern Ireland rates as the default table,
     * Scottish non-savings, non-dividend rates as the alternate.
     */
    public static TaxYearConfig standard2025() {
        BandTable standard = new BandTable(STANDARD_TABLE, "rUK", List.of(
                TaxBand.upTo("37700", "0.20", "Basic Rate"),
                TaxBand.upTo("125140", "0.40", "Higher Rate"),
                TaxBand.above("0.45", "Additional Rate")));
        BandTable scottish = new BandTable(SCOTTISH_TABLE, "Scottish", List.of(
                TaxBand.upTo("2306", "0.19", "Starter Rate"),
                TaxBand.upTo("13991", "0.20", "Basic Rate"),
                TaxBand.upTo("31092", "0.21", "Intermediate Rate"),
                TaxBand.upTo("62430", "0.42", "Higher Rate"),
                TaxBand.upTo("125140", "0.45", "Advanced Rate"),
                TaxBand.above("0.48", "Top Rate")));
        return new TaxYearConfig(
                LocalDate.of(2025, 4, 6),
                LocalDate.of(2026, 4, 5),
                new BigDecimal("12570"),
                new BigDecimal("100000"),
                new BigDecimal("125140"),
                STANDARD_TABLE,
                List.of(standard, scottish));
    }
}
