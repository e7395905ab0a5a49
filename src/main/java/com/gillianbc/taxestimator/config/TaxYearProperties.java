package com.gillianbc.taxestimator.config;

import com.gillianbc.taxestimator.model.BandTable;
import com.gillianbc.taxestimator.model.TaxBand;
import com.gillianbc.taxestimator.model.TaxYearConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.format.annotation.DateTimeFormat;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Tax year figures bound from the {@code tax-year} section of the application configuration.
 */
@ConfigurationProperties(prefix = "tax-year")
public record TaxYearProperties(
        @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
        @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate,
        BigDecimal personalAllowance,
        BigDecimal taperThreshold,
        BigDecimal taperLimit,
        String defaultBandTable,
        String zone,
        Map<String, Table> bandTables
) {

    public TaxYearProperties {
        if (startDate == null || endDate == null) {
            throw new IllegalArgumentException("tax-year start-date and end-date must be provided");
        }
        if (personalAllowance == null || taperThreshold == null || taperLimit == null) {
            throw new IllegalArgumentException("tax-year personal-allowance, taper-threshold and taper-limit must be provided");
        }
        if (bandTables == null || bandTables.isEmpty()) {
            throw new IllegalArgumentException("tax-year band-tables must contain at least one table");
        }
        if (defaultBandTable == null || defaultBandTable.isBlank()) {
            defaultBandTable = TaxYearConfig.STANDARD_TABLE;
        }
        if (zone == null || zone.isBlank()) {
            zone = "Europe/London";
        }
    }

    /**
     * A band table; the final band leaves {@code limit} unset to mean "everything above".
     */
    public record Table(String region, List<Band> bands) {
    }

    public record Band(String name, BigDecimal limit, BigDecimal rate) {
    }

    public TaxYearConfig toTaxYearConfig() {
        List<BandTable> tables = new ArrayList<>();
        bandTables.forEach((name, table) -> {
            if (table.bands() == null) {
                throw new IllegalArgumentException("band table " + name + " has no bands");
            }
            List<TaxBand> bands = table.bands().stream()
                    .map(band -> new TaxBand(band.name(), band.limit(), band.rate()))
                    .toList();
            tables.add(new BandTable(name, table.region() == null ? name : table.region(), bands));
        });
        return new TaxYearConfig(startDate, endDate, personalAllowance, taperThreshold, taperLimit,
                defaultBandTable, tables);
    }
}
