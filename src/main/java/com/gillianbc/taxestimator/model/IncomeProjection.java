package com.gillianbc.taxestimator.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;

/**
 * Full-year figure for one source together with the period arithmetic behind it.
 * Period fields are null unless the basis is {@link ProjectionBasis#PROJECTED} or
 * {@link ProjectionBasis#UNPROJECTED}.
 */
@Getter
@Builder
@ToString
public class IncomeProjection {

    private final String sourceName;
    private final BigDecimal incomeToDate;
    private final boolean regular;
    private final ProjectionBasis basis;
    private final BigDecimal projectedOrActual;
    private final BigDecimal periodsWorked;
    private final BigDecimal totalPeriods;
    private final BigDecimal monthlyRate;
    private final BigDecimal firstPeriodFraction;
    private final Integer startPeriodNumber;
    private final String calculation;
}
