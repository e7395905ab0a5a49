package com.gillianbc.taxestimator.model;

import lombok.Getter;
import lombok.ToString;

import java.time.LocalDate;
import java.util.Objects;

/**
 * A PAYE month: the 6th of one calendar month through the 5th of the next, numbered 1-12 within the tax year.
 */
@Getter
@ToString
public class PayePeriod {

    private final int periodNumber;
    private final LocalDate startDate;
    private final LocalDate endDate;
    private final int lengthDays;

    public PayePeriod(int periodNumber, LocalDate startDate, LocalDate endDate, int lengthDays) {
        this.periodNumber = periodNumber;
        this.startDate = Objects.requireNonNull(startDate, "startDate must not be null");
        this.endDate = Objects.requireNonNull(endDate, "endDate must not be null");
        this.lengthDays = lengthDays;
    }
}
