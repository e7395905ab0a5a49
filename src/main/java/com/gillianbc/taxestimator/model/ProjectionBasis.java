package com.gillianbc.taxestimator.model;

/**
 * How a source's full-year figure was arrived at.
 */
public enum ProjectionBasis {
    PROJECTED,
    USER_OVERRIDE,
    ONE_OFF,
    /** Not enough elapsed time to project, so income to date is used as is. */
    UNPROJECTED
}
