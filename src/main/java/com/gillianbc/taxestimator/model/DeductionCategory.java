package com.gillianbc.taxestimator.model;

public enum DeductionCategory {
    JOB_EXPENSES,
    PROFESSIONAL_SUBS,
    /** Flat rate expenses for uniforms, tools and the like. */
    FRE,
    MARRIAGE_ALLOWANCE,
    GIFT_AID,
    OTHER
}
