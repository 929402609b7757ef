package com.statlens.tables.constraint;

public enum ConstraintState {
    UNCONSTRAINED,
    PARTIALLY_CONSTRAINED,
    FULLY_CONSTRAINED
}
