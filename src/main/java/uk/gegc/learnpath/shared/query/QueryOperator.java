package uk.gegc.learnpath.shared.query;

public enum QueryOperator {
    EQ,
    NEQ,
    IN,
    GTE,
    LTE,
    LIKE
}
