package eu.virtualparadox.docsearch.query.analysis;

public enum EQueryComplexity {
    LOW,
    MEDIUM,
    HIGH
}
