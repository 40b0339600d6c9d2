package com.phillippitts.modelrelay.domain;

/** Focus of a code analysis request. */
public enum AnalysisType {
    PERFORMANCE,
    SECURITY,
    ARCHITECTURE,
    STYLE,
    QUALITY
}
