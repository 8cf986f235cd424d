package com.example.slidereplace;

import java.util.Collections;
import java.util.List;

/** 一次替换调用的结果 */
public final class ReplacementReport {
    public final String scope;
    public final int replacementCount;
    public final int paragraphsScanned;
    public final int paragraphsChanged;
    public final List<NoMatchWarning> warnings;

    public ReplacementReport(String scope, int replacementCount, int paragraphsScanned, int paragraphsChanged,
                             List<NoMatchWarning> warnings) {
        this.scope = scope;
        this.replacementCount = replacementCount;
        this.paragraphsScanned = paragraphsScanned;
        this.paragraphsChanged = paragraphsChanged;
        this.warnings = warnings == null ? List.of() : Collections.unmodifiableList(warnings);
    }

    public boolean hasWarnings() { return !warnings.isEmpty(); }

    @Override
    public String toString() {
        return "ReplacementReport{scope=" + scope + ", count=" + replacementCount
            + ", changed=" + paragraphsChanged + "/" + paragraphsScanned + ", warnings=" + warnings + "}";
    }
}
