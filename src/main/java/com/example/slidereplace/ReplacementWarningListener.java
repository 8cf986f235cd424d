package com.example.slidereplace;

@FunctionalInterface
public interface ReplacementWarningListener {

    void onNoMatch(NoMatchWarning warning);

    ReplacementWarningListener IGNORE = w -> { };
}
