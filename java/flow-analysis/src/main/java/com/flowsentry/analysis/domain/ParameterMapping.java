package com.flowsentry.analysis.domain;

// ============================================
// ParameterMapping: Formal parameter bound to an actual argument
// ============================================
public class ParameterMapping {
    private final int position;
    private final String formalName;
    private final String actualArgument;
    private final ArgumentDerivation derivation;

    public ParameterMapping(int position, String formalName, String actualArgument, ArgumentDerivation derivation) {
        this.position = position;
        this.formalName = formalName;
        this.actualArgument = actualArgument;
        this.derivation = derivation;
    }

    public int getPosition() {
        return position;
    }

    public String getFormalName() {
        return formalName;
    }

    public String getActualArgument() {
        return actualArgument;
    }

    public ArgumentDerivation getDerivation() {
        return derivation;
    }
}
