package com.flowsentry.analysis.domain;

// ============================================
// CallGraphStatistics: Summary numbers for reports
// ============================================
public class CallGraphStatistics {
    private final int totalFunctions;
    private final int totalCalls;
    private final int externalFunctions;
    private final int recursiveFunctions;
    private final double averageCallsPerFunction;
    private final int maxCallsPerFunction;
    private final String mostCalledFunction;
    private final int mostCalledCount;
    private final int deepestCallChain;
    private final double averageRecursionDepth;

    public CallGraphStatistics(int totalFunctions, int totalCalls, int externalFunctions, int recursiveFunctions,
                               double averageCallsPerFunction, int maxCallsPerFunction,
                               String mostCalledFunction, int mostCalledCount,
                               int deepestCallChain, double averageRecursionDepth) {
        this.totalFunctions = totalFunctions;
        this.totalCalls = totalCalls;
        this.externalFunctions = externalFunctions;
        this.recursiveFunctions = recursiveFunctions;
        this.averageCallsPerFunction = averageCallsPerFunction;
        this.maxCallsPerFunction = maxCallsPerFunction;
        this.mostCalledFunction = mostCalledFunction;
        this.mostCalledCount = mostCalledCount;
        this.deepestCallChain = deepestCallChain;
        this.averageRecursionDepth = averageRecursionDepth;
    }

    public int getTotalFunctions() {
        return totalFunctions;
    }

    public int getTotalCalls() {
        return totalCalls;
    }

    public int getExternalFunctions() {
        return externalFunctions;
    }

    public int getRecursiveFunctions() {
        return recursiveFunctions;
    }

    public double getAverageCallsPerFunction() {
        return averageCallsPerFunction;
    }

    public int getMaxCallsPerFunction() {
        return maxCallsPerFunction;
    }

    public String getMostCalledFunction() {
        return mostCalledFunction;
    }

    public int getMostCalledCount() {
        return mostCalledCount;
    }

    public int getDeepestCallChain() {
        return deepestCallChain;
    }

    public double getAverageRecursionDepth() {
        return averageRecursionDepth;
    }
}
