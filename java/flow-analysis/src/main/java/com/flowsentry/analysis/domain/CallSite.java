package com.flowsentry.analysis.domain;

// ============================================
// CallSite: Where a call appears in its caller
// ============================================
public class CallSite {
    private final String blockId;
    private final String statementId;
    private final String statementText;

    public CallSite(String blockId, String statementId, String statementText) {
        this.blockId = blockId;
        this.statementId = statementId;
        this.statementText = statementText;
    }

    public String getBlockId() {
        return blockId;
    }

    public String getStatementId() {
        return statementId;
    }

    public String getStatementText() {
        return statementText;
    }

    @Override
    public String toString() {
        return blockId + ":" + statementId;
    }
}
