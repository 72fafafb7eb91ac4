package com.flowsentry.analysis;

import com.flowsentry.analysis.domain.TaintFact;

// ============================================
// TaintSeed: Fact injected at a statement index before propagation starts
// ============================================
public class TaintSeed {
    private final String blockId;
    private final int startIndex;
    private final TaintFact fact;

    public TaintSeed(String blockId, int startIndex, TaintFact fact) {
        this.blockId = blockId;
        this.startIndex = startIndex;
        this.fact = fact;
    }

    public String getBlockId() {
        return blockId;
    }

    public int getStartIndex() {
        return startIndex;
    }

    public TaintFact getFact() {
        return fact;
    }

    public String getKey() {
        return blockId + ":" + startIndex + ":" + fact.getKey();
    }
}
