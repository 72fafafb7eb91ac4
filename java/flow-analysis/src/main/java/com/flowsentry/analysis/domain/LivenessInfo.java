package com.flowsentry.analysis.domain;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

// ============================================
// LivenessInfo: Live variables at block boundaries
// ============================================
public class LivenessInfo {
    private final String blockId;
    private final Set<String> use;
    private final Set<String> def;
    private final Set<String> in;
    private final Set<String> out;

    public LivenessInfo(String blockId, Set<String> use, Set<String> def, Set<String> in, Set<String> out) {
        this.blockId = blockId;
        this.use = sorted(use);
        this.def = sorted(def);
        this.in = sorted(in);
        this.out = sorted(out);
    }

    private static Set<String> sorted(Set<String> values) {
        return values != null
            ? Collections.unmodifiableSet(new TreeSet<>(values))
            : Collections.<String>emptySet();
    }

    public String getBlockId() {
        return blockId;
    }

    public Set<String> getUse() {
        return use;
    }

    public Set<String> getDef() {
        return def;
    }

    public Set<String> getIn() {
        return in;
    }

    public Set<String> getOut() {
        return out;
    }
}
