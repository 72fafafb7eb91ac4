package com.flowsentry.analysis.domain;

import java.util.Objects;

// ============================================
// PathHop: One step of a source-to-sink path
// ============================================
public class PathHop {
    private final String file;
    private final String function;
    private final String blockId;
    private final String statementId;

    public PathHop(String file, String function, String blockId, String statementId) {
        this.file = file;
        this.function = function;
        this.blockId = blockId;
        this.statementId = statementId;
    }

    public String getFile() {
        return file;
    }

    public String getFunction() {
        return function;
    }

    public String getBlockId() {
        return blockId;
    }

    public String getStatementId() {
        return statementId;
    }

    /**
     * Compact {@code block:statement} form used in propagation paths.
     */
    public String toPathEntry() {
        return blockId + ":" + statementId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PathHop)) {
            return false;
        }
        PathHop other = (PathHop) o;
        return Objects.equals(file, other.file)
            && Objects.equals(function, other.function)
            && Objects.equals(blockId, other.blockId)
            && Objects.equals(statementId, other.statementId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(file, function, blockId, statementId);
    }

    @Override
    public String toString() {
        return function + "/" + toPathEntry();
    }
}
