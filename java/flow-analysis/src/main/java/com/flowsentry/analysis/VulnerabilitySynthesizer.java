package com.flowsentry.analysis;

import com.flowsentry.analysis.domain.PathHop;
import com.flowsentry.analysis.domain.Severity;
import com.flowsentry.analysis.domain.TaintFact;
import com.flowsentry.analysis.domain.TaintSink;
import com.flowsentry.analysis.domain.Vulnerability;
import com.flowsentry.analysis.domain.VulnerabilityType;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns a tainted fact reaching a sink into a {@link Vulnerability} and merges duplicates.
 */
public class VulnerabilitySynthesizer {

    public Vulnerability create(TaintFact fact, TaintSink sink, PathHop sinkSite) {
        VulnerabilityType type = sink.getCategory().getVulnerabilityType();
        Severity severity = sink.getSeverity() != null ? sink.getSeverity() : sink.getCategory().getDefaultSeverity();
        String cweId = sink.getCweId() != null ? sink.getCweId() : sink.getCategory().getDefaultCweId();

        List<PathHop> path = new ArrayList<>(fact.getHops());
        if (path.isEmpty() || !path.get(path.size() - 1).equals(sinkSite)) {
            path.add(sinkSite);
        }
        String id = sinkSite.getFunction() + "_" + sinkSite.getBlockId() + "_" + sinkSite.getStatementId()
            + "_" + fact.getVariable() + "_" + type.getId();
        String description = type.getDisplayName() + ": " + fact.getVariable() + " from "
            + fact.getSourceFunction() + " reaches " + sink.getFunctionName()
            + (fact.isSanitized() ? " after sanitization" : "");

        return new Vulnerability(id, type, severity, cweId, fact.getSourceSite(), sinkSite, path,
            fact.getSourceFunction(), fact.getSourceCategory(), fact.getVariable(), sink.getFunctionName(),
            fact.isSanitized(), fact.getContextId(), description);
    }

    /**
     * Keep the first vulnerability per source site, sink site, variable and type. An
     * unsanitized finding replaces a sanitized one for the same key.
     */
    public List<Vulnerability> deduplicate(Collection<Vulnerability> vulnerabilities) {
        Map<String, Vulnerability> unique = new LinkedHashMap<>();
        for (Vulnerability vulnerability : vulnerabilities) {
            String key = vulnerability.getDeduplicationKey();
            Vulnerability existing = unique.get(key);
            if (existing == null || (existing.isSanitized() && !vulnerability.isSanitized())) {
                unique.put(key, vulnerability);
            }
        }
        return new ArrayList<>(unique.values());
    }

    /**
     * Ordered {file, function, block, statement} list for reports.
     */
    public static List<Map<String, String>> materializePath(Vulnerability vulnerability) {
        List<Map<String, String>> hops = new ArrayList<>();
        for (PathHop hop : vulnerability.getPath()) {
            Map<String, String> entry = new LinkedHashMap<>();
            entry.put("file", hop.getFile());
            entry.put("function", hop.getFunction());
            entry.put("block", hop.getBlockId());
            entry.put("statement", hop.getStatementId());
            hops.add(entry);
        }
        return hops;
    }
}
