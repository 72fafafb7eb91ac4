package com.flowsentry.analysis;

import com.flowsentry.analysis.FunctionCallExtractor.ExtractedCall;
import com.flowsentry.analysis.domain.BasicBlock;
import com.flowsentry.analysis.domain.ControlDependence;
import com.flowsentry.analysis.domain.FunctionCfg;
import com.flowsentry.analysis.domain.FunctionSummary;
import com.flowsentry.analysis.domain.PathHop;
import com.flowsentry.analysis.domain.SanitizerFunction;
import com.flowsentry.analysis.domain.Statement;
import com.flowsentry.analysis.domain.StatementKind;
import com.flowsentry.analysis.domain.TaintDerivation;
import com.flowsentry.analysis.domain.TaintFact;
import com.flowsentry.analysis.domain.TaintSink;
import com.flowsentry.analysis.domain.TaintSource;
import com.flowsentry.analysis.domain.TaintSourceCategory;
import com.flowsentry.analysis.domain.Vulnerability;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Forward taint propagation over one function.
 *
 * <p>Work items are (block, start index, fact). A fact is carried through the statements
 * of its block from the start index on, then to every successor at index 0. A statement
 * that uses the tainted variable taints the variables it defines, except where the use is
 * an argument of a call: calls apply their summary, sanitizer or inter-procedural effect
 * instead, and calls with no model are a boundary for the value they return.</p>
 *
 * <p>Which refinements apply is decided by the configured {@link SensitivityLevel}.</p>
 */
public class TaintAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(TaintAnalyzer.class);

    /** Receiver used for a call whose result is returned directly. */
    static final String RETURN_VALUE = "<return>";

    private static final String ARGV = "argv";

    private final AnalysisConfig config;
    private final TaintSourceRegistry sources;
    private final TaintSinkRegistry sinks;
    private final SanitizationRegistry sanitizers;
    private final FunctionSummaryTable summaries;
    private final VulnerabilitySynthesizer synthesizer;

    public TaintAnalyzer(AnalysisConfig config) {
        this(config, new TaintSourceRegistry(), new TaintSinkRegistry(), new SanitizationRegistry(),
            new FunctionSummaryTable());
    }

    public TaintAnalyzer(AnalysisConfig config, TaintSourceRegistry sources, TaintSinkRegistry sinks,
                         SanitizationRegistry sanitizers, FunctionSummaryTable summaries) {
        this.config = config != null ? config : AnalysisConfig.defaults();
        this.sources = sources;
        this.sinks = sinks;
        this.sanitizers = sanitizers;
        this.summaries = summaries;
        this.synthesizer = new VulnerabilitySynthesizer();
    }

    // ============================================
    // PUBLIC API
    // ============================================

    public TaintAnalysisResult analyze(FunctionCfg cfg) {
        return analyze(cfg, Collections.<TaintSeed>emptyList(), "", Collections.<String>emptySet());
    }

    /**
     * @param seeds facts injected by callers or callees
     * @param contextId call string the facts belong to, empty below maximum sensitivity
     * @param userFunctions analyzable functions whose calls are left to the inter-procedural layer
     */
    public TaintAnalysisResult analyze(FunctionCfg cfg, List<TaintSeed> seeds, String contextId,
                                       Set<String> userFunctions) {
        Run run = new Run(cfg, contextId != null ? contextId : "", userFunctions);
        run.collectSources();
        for (TaintSeed seed : seeds) {
            TaintFact fact = seed.getFact();
            run.recordFact(fact);
            run.enqueue(seed.getBlockId(), seed.getStartIndex(), fact);
        }
        run.propagate();

        TaintAnalysisResult result = new TaintAnalysisResult(cfg.getName(), run.contextId,
            new ArrayList<>(run.facts.values()), synthesizer.deduplicate(run.vulnerabilities),
            new ArrayList<>(run.controlDependences.values()), run.taintedCalls,
            new ArrayList<>(run.returnFacts.values()), run.processed);
        LOG.debug("Taint {}{}: {} facts, {} vulnerabilities, {} work items", cfg.getName(),
            run.contextId.isEmpty() ? "" : "[" + run.contextId + "]", result.getFacts().size(),
            result.getVulnerabilities().size(), run.processed);
        return result;
    }

    // ============================================
    // VARIABLE MATCHING
    // ============================================

    /**
     * Access path used for a variable: the full path when field-sensitive, else its base.
     */
    String normalizeVariable(String variable) {
        if (config.getSensitivity().isFieldSensitive()) {
            return variable;
        }
        int dot = variable.indexOf('.');
        return dot < 0 ? variable : variable.substring(0, dot);
    }

    /**
     * Whether a use of {@code candidate} reads the value of {@code tainted}. With field
     * sensitivity {@code s.a} matches {@code s} and {@code s.a.b} but not {@code s.b}.
     */
    boolean matches(String tainted, String candidate) {
        String left = normalizeVariable(tainted);
        String right = normalizeVariable(candidate);
        return left.equals(right) || right.startsWith(left + ".") || left.startsWith(right + ".");
    }

    private boolean usesAny(Set<String> used, String variable) {
        for (String candidate : used) {
            if (matches(variable, candidate)) {
                return true;
            }
        }
        return false;
    }

    // ============================================
    // ONE ANALYSIS RUN
    // ============================================

    private final class Run {
        private final FunctionCfg cfg;
        private final String contextId;
        private final Set<String> userFunctions;
        private final ControlDependenceAnalyzer controlDependence;

        private final Deque<WorkItem> worklist = new ArrayDeque<>();
        private final Set<String> visited = new HashSet<>();
        private final Map<String, TaintFact> facts = new LinkedHashMap<>();
        private final Map<String, TaintFact> returnFacts = new LinkedHashMap<>();
        private final List<Vulnerability> vulnerabilities = new ArrayList<>();
        private final Map<String, ControlDependence> controlDependences = new LinkedHashMap<>();
        private final List<TaintedCall> taintedCalls = new ArrayList<>();
        private int processed;

        Run(FunctionCfg cfg, String contextId, Set<String> userFunctions) {
            this.cfg = cfg;
            this.contextId = contextId;
            this.userFunctions = userFunctions;
            this.controlDependence = new ControlDependenceAnalyzer(cfg);
        }

        // ---- sources ----

        void collectSources() {
            boolean argvParameter = cfg.getParameters().contains(ARGV);
            if (argvParameter && cfg.getEntryBlockId() != null) {
                String entry = cfg.getEntryBlockId();
                PathHop site = new PathHop(cfg.getSourceFile(), cfg.getName(), entry, entry + "_param_" + ARGV);
                TaintFact fact = TaintFact.fromSource(ARGV, ARGV, argvCategory(), site, TaintDerivation.SOURCE,
                    contextId);
                recordFact(fact);
                enqueue(entry, 0, fact);
            }
            for (BasicBlock block : cfg.getBasicBlocks()) {
                List<Statement> statements = block.getStatements();
                for (int j = 0; j < statements.size(); j++) {
                    Statement statement = statements.get(j);
                    PathHop site = hop(block.getId(), statement);
                    for (ExtractedCall call : FunctionCallExtractor.extractCalls(statement.getText())) {
                        TaintSource source = sources.getSource(call.getName());
                        if (source == null) {
                            continue;
                        }
                        for (String target : sources.targetVariables(source, call, statement.getText())) {
                            TaintFact fact = TaintFact.fromSource(normalizeVariable(target), source.getFunctionName(),
                                source.getCategory(), site, TaintDerivation.SOURCE, contextId);
                            recordFact(fact);
                            enqueue(block.getId(), j + 1, fact);
                        }
                    }
                    if (!argvParameter && statement.getUsedVariables().contains(ARGV)) {
                        for (String target : statement.getDefinedVariables()) {
                            TaintFact fact = TaintFact.fromSource(normalizeVariable(target), ARGV, argvCategory(),
                                site, TaintDerivation.SOURCE, contextId);
                            recordFact(fact);
                            enqueue(block.getId(), j + 1, fact);
                        }
                    }
                }
            }
        }

        private TaintSourceCategory argvCategory() {
            TaintSource argv = sources.getSource(ARGV);
            return argv != null ? argv.getCategory() : TaintSourceCategory.COMMAND_LINE;
        }

        // ---- worklist ----

        void enqueue(String blockId, int startIndex, TaintFact fact) {
            if (!fact.isTainted() || cfg.getBlock(blockId) == null) {
                return;
            }
            String source = fact.getSourceSite().toPathEntry() + (fact.isSanitized() ? "#sanitized" : "");
            String key = blockId + ":" + fact.getVariable() + ":" + source + ":" + startIndex;
            if (visited.add(key)) {
                worklist.add(new WorkItem(blockId, startIndex, fact));
            }
        }

        void recordFact(TaintFact fact) {
            if (!facts.containsKey(fact.getKey())) {
                facts.put(fact.getKey(), fact);
            }
        }

        void propagate() {
            while (!worklist.isEmpty()) {
                WorkItem item = worklist.poll();
                processed++;
                if (scanBlock(item)) {
                    for (String successor : cfg.getSuccessors(item.blockId)) {
                        enqueue(successor, 0, item.fact);
                    }
                }
            }
        }

        /**
         * Carry the fact through the rest of its block.
         *
         * @return false when the fact was killed or sanitized before the block end
         */
        private boolean scanBlock(WorkItem item) {
            BasicBlock block = cfg.getBlock(item.blockId);
            List<Statement> statements = block.getStatements();
            String variable = item.fact.getVariable();
            for (int j = item.startIndex; j < statements.size(); j++) {
                Statement statement = statements.get(j);
                if (usesAny(statement.getUsedVariables(), variable)) {
                    if (!processUse(block, j, item.fact)) {
                        return false;
                    }
                } else if (config.getSensitivity().isFlowSensitive() && definesExactly(statement, variable)) {
                    return false;
                }
            }
            return true;
        }

        private boolean definesExactly(Statement statement, String variable) {
            for (String defined : statement.getDefinedVariables()) {
                if (normalizeVariable(defined).equals(variable)) {
                    return true;
                }
            }
            return false;
        }

        // ---- statement transfer ----

        /**
         * Apply one statement that reads the fact's variable.
         *
         * @return false when the statement sanitized the variable itself
         */
        private boolean processUse(BasicBlock block, int index, TaintFact fact) {
            Statement statement = block.getStatements().get(index);
            String text = statement.getText();
            String variable = fact.getVariable();
            PathHop site = hop(block.getId(), statement);
            boolean continues = true;

            List<ExtractedCall> calls = FunctionCallExtractor.extractCalls(text);
            for (ExtractedCall call : calls) {
                Set<Integer> tainted = taintedArguments(call, variable);
                if (tainted.isEmpty()) {
                    continue;
                }
                checkSink(call, tainted, fact, site);

                SanitizerFunction sanitizer = sanitizers.getSanitizer(call.getName());
                if (sanitizer != null) {
                    continues &= applySanitizer(sanitizer, call, block.getId(), index, fact, site);
                    continue;
                }
                String receiver = receiverOf(statement, call);
                if (userFunctions.contains(call.getName())) {
                    taintedCalls.add(new TaintedCall(call.getName(), tainted, fact, site));
                    continue;
                }
                FunctionSummary summary = summaries.getSummary(call.getName());
                if (summary != null) {
                    for (String target : summaries.propagate(summary, call.getArguments(), tainted, receiver)) {
                        taintTarget(block.getId(), index, fact, target, site);
                    }
                } else if (!sources.isSource(call.getName())) {
                    LOG.trace("{}: {} stops at unmodelled call {}", cfg.getName(), variable, call.getName());
                }
            }

            if (usesAny(StatementFactsExtractor.usedVariables(withoutCalls(text, calls)), variable)) {
                for (String defined : statement.getDefinedVariables()) {
                    taintTarget(block.getId(), index, fact, defined, site);
                }
                if (statement.isReturn()) {
                    recordReturn(fact, site);
                }
            }

            if (isBranch(block, statement, index)) {
                applyControlDependence(block, statement, fact);
            }
            return continues;
        }

        private Set<Integer> taintedArguments(ExtractedCall call, String variable) {
            Set<Integer> tainted = new LinkedHashSet<>();
            List<String> arguments = call.getArguments();
            for (int i = 0; i < arguments.size(); i++) {
                if (usesAny(StatementFactsExtractor.usedVariables(arguments.get(i)), variable)) {
                    tainted.add(i);
                }
            }
            return tainted;
        }

        private void checkSink(ExtractedCall call, Set<Integer> tainted, TaintFact fact, PathHop site) {
            TaintSink sink = sinks.getSink(call.getName());
            if (sink == null || fact.isSanitized()) {
                return;
            }
            for (Integer index : tainted) {
                if (TaintSinkRegistry.isDangerousArgument(sink, index, call.getArguments().size())) {
                    vulnerabilities.add(synthesizer.create(fact, sink, site));
                    return;
                }
            }
        }

        private boolean applySanitizer(SanitizerFunction sanitizer, ExtractedCall call, String blockId, int index,
                                       TaintFact fact, PathHop site) {
            String input = sanitizers.inputVariable(sanitizer, call);
            if (input == null || !matches(fact.getVariable(), input)) {
                return true;
            }
            String output = sanitizers.outputVariable(sanitizer, call,
                cfg.getBlock(blockId).getStatements().get(index).getText());
            if (output == null) {
                output = input;
            }
            output = normalizeVariable(output);
            TaintFact sanitized = fact.sanitize(output, site, sanitizer.isRemovesTaint());
            recordFact(sanitized);
            enqueue(blockId, index + 1, sanitized);
            return !output.equals(fact.getVariable());
        }

        private void taintTarget(String blockId, int index, TaintFact fact, String target, PathHop site) {
            if (RETURN_VALUE.equals(target)) {
                recordReturn(fact, site);
                return;
            }
            String variable = normalizeVariable(target);
            if (variable.equals(fact.getVariable())) {
                return;
            }
            TaintFact derived = fact.derive(variable, site, TaintDerivation.DATA);
            recordFact(derived);
            enqueue(blockId, index + 1, derived);
        }

        private void recordReturn(TaintFact fact, PathHop site) {
            TaintFact returned = fact.derive(fact.getVariable(), site, fact.getDerivation());
            if (!returnFacts.containsKey(returned.getKey())) {
                returnFacts.put(returned.getKey(), returned);
            }
        }

        // ---- control dependence ----

        private boolean isBranch(BasicBlock block, Statement statement, int index) {
            if (block.getSuccessors().size() < 2) {
                return false;
            }
            return statement.getKind() == StatementKind.CONDITIONAL || statement.getKind() == StatementKind.LOOP
                || index == block.getStatements().size() - 1;
        }

        private void applyControlDependence(BasicBlock block, Statement condition, TaintFact fact) {
            Set<String> dependent = controlDependence.dependentBlocks(block.getId(), config.getSensitivity());
            if (dependent.isEmpty()) {
                return;
            }
            String key = block.getId() + ":" + fact.getVariable();
            if (!controlDependences.containsKey(key)) {
                controlDependences.put(key, new ControlDependence(cfg.getName(), block.getId(), condition.getId(),
                    fact.getVariable(), dependent));
            }
            for (String dependentId : dependent) {
                List<Statement> statements = cfg.getBlock(dependentId).getStatements();
                for (int k = 0; k < statements.size(); k++) {
                    Statement statement = statements.get(k);
                    for (String defined : statement.getDefinedVariables()) {
                        TaintFact controlled = fact.derive(normalizeVariable(defined), hop(dependentId, statement),
                            TaintDerivation.CONTROL);
                        recordFact(controlled);
                        enqueue(dependentId, k + 1, controlled);
                    }
                }
            }
        }

        private PathHop hop(String blockId, Statement statement) {
            return new PathHop(cfg.getSourceFile(), cfg.getName(), blockId, statement.getId());
        }
    }

    // ============================================
    // HELPERS
    // ============================================

    /**
     * Variable assigned the result of {@code call}: the assignment target, {@link #RETURN_VALUE}
     * for {@code return call(..)}, or null when the result is discarded or nested.
     */
    static String receiverOf(Statement statement, ExtractedCall call) {
        String text = FunctionCallExtractor.cleanStatementText(statement.getText());
        if (Pattern.compile("^return\\s+\\(?\\s*" + Pattern.quote(call.getName()) + "\\s*\\(").matcher(text).find()) {
            return RETURN_VALUE;
        }
        return InterProceduralReachingDefinitions.receivingVariable(text, call.getName());
    }

    /**
     * Statement text with every outermost call expression replaced by a constant.
     */
    static String withoutCalls(String text, List<ExtractedCall> calls) {
        String cleaned = FunctionCallExtractor.cleanStatementText(text);
        StringBuilder residual = new StringBuilder();
        int position = 0;
        for (ExtractedCall call : calls) {
            int start = call.getStart();
            if (start < position || start > cleaned.length()) {
                continue;
            }
            int end = Math.min(cleaned.length(), start + call.getCallExpression().length());
            residual.append(cleaned, position, start).append('0');
            position = end;
        }
        residual.append(cleaned.substring(Math.min(position, cleaned.length())));
        return residual.toString();
    }

    private static final class WorkItem {
        private final String blockId;
        private final int startIndex;
        private final TaintFact fact;

        WorkItem(String blockId, int startIndex, TaintFact fact) {
            this.blockId = blockId;
            this.startIndex = startIndex;
            this.fact = fact;
        }
    }
}
