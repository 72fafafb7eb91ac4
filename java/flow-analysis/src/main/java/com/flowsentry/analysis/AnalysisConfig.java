package com.flowsentry.analysis;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Immutable analysis configuration, passed explicitly to every solver.
 */
public class AnalysisConfig {

    private static final Logger LOG = LoggerFactory.getLogger(AnalysisConfig.class);

    public static final String DEFAULT_RESOURCE = "flowsentry.properties";
    private static final String PREFIX = "flowsentry.";

    private final SensitivityLevel sensitivity;
    private final boolean livenessEnabled;
    private final boolean reachingDefinitionsEnabled;
    private final boolean taintEnabled;
    private final boolean interProceduralEnabled;
    private final boolean callGraphEnabled;
    private final int contextDepth;
    private final int parallelism;

    private AnalysisConfig(Builder builder) {
        this.sensitivity = builder.sensitivity;
        this.livenessEnabled = builder.livenessEnabled;
        this.reachingDefinitionsEnabled = builder.reachingDefinitionsEnabled;
        this.taintEnabled = builder.taintEnabled;
        this.interProceduralEnabled = builder.interProceduralEnabled;
        this.callGraphEnabled = builder.callGraphEnabled;
        this.contextDepth = builder.contextDepth;
        this.parallelism = builder.parallelism;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static AnalysisConfig defaults() {
        return builder().build();
    }

    public Builder toBuilder() {
        return new Builder()
            .sensitivity(sensitivity)
            .liveness(livenessEnabled)
            .reachingDefinitions(reachingDefinitionsEnabled)
            .taint(taintEnabled)
            .interProcedural(interProceduralEnabled)
            .callGraph(callGraphEnabled)
            .contextDepth(contextDepth)
            .parallelism(parallelism);
    }

    // ============================================
    // PROPERTIES LOADING
    // ============================================

    /**
     * Read {@code flowsentry.*} keys. Unknown sensitivity values are reported through
     * {@code diagnostics} and replaced by the fallback level.
     */
    public static AnalysisConfig fromProperties(Properties properties, AnalysisDiagnostics diagnostics) {
        Builder builder = builder();
        if (properties == null) {
            return builder.build();
        }
        String sensitivity = properties.getProperty(PREFIX + "sensitivity");
        if (sensitivity != null) {
            builder.sensitivity(SensitivityLevel.resolve(sensitivity, diagnostics));
        }
        builder.liveness(flag(properties, "liveness", true));
        builder.reachingDefinitions(flag(properties, "reachingDefinitions", true));
        builder.taint(flag(properties, "taint", true));
        builder.interProcedural(flag(properties, "interProcedural", true));
        builder.callGraph(flag(properties, "callGraph", true));
        builder.contextDepth(number(properties, "contextDepth", 1, diagnostics));
        builder.parallelism(number(properties, "parallelism", Runtime.getRuntime().availableProcessors(), diagnostics));
        return builder.build();
    }

    /**
     * Load {@value #DEFAULT_RESOURCE} from the classpath, or defaults when absent.
     */
    public static AnalysisConfig loadDefault(AnalysisDiagnostics diagnostics) {
        Properties properties = new Properties();
        try (InputStream in = AnalysisConfig.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                return defaults();
            }
            properties.load(in);
        } catch (IOException e) {
            LOG.warn("Could not read {}: {}", DEFAULT_RESOURCE, e.getMessage());
            return defaults();
        }
        return fromProperties(properties, diagnostics);
    }

    private static boolean flag(Properties properties, String key, boolean defaultValue) {
        String value = properties.getProperty(PREFIX + key);
        return value != null ? Boolean.parseBoolean(value.trim()) : defaultValue;
    }

    private static int number(Properties properties, String key, int defaultValue, AnalysisDiagnostics diagnostics) {
        String value = properties.getProperty(PREFIX + key);
        if (value == null) {
            return defaultValue;
        }
        try {
            int parsed = Integer.parseInt(value.trim());
            return parsed > 0 ? parsed : defaultValue;
        } catch (NumberFormatException e) {
            String message = "Invalid " + PREFIX + key + " '" + value + "', using " + defaultValue;
            if (diagnostics != null) {
                diagnostics.warn(LOG, "config", null, message);
            } else {
                LOG.warn(message);
            }
            return defaultValue;
        }
    }

    // ============================================
    // ACCESSORS
    // ============================================

    public SensitivityLevel getSensitivity() {
        return sensitivity;
    }

    public boolean isLivenessEnabled() {
        return livenessEnabled;
    }

    public boolean isReachingDefinitionsEnabled() {
        return reachingDefinitionsEnabled;
    }

    public boolean isTaintEnabled() {
        return taintEnabled;
    }

    public boolean isInterProceduralEnabled() {
        return interProceduralEnabled;
    }

    public boolean isCallGraphEnabled() {
        return callGraphEnabled;
    }

    public int getContextDepth() {
        return contextDepth;
    }

    public int getParallelism() {
        return parallelism;
    }

    /**
     * Inter-procedural taint needs both the flag and a sensitivity that includes it.
     */
    public boolean isInterProceduralTaintEnabled() {
        return taintEnabled && interProceduralEnabled && callGraphEnabled
            && sensitivity.isInterProceduralEnabled();
    }

    @Override
    public String toString() {
        return "AnalysisConfig{sensitivity=" + sensitivity.getLabel()
            + ", liveness=" + livenessEnabled
            + ", reachingDefinitions=" + reachingDefinitionsEnabled
            + ", taint=" + taintEnabled
            + ", interProcedural=" + interProceduralEnabled
            + ", callGraph=" + callGraphEnabled
            + ", contextDepth=" + contextDepth
            + ", parallelism=" + parallelism + "}";
    }

    public static class Builder {
        private SensitivityLevel sensitivity = SensitivityLevel.DEFAULT;
        private boolean livenessEnabled = true;
        private boolean reachingDefinitionsEnabled = true;
        private boolean taintEnabled = true;
        private boolean interProceduralEnabled = true;
        private boolean callGraphEnabled = true;
        private int contextDepth = 1;
        private int parallelism = Runtime.getRuntime().availableProcessors();

        public Builder sensitivity(SensitivityLevel sensitivity) {
            this.sensitivity = sensitivity != null ? sensitivity : SensitivityLevel.DEFAULT;
            return this;
        }

        public Builder liveness(boolean enabled) {
            this.livenessEnabled = enabled;
            return this;
        }

        public Builder reachingDefinitions(boolean enabled) {
            this.reachingDefinitionsEnabled = enabled;
            return this;
        }

        public Builder taint(boolean enabled) {
            this.taintEnabled = enabled;
            return this;
        }

        public Builder interProcedural(boolean enabled) {
            this.interProceduralEnabled = enabled;
            return this;
        }

        public Builder callGraph(boolean enabled) {
            this.callGraphEnabled = enabled;
            return this;
        }

        public Builder contextDepth(int contextDepth) {
            if (contextDepth < 1) {
                throw new IllegalArgumentException("contextDepth must be >= 1: " + contextDepth);
            }
            this.contextDepth = contextDepth;
            return this;
        }

        public Builder parallelism(int parallelism) {
            if (parallelism < 1) {
                throw new IllegalArgumentException("parallelism must be >= 1: " + parallelism);
            }
            this.parallelism = parallelism;
            return this;
        }

        public AnalysisConfig build() {
            return new AnalysisConfig(this);
        }
    }
}
