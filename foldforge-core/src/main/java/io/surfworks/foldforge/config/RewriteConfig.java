package io.surfworks.foldforge.config;

import java.nio.file.Path;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Configuration for running the reshape folding rewrites.
 *
 * <p>Configuration is loaded in order of precedence:
 * <ol>
 *   <li>Values set programmatically through the {@code with*} methods (highest priority)</li>
 *   <li>Config file ({@code ~/.config/foldforge/rewrite.json})</li>
 *   <li>Defaults (lowest priority)</li>
 * </ol>
 *
 * @param maxIterations        maximum number of sweeps the driver runs before giving up on a fixpoint
 * @param removeDeadOps        erase side-effect free operations whose results became unused
 * @param enableBubbleUpExpand register the expand/collapse reordering pattern
 * @param recordDiagnostics    keep every decline reason of the last run for inspection
 * @param verifyAfterEachSweep run the IR verifier after each sweep and fail on illegal IR
 * @param disabledPatterns     names of patterns that must never fire
 */
public record RewriteConfig(
        int maxIterations,
        boolean removeDeadOps,
        boolean enableBubbleUpExpand,
        boolean recordDiagnostics,
        boolean verifyAfterEachSweep,
        Set<String> disabledPatterns
) {

    /** Default sweep limit */
    public static final int DEFAULT_MAX_ITERATIONS = 10;

    /** Config directory */
    public static final Path CONFIG_DIR = Path.of(
            System.getProperty("user.home"), ".config", "foldforge"
    );

    /** Config file name */
    public static final String CONFIG_FILE = "rewrite.json";

    public RewriteConfig {
        Objects.requireNonNull(disabledPatterns, "disabledPatterns cannot be null");
        if (maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be positive, got " + maxIterations);
        }
        disabledPatterns = Set.copyOf(disabledPatterns);
    }

    /**
     * Returns the default configuration.
     */
    public static RewriteConfig defaults() {
        return new RewriteConfig(DEFAULT_MAX_ITERATIONS, true, true, false, false, Set.of());
    }

    /**
     * Returns the default config file path.
     */
    public static Path configFile() {
        return CONFIG_DIR.resolve(CONFIG_FILE);
    }

    public boolean isEnabled(String patternName) {
        return !disabledPatterns.contains(patternName);
    }

    public RewriteConfig withMaxIterations(int iterations) {
        return new RewriteConfig(iterations, removeDeadOps, enableBubbleUpExpand, recordDiagnostics,
                verifyAfterEachSweep, disabledPatterns);
    }

    public RewriteConfig withRemoveDeadOps(boolean enabled) {
        return new RewriteConfig(maxIterations, enabled, enableBubbleUpExpand, recordDiagnostics,
                verifyAfterEachSweep, disabledPatterns);
    }

    public RewriteConfig withBubbleUpExpand(boolean enabled) {
        return new RewriteConfig(maxIterations, removeDeadOps, enabled, recordDiagnostics,
                verifyAfterEachSweep, disabledPatterns);
    }

    public RewriteConfig withDiagnostics(boolean enabled) {
        return new RewriteConfig(maxIterations, removeDeadOps, enableBubbleUpExpand, enabled,
                verifyAfterEachSweep, disabledPatterns);
    }

    public RewriteConfig withVerification(boolean enabled) {
        return new RewriteConfig(maxIterations, removeDeadOps, enableBubbleUpExpand, recordDiagnostics,
                enabled, disabledPatterns);
    }

    public RewriteConfig withDisabledPattern(String patternName) {
        Set<String> disabled = new HashSet<>(disabledPatterns);
        disabled.add(patternName);
        return new RewriteConfig(maxIterations, removeDeadOps, enableBubbleUpExpand, recordDiagnostics,
                verifyAfterEachSweep, disabled);
    }
}
