package io.surfworks.foldforge.rewrite;

/**
 * A recorded decline: which pattern looked at which operation, and why it did not fire.
 *
 * @param patternName the pattern that declined
 * @param operation the textual form of the root operation at the time of the decline
 * @param reason the advisory reason given by the pattern
 */
public record RewriteDiagnostic(String patternName, String operation, String reason) {

    @Override
    public String toString() {
        return String.format("%s declined on '%s': %s", patternName, operation, reason);
    }
}
