package io.surfworks.foldforge.rewrite;

import java.util.Objects;

/**
 * Outcome of {@link RewritePattern#match}: either the captured neighborhood to rewrite, or the
 * reason the pattern declined.
 *
 * @param <M> the pattern-specific match type
 */
public sealed interface MatchResult<M> permits MatchResult.Success, MatchResult.Failure {

    static <M> MatchResult<M> success(M match) {
        return new Success<>(match);
    }

    static <M> MatchResult<M> failure(String reason) {
        return new Failure<>(reason);
    }

    boolean isSuccess();

    record Success<M>(M match) implements MatchResult<M> {
        public Success {
            Objects.requireNonNull(match, "match cannot be null");
        }

        @Override
        public boolean isSuccess() {
            return true;
        }
    }

    record Failure<M>(String reason) implements MatchResult<M> {
        public Failure {
            Objects.requireNonNull(reason, "reason cannot be null");
        }

        @Override
        public boolean isSuccess() {
            return false;
        }
    }
}
