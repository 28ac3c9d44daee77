package io.surfworks.foldforge.tensor;

import java.util.List;

/**
 * Exception thrown when a function fails tensor IR verification.
 */
public class TensorIrException extends RuntimeException {

    private final List<String> errors;

    public TensorIrException(String message, List<String> errors) {
        super(message);
        this.errors = List.copyOf(errors);
    }

    /**
     * Returns the individual verification failures.
     */
    public List<String> getErrors() {
        return errors;
    }
}
