package space.ketterling.dataviento.openmeteo;

import java.util.List;

/**
 * An upstream payload that is malformed or outside its documented ranges.
 * Never retried.
 */
public class PayloadValidationException extends Exception {
    private final List<String> violations;

    public PayloadValidationException(String what, List<String> violations) {
        super(what + " failed validation: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public PayloadValidationException(String message, Throwable cause) {
        super(message, cause);
        this.violations = List.of(message);
    }

    public List<String> violations() {
        return violations;
    }
}
