package dev.nodedump.reformatter.diagnostic;

import java.util.Arrays;
import java.util.Optional;

/**
 * Raised when an internal invariant check fails.
 */
public class InvariantViolation extends IllegalStateException {

    public static final String FAILED_ASSERTION = "FailedAssertion";

    private final String conditionName;
    private final String errorType;

    public InvariantViolation(String conditionName) {
        this(conditionName, FAILED_ASSERTION);
    }

    public InvariantViolation(String conditionName, String errorType) {
        super(errorType + "(\"" + conditionName + "\")");
        this.conditionName = conditionName;
        this.errorType = errorType;
    }

    public String conditionName() {
        return conditionName;
    }

    public String errorType() {
        return errorType;
    }

    /**
     * First stack frame outside of {@link Invariants}, i.e. the code whose check failed.
     */
    public Optional<StackTraceElement> origin() {
        return Arrays.stream(getStackTrace())
                .filter(frame -> !frame.getClassName().equals(Invariants.class.getName()))
                .findFirst();
    }
}
