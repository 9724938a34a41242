package dev.nodedump.reformatter.diagnostic;

/**
 * Internal consistency checks. A failed check throws {@link InvariantViolation}.
 */
public final class Invariants {

    private Invariants() {
    }

    public static void check(boolean condition, String conditionName) {
        if (!condition) {
            throw new InvariantViolation(conditionName);
        }
    }
}
