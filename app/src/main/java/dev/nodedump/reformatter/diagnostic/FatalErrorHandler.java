package dev.nodedump.reformatter.diagnostic;

import java.io.PrintStream;
import java.util.Objects;
import java.util.Optional;

/**
 * Last-resort reporter for failed invariant checks and uncaught failures.
 *
 * <p>Writes the process id, version, active request and a stack trace to the error stream and then terminates
 * the process. Process id and version are resolved up front so that reporting does not depend on anything that
 * may be broken by the failure.
 */
public class FatalErrorHandler implements Thread.UncaughtExceptionHandler {

    static final String NO_REQUEST = "(null)";

    private final PrintStream err;
    private final ProcessTerminator terminator;
    private final boolean abortOnFatal;
    private final long pid;
    private final String version;

    public FatalErrorHandler(boolean abortOnFatal) {
        this(System.err, new RuntimeProcessTerminator(), abortOnFatal, ProcessHandle.current().pid(), BuildInfo.version());
    }

    FatalErrorHandler(PrintStream err, ProcessTerminator terminator, boolean abortOnFatal, long pid, String version) {
        this.err = Objects.requireNonNull(err, "err");
        this.terminator = Objects.requireNonNull(terminator, "terminator");
        this.abortOnFatal = abortOnFatal;
        this.pid = pid;
        this.version = Objects.requireNonNull(version, "version");
    }

    public void install() {
        Thread.setDefaultUncaughtExceptionHandler(this);
    }

    @Override
    public void uncaughtException(Thread thread, Throwable failure) {
        report(failure);
    }

    public void report(Throwable failure) {
        boolean invariantFailure = failure instanceof InvariantViolation;
        try {
            emit(failure);
        } catch (RuntimeException | Error secondary) {
            // keep the original failure primary and still terminate
            if (failure != null && failure != secondary) {
                failure.addSuppressed(secondary);
            }
        } finally {
            if (invariantFailure || abortOnFatal) {
                terminator.abort();
            } else {
                terminator.exit(1);
            }
        }
    }

    private void emit(Throwable failure) {
        String request = ActiveRequest.current().orElse(NO_REQUEST);
        if (failure instanceof InvariantViolation violation) {
            err.println(trapLine(violation, request));
            err.printf("Assertion failure (PID %d)%n", pid);
        } else {
            String type = failure == null ? "unknown" : failure.getClass().getName();
            err.printf("Fatal error: %s (PID %d)%n", type, pid);
        }
        err.printf("version: %s%n", version);
        err.printf("query: %s%n", request);
        err.println("backtrace:");
        StackTraceElement[] frames = failure == null ? new StackTraceElement[0] : failure.getStackTrace();
        for (int i = 0; i < frames.length; i++) {
            StackTraceElement frame = frames[i];
            err.printf("#%d %s.%s(%s:%d)%n",
                    i,
                    frame.getClassName(),
                    frame.getMethodName(),
                    frame.getFileName() == null ? "Unknown Source" : frame.getFileName(),
                    frame.getLineNumber());
        }
        err.flush();
    }

    private String trapLine(InvariantViolation violation, String request) {
        Optional<StackTraceElement> origin = violation.origin();
        if (violation.conditionName() == null
                || violation.errorType() == null
                || origin.map(StackTraceElement::getFileName).isEmpty()) {
            return "TRAP: ExceptionalCondition: bad arguments";
        }
        StackTraceElement frame = origin.get();
        return String.format("TRAP: %s(\"%s\", File: \"%s\", Line: %d, PID: %d, Query: %s)",
                violation.errorType(), violation.conditionName(),
                frame.getFileName(), frame.getLineNumber(), pid, request);
    }
}
