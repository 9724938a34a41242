package dev.nodedump.reformatter.diagnostic;

/**
 * Ends the process once fatal diagnostics have been written.
 */
public interface ProcessTerminator {

    /** Abnormal termination, the equivalent of a core-dumping abort. */
    void abort();

    void exit(int status);
}
