package dev.nodedump.reformatter.diagnostic;

/**
 * Terminates the running JVM.
 */
public class RuntimeProcessTerminator implements ProcessTerminator {

    static final int ABORT_STATUS = 134;

    @Override
    public void abort() {
        // no shutdown hooks
        Runtime.getRuntime().halt(ABORT_STATUS);
    }

    @Override
    public void exit(int status) {
        Runtime.getRuntime().exit(status);
    }
}
