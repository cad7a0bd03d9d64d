package com.ttennebkram.stylize.error;

/**
 * A pipeline stage failed. The pipeline records it as a sentinel and carries on.
 */
public class StageFailureException extends StylizeException {

    private final String stageName;

    public StageFailureException(String stageName, Throwable cause) {
        super("Stage '" + stageName + "' failed: " + describe(cause), cause);
        this.stageName = stageName;
    }

    public String getStageName() {
        return stageName;
    }

    static String describe(Throwable cause) {
        if (cause == null) {
            return "unknown cause";
        }
        String msg = cause.getMessage();
        return msg != null ? cause.getClass().getSimpleName() + ": " + msg : cause.getClass().getSimpleName();
    }
}
