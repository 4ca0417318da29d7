package org.neuralchilli.datahub.worker;

/**
 * Outcome of running one payload locally.
 */
public final class RunResult {

    private final boolean success;
    private final String output;
    private final String error;

    private RunResult(boolean success, String output, String error) {
        this.success = success;
        this.output = output != null ? output : "";
        this.error = error;
    }

    public static RunResult success(String output) {
        return new RunResult(true, output, null);
    }

    public static RunResult failure(String error) {
        return new RunResult(false, null, error);
    }

    public boolean isSuccess() {
        return success;
    }

    public String output() {
        return output;
    }

    public String error() {
        return error;
    }

    @Override
    public String toString() {
        return success ? "RunResult[success]" : "RunResult[failure: " + error + "]";
    }
}
