package ai.tabprof;

/**
 * Fatal profiling failure. No partial report is produced once this is thrown.
 */
public class ProfilerException extends RuntimeException {

    public ProfilerException(String message) {
        super(message);
    }

    public ProfilerException(String message, Throwable cause) {
        super(message, cause);
    }
}
