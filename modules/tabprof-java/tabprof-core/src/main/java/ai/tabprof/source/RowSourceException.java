package ai.tabprof.source;

import ai.tabprof.ProfilerException;

/**
 * Input can not be read or is malformed.
 */
public class RowSourceException extends ProfilerException {

    public RowSourceException(String message) {
        super(message);
    }

    public RowSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
