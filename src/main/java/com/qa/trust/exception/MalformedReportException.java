package com.qa.trust.exception;

/**
 * The input could not be parsed into well-formed test cases. No record is produced and no
 * project state is touched.
 */
public class MalformedReportException extends RuntimeException {

    public MalformedReportException(String message) {
        super(message);
    }

    public MalformedReportException(String message, Throwable cause) {
        super(message, cause);
    }
}
