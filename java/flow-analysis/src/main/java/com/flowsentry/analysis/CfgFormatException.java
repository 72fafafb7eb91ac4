package com.flowsentry.analysis;

/**
 * Raised when a workspace CFG document cannot be read or parsed at all.
 */
public class CfgFormatException extends Exception {

    public CfgFormatException(String message) {
        super(message);
    }

    public CfgFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
