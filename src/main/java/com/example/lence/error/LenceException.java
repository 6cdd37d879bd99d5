package com.example.lence.error;

/**
 * Failure reported back to the caller with a machine-readable kind and a human-readable detail.
 * None of these are fatal to the server process.
 */
public class LenceException extends RuntimeException {
    private final ErrorKind kind;
    private final String detail;

    public LenceException(ErrorKind kind, String detail) {
        this(kind, detail, null);
    }

    public LenceException(ErrorKind kind, String detail, Throwable cause) {
        super(kind + ": " + detail, cause);
        this.kind = kind;
        this.detail = detail;
    }

    public static LenceException notFound(String detail) {
        return new LenceException(ErrorKind.NOT_FOUND, detail);
    }

    public static LenceException configuration(String detail) {
        return new LenceException(ErrorKind.CONFIGURATION_ERROR, detail);
    }

    public static LenceException configuration(String detail, Throwable cause) {
        return new LenceException(ErrorKind.CONFIGURATION_ERROR, detail, cause);
    }

    public static LenceException executionFailed(String detail, Throwable cause) {
        return new LenceException(ErrorKind.QUERY_EXECUTION_FAILED, detail, cause);
    }

    public ErrorKind getKind() {
        return kind;
    }

    public String getDetail() {
        return detail;
    }
}
