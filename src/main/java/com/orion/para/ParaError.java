package com.orion.para;

public class ParaError {
    private final ParaErrorCode code;
    private final String message;
    private final Throwable cause;

    public ParaError(ParaErrorCode code, String message, Throwable cause) {
        this.code = code;
        this.message = message;
        this.cause = cause;
    }

    public static ParaError of(ParaErrorCode code, String message) {
        return new ParaError(code, message, null);
    }

    public static ParaError of(ParaErrorCode code, String message, Throwable cause) {
        return new ParaError(code, message, cause);
    }

    public ParaErrorCode getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    public Throwable getCause() {
        return cause;
    }

    @Override
    public String toString() {
        return code + ": " + message;
    }
}
