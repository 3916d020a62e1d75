package com.govsandbox.common;

import lombok.Getter;

/**
 * Thrown by sandbox components when a request is malformed, unauthorized, or an integrity check fails.
 * Callers switch on {@link #getKind()}; the message is for logs and operators.
 */
@Getter
public class SandboxException extends RuntimeException {

    private final ErrorKind kind;

    public SandboxException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public SandboxException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}
