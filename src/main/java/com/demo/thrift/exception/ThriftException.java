package com.demo.thrift.exception;

/**
 * Base of every caller-visible rejection raised by the ledgers. Nothing inside the core is fatal:
 * an operation that throws one of these has been rolled back completely.
 */
public abstract class ThriftException extends RuntimeException {

    private final ErrorKind kind;

    protected ThriftException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
