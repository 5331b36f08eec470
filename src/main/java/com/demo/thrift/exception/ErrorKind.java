package com.demo.thrift.exception;

import org.springframework.http.HttpStatus;

public enum ErrorKind {
    INVALID_INPUT(HttpStatus.BAD_REQUEST),
    PRECONDITION_FAILED(HttpStatus.CONFLICT),
    INSUFFICIENT_BALANCE(HttpStatus.UNPROCESSABLE_ENTITY),
    UNAUTHORIZED(HttpStatus.FORBIDDEN),
    NOT_FOUND(HttpStatus.NOT_FOUND);

    private final HttpStatus status;

    ErrorKind(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus status() {
        return status;
    }
}
