package com.demo.thrift.exception;

public class UnauthorizedException extends ThriftException {
    public UnauthorizedException(String message) { super(ErrorKind.UNAUTHORIZED, message); }
}
