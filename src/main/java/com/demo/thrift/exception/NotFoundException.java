package com.demo.thrift.exception;

public class NotFoundException extends ThriftException {
    public NotFoundException(String message) { super(ErrorKind.NOT_FOUND, message); }
}
