package com.demo.thrift.exception;

public class PreconditionFailedException extends ThriftException {
    public PreconditionFailedException(String message) { super(ErrorKind.PRECONDITION_FAILED, message); }
}
