package com.demo.thrift.exception;

public class InvalidInputException extends ThriftException {
    public InvalidInputException(String message) { super(ErrorKind.INVALID_INPUT, message); }
}
