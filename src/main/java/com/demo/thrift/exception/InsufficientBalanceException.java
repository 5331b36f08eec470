package com.demo.thrift.exception;

public class InsufficientBalanceException extends ThriftException {
    public InsufficientBalanceException(String message) { super(ErrorKind.INSUFFICIENT_BALANCE, message); }
}
