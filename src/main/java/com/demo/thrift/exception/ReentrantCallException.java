package com.demo.thrift.exception;

/** A call tried to enter a guard scope its own thread is already inside. */
public class ReentrantCallException extends PreconditionFailedException {

    private final String scope;

    public ReentrantCallException(String scope) {
        super("Reentrant call rejected for " + scope);
        this.scope = scope;
    }

    public String getScope() {
        return scope;
    }
}
