package com.demo.thrift.service;

/**
 * Settlement asset movements. Implementations must be atomic with the calling ledger operation:
 * either the whole amount moves or nothing does. {@code false} means the source cannot cover it.
 */
public interface ValueTransfer {
    boolean transfer(String from, String to, long amount);
    boolean transferFrom(String owner, String to, long amount);
    long    balanceOf(String account);
}
