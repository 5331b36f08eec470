package com.demo.thrift.service;

/**
 * Yield strategy used by the escrow vault for idle funds. Deposits pull from the vault account,
 * withdrawals and harvests pay into it. Failures propagate; the escrow never retries.
 */
public interface YieldAdapter {
    void deposit(long amount);
    void withdraw(long amount);
    long harvest();
    long balance();
    int  apy();
}
