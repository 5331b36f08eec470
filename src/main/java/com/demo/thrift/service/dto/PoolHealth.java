package com.demo.thrift.service.dto;

/** {@code utilisationBps} is claims paid over premiums collected. */
public record PoolHealth(
        Long groupId,
        long groupBalance,
        long reserveFund,
        long totalPremiums,
        long totalClaimsPaid,
        int utilisationBps
) {}
