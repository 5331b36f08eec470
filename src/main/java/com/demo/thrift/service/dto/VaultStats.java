package com.demo.thrift.service.dto;

public record VaultStats(
        long onHand,
        long deployed,
        long totalAssets,
        long idleFunds,
        long escrowedForGroups,
        int bufferBps,
        int apyBps
) {}
