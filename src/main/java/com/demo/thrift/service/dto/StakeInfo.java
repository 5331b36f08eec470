package com.demo.thrift.service.dto;

public record StakeInfo(
        long groupId,
        String member,
        long amount,
        int defaultCount,
        boolean blacklisted,
        int trustScore
) {}
