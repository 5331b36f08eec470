package com.demo.thrift.model;

import lombok.Builder;

@Builder(toBuilder = true)
public record StakeRecord(
        long groupId,
        String member,
        long amount,
        int defaultCount,
        boolean blacklisted
) {
    public static StakeRecord empty(long groupId, String member) {
        return new StakeRecord(groupId, member, 0, 0, false);
    }
}
