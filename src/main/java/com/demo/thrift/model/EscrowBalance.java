package com.demo.thrift.model;

import lombok.Builder;

/**
 * Escrowed funds of one group. {@code feesPaid} and {@code penaltiesForfeited} count principal
 * that left the group to the treasury and to the insurance pool. {@code creatorFeesHeld} is the
 * creator's share of those fees, kept in the vault until the group completes.
 */
@Builder(toBuilder = true)
public record EscrowBalance(
        long groupId,
        long principal,
        long yieldReserve,
        long pendingPayouts,
        long feesPaid,
        long penaltiesForfeited,
        long yieldHarvested,
        long creatorFeesHeld
) {
    public static EscrowBalance empty(long groupId) {
        return EscrowBalance.builder().groupId(groupId).build();
    }

    public long total() {
        return principal + yieldReserve + pendingPayouts + creatorFeesHeld;
    }
}
