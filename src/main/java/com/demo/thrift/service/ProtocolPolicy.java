package com.demo.thrift.service;

import com.demo.thrift.exception.InvalidInputException;
import com.demo.thrift.service.support.Bps;
import lombok.Builder;

import java.time.Duration;
import java.util.Set;

/**
 * Platform-wide parameters, fixed at startup. Admins and claim processors are listed here rather
 * than looked up at runtime.
 */
@Builder(toBuilder = true)
public record ProtocolPolicy(
        int liquidityBufferBps,
        int groupYieldShareBps,
        int stakePenaltyBps,
        int blacklistThreshold,
        int initialTrust,
        int trustReward,
        int trustPenalty,
        int maxTrust,
        int minReserveBps,
        long claimCap,
        long emergencyCap,
        Duration claimCooldown,
        int approvalThreshold,
        Set<String> admins,
        Set<String> claimProcessors,
        String treasury,
        long groupCreationFee,
        /** Part of every rotational platform fee held back for the group's creator until completion. */
        int creatorFeeShareBps
) {

    public static final String DEFAULT_TREASURY = "0x7000000000000000000000000000000000000007";

    public ProtocolPolicy {
        for (int bps : new int[]{liquidityBufferBps, groupYieldShareBps, stakePenaltyBps, minReserveBps,
                creatorFeeShareBps}) {
            if (bps < 0 || bps > Bps.DENOMINATOR) {
                throw new InvalidInputException("bps value out of range: " + bps);
            }
        }
        if (groupCreationFee < 0) {
            throw new InvalidInputException("groupCreationFee must not be negative");
        }
        if (blacklistThreshold < 1 || approvalThreshold < 1) {
            throw new InvalidInputException("thresholds must be at least 1");
        }
        if (maxTrust < 0 || initialTrust < 0 || initialTrust > maxTrust || trustReward < 0 || trustPenalty < 0) {
            throw new InvalidInputException("inconsistent trust parameters");
        }
        claimCooldown = claimCooldown == null ? Duration.ZERO : claimCooldown;
        admins = admins == null ? Set.of() : Set.copyOf(admins);
        claimProcessors = claimProcessors == null ? Set.of() : Set.copyOf(claimProcessors);
        treasury = treasury == null ? DEFAULT_TREASURY : treasury;
    }

    public static ProtocolPolicy defaults() {
        return ProtocolPolicy.builder()
                .liquidityBufferBps(1_000)
                .groupYieldShareBps(8_000)
                .stakePenaltyBps(2_000)
                .blacklistThreshold(3)
                .initialTrust(100)
                .trustReward(10)
                .trustPenalty(50)
                .maxTrust(1_000)
                .minReserveBps(1_000)
                .claimCap(1_000_000_000L)
                .emergencyCap(500_000_000L)
                .claimCooldown(Duration.ofDays(30))
                .approvalThreshold(2)
                .admins(Set.of())
                .claimProcessors(Set.of())
                .treasury(DEFAULT_TREASURY)
                .groupCreationFee(0)
                .creatorFeeShareBps(500)
                .build();
    }

    public boolean isAdmin(String address) {
        return admins.contains(address);
    }

    public boolean isClaimProcessor(String address) {
        return claimProcessors.contains(address) || admins.contains(address);
    }

    public int clampTrust(long score) {
        return (int) Math.max(0, Math.min(maxTrust, score));
    }
}
