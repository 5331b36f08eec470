package com.demo.thrift.model;

import lombok.Builder;

/**
 * Insurance funds of one group. Only {@code groupBalance} is claimable; {@code reserveFund} is the
 * solvency cushion and leaves only through an admin withdrawal.
 */
@Builder(toBuilder = true)
public record InsurancePool(
        long groupId,
        long groupBalance,
        long reserveFund,
        long totalPremiums,
        long totalClaimsPaid,
        long totalShortfallCovered,
        boolean emergencyMode
) {}
