package com.demo.thrift.model;

import java.time.Instant;

/**
 * Settlement of one member's obligation for one cycle. {@code amount} is what reached the escrow
 * principal; {@code premium} is what went to the insurance pool.
 */
public record Contribution(
        long groupId,
        int cycle,
        String member,
        long amount,
        long premium,
        Instant timestamp,
        ContributionStatus status
) {}
