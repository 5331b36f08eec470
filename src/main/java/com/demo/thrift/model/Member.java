package com.demo.thrift.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/** One per (group, address); created on join and never deleted. */
@Value
@Builder(toBuilder = true)
public class Member {

    long groupId;
    String address;
    long stakeAmount;
    long totalContributed;
    long totalReceived;
    /** Part of {@link #totalReceived} that came out of the yield reserve. */
    long yieldReceived;
    int trustScore;
    Instant joinedAt;
    boolean active;
    boolean withdrawn;

    /** Principal paid back to the member, i.e. everything received except yield. */
    public long principalReceived() {
        return totalReceived - yieldReceived;
    }
}
