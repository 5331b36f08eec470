package com.demo.thrift.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * A savings group. Mutated only by the lifecycle service, by saving a new copy; terminal groups
 * stay in the store so their history remains queryable.
 */
@Value
@Builder(toBuilder = true)
public class Group {

    long id;
    String creator;
    GroupConfig config;
    GroupStatus status;

    /** Join order until activation, payout order afterwards. */
    @Builder.Default
    List<String> members = List.of();

    /** Creator supplied payout order, empty when none was set. */
    @Builder.Default
    List<String> payoutOrder = List.of();

    int currentCycle;
    Instant cycleStartTime;
    int nextPayoutIndex;
    Instant maturityTime;
    Instant createdAt;
    Instant activatedAt;
    Instant closedAt;

    public boolean hasMember(String address) {
        return members.contains(address);
    }

    public boolean isFull() {
        return members.size() >= config.groupSize();
    }

    /** Last instant at which a contribution for the current cycle is accepted. */
    public Instant contributionDeadline() {
        return cycleStartTime.plus(config.cycleInterval()).plus(config.gracePeriod());
    }

    public boolean isMatured(Instant now) {
        return maturityTime != null && !now.isBefore(maturityTime);
    }
}
