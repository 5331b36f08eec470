package com.demo.thrift.controller.dto;

import com.demo.thrift.model.GroupConfig;
import com.demo.thrift.model.GroupModel;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;

import java.time.Duration;
import java.util.List;

public final class GroupDtos {
    private GroupDtos() {}

    // -------- Requests ----------
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class CreateGroupRequest {
        @NotNull  public GroupModel model;
        @Positive public long contributionAmount;
        @NotNull  public Duration cycleInterval;   // ISO-8601, e.g. "P30D"
        @Min(GroupConfig.MIN_GROUP_SIZE) @Max(GroupConfig.MAX_GROUP_SIZE)
                  public int groupSize;
        public Duration lockDuration;              // FIXED_SAVINGS only
        public Duration gracePeriod;
        @PositiveOrZero public long stakeRequired;
        public boolean insuranceEnabled;
        @Min(0) @Max(GroupConfig.MAX_BPS) public int insuranceBps;
        @Min(0) @Max(GroupConfig.MAX_BPS) public int platformFeeBps;
        @Min(0) @Max(GroupConfig.MAX_BPS) public int earlyWithdrawalPenaltyBps;

        public GroupConfig toConfig() {
            return GroupConfig.builder()
                    .model(model)
                    .contributionAmount(contributionAmount)
                    .cycleInterval(cycleInterval)
                    .groupSize(groupSize)
                    .lockDuration(lockDuration)
                    .gracePeriod(gracePeriod)
                    .stakeRequired(stakeRequired)
                    .insuranceEnabled(insuranceEnabled)
                    .insuranceBps(insuranceBps)
                    .platformFeeBps(platformFeeBps)
                    .earlyWithdrawalPenaltyBps(earlyWithdrawalPenaltyBps)
                    .build();
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PayoutOrderRequest {
        @NotEmpty public List<String> order;
    }

    // -------- Responses ----------
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ClaimPayoutResponse {
        public long groupId;
        public String recipient;
        public long amount;

        public ClaimPayoutResponse(long groupId, String recipient, long amount) {
            this.groupId = groupId;
            this.recipient = recipient;
            this.amount = amount;
        }
    }
}
