package com.demo.thrift.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Set;

@Value
@Builder(toBuilder = true)
public class InsuranceClaim {

    String id;
    String claimant;
    long groupId;
    long amount;
    String evidenceReference;
    ClaimStatus status;
    Instant submittedAt;
    Instant processedAt;
    @Builder.Default
    Set<String> approvals = Set.of();
    String rejectionReason;

    public boolean hasApproved(String approver) {
        return approvals.contains(approver);
    }
}
