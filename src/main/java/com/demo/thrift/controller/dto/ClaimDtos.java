package com.demo.thrift.controller.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

public final class ClaimDtos {
    private ClaimDtos() {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SubmitClaimRequest {
        @Positive public long amount;
        @NotBlank public String evidenceReference;   // e.g. an IPFS CID
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ApproveRequest {
        public Long approvedAmount;   // optional, may only lower the claim
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RejectRequest {
        public String reason;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ReserveWithdrawalRequest {
        @NotBlank public String recipient;
        @Positive public long amount;
    }
}
