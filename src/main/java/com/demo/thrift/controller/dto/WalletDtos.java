package com.demo.thrift.controller.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.Positive;

public final class WalletDtos {
    private WalletDtos() {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class MintRequest {
        @Positive public long amount;
    }

    public static class BalanceResponse {
        public String account;
        public long balance;

        public BalanceResponse(String account, long balance) {
            this.account = account;
            this.balance = balance;
        }
    }
}
