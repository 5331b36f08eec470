package com.demo.thrift.controller;

import com.demo.thrift.adapter.InMemoryValueTransfer;
import com.demo.thrift.controller.dto.WalletDtos;
import com.demo.thrift.service.support.Addresses;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.web.bind.annotation.*;

/**
 * Mints the settlement asset out of thin air. Off unless {@code thrift.faucet.enabled} is set, as
 * the {@code demo} profile does.
 */
@Slf4j
@RestController
@RequestMapping("/api/wallets")
@RequiredArgsConstructor
@ConditionalOnProperty(name = "thrift.faucet.enabled", havingValue = "true")
public class FaucetController {

    private final InMemoryValueTransfer valueTransfer;

    @PostMapping("/{address}/mint")
    public WalletDtos.BalanceResponse mint(@PathVariable String address,
                                           @Valid @RequestBody WalletDtos.MintRequest body) {
        String account = Addresses.normalize(address);
        long balance = valueTransfer.mint(account, body.amount);
        log.info("Faucet minted {} to {}", body.amount, account);
        return new WalletDtos.BalanceResponse(account, balance);
    }
}
