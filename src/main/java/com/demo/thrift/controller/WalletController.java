package com.demo.thrift.controller;

import com.demo.thrift.adapter.InMemoryValueTransfer;
import com.demo.thrift.controller.dto.WalletDtos;
import com.demo.thrift.service.support.Addresses;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

/** Balances of the in-process settlement asset. */
@RestController
@RequestMapping("/api/wallets")
@RequiredArgsConstructor
public class WalletController {

    private final InMemoryValueTransfer valueTransfer;

    @GetMapping("/{address}")
    public WalletDtos.BalanceResponse balance(@PathVariable String address) {
        String account = Addresses.normalize(address);
        return new WalletDtos.BalanceResponse(account, valueTransfer.balanceOf(account));
    }
}
