package com.demo.thrift.controller;

import com.demo.thrift.service.EscrowLedger;
import com.demo.thrift.service.dto.VaultStats;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/escrow")
@RequiredArgsConstructor
public class EscrowController {

    private final EscrowLedger escrowLedger;

    @PostMapping("/harvest")
    public Map<String, Object> harvest(@RequestParam long groupId) {
        long harvested = escrowLedger.harvestYield(groupId);
        return Map.of("groupId", groupId, "harvested", harvested);
    }

    @GetMapping("/vault")
    public VaultStats vault() {
        return escrowLedger.vaultStats();
    }
}
