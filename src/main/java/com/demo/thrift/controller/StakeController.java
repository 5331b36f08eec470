package com.demo.thrift.controller;

import com.demo.thrift.model.Reputation;
import com.demo.thrift.service.StakeLedger;
import com.demo.thrift.service.dto.StakeInfo;
import com.demo.thrift.service.support.Addresses;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/stakes")
@RequiredArgsConstructor
public class StakeController {

    private final StakeLedger stakeLedger;

    @GetMapping("/{groupId}/{address}")
    public StakeInfo stake(@PathVariable long groupId, @PathVariable String address) {
        return stakeLedger.stakeInfo(groupId, address);
    }

    @GetMapping("/trust/{address}")
    public Reputation trust(@PathVariable String address) {
        return stakeLedger.reputationOf(Addresses.normalize(address));
    }

    @PostMapping("/whitelist/{address}")
    public Map<String, Object> whitelist(@PathVariable String address,
                                         @RequestHeader(GroupController.CALLER) String caller) {
        stakeLedger.whitelist(caller, address);
        return Map.of("ok", true, "address", Addresses.normalize(address));
    }
}
