package com.demo.thrift.controller;

import com.demo.thrift.controller.dto.ClaimDtos;
import com.demo.thrift.model.InsurancePool;
import com.demo.thrift.service.InsuranceLedger;
import com.demo.thrift.service.dto.PoolHealth;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/insurance")
@RequiredArgsConstructor
public class InsuranceController {

    private final InsuranceLedger insuranceLedger;

    @GetMapping("/health")
    public PoolHealth health(@RequestParam(required = false) Long group) {
        return group == null ? insuranceLedger.health() : insuranceLedger.health(group);
    }

    @PostMapping("/groups/{groupId}/reserve-withdrawal")
    public InsurancePool withdrawReserve(@PathVariable long groupId,
                                         @RequestHeader(GroupController.CALLER) String caller,
                                         @Valid @RequestBody ClaimDtos.ReserveWithdrawalRequest body) {
        return insuranceLedger.withdrawReserve(caller, groupId, body.recipient, body.amount);
    }
}
