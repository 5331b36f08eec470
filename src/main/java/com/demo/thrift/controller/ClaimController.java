package com.demo.thrift.controller;

import com.demo.thrift.controller.dto.ClaimDtos;
import com.demo.thrift.exception.InvalidInputException;
import com.demo.thrift.model.InsuranceClaim;
import com.demo.thrift.service.InsuranceLedger;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/claims")
@RequiredArgsConstructor
public class ClaimController {

    private final InsuranceLedger insuranceLedger;

    @GetMapping("/{claimId}")
    public InsuranceClaim get(@PathVariable String claimId) {
        return insuranceLedger.claim(claimId);
    }

    @GetMapping
    public List<InsuranceClaim> list(@RequestParam(required = false) String member,
                                     @RequestParam(required = false) Long group) {
        if ((member == null) == (group == null)) {
            throw new InvalidInputException("give exactly one of member or group");
        }
        return member != null ? insuranceLedger.claimsByMember(member) : insuranceLedger.claimsByGroup(group);
    }

    @PostMapping("/{claimId}/approve")
    public InsuranceClaim approve(@PathVariable String claimId,
                                  @RequestHeader(GroupController.CALLER) String caller,
                                  @RequestBody(required = false) ClaimDtos.ApproveRequest body) {
        return insuranceLedger.approveClaim(caller, claimId, body == null ? null : body.approvedAmount);
    }

    @PostMapping("/{claimId}/reject")
    public InsuranceClaim reject(@PathVariable String claimId,
                                 @RequestHeader(GroupController.CALLER) String caller,
                                 @RequestBody(required = false) ClaimDtos.RejectRequest body) {
        return insuranceLedger.rejectClaim(caller, claimId, body == null ? null : body.reason);
    }

    @PostMapping("/{claimId}/execute")
    public InsuranceClaim execute(@PathVariable String claimId,
                                  @RequestHeader(GroupController.CALLER) String caller) {
        return insuranceLedger.executeClaimPayout(caller, claimId);
    }
}
