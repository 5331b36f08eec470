package com.demo.thrift.controller;

import com.demo.thrift.controller.dto.ClaimDtos;
import com.demo.thrift.controller.dto.GroupDtos;
import com.demo.thrift.exception.InvalidInputException;
import com.demo.thrift.model.Contribution;
import com.demo.thrift.model.EscrowBalance;
import com.demo.thrift.model.Group;
import com.demo.thrift.model.GroupModel;
import com.demo.thrift.model.InsuranceClaim;
import com.demo.thrift.model.Member;
import com.demo.thrift.model.Payout;
import com.demo.thrift.service.EscrowLedger;
import com.demo.thrift.service.GroupLifecycleService;
import com.demo.thrift.service.GroupRegistry;
import com.demo.thrift.service.dto.PlatformStats;
import com.demo.thrift.service.dto.Reconciliation;
import com.demo.thrift.service.support.Addresses;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/groups")
@RequiredArgsConstructor
public class GroupController {

    static final String CALLER = "X-Caller-Address";

    private final GroupRegistry registry;
    private final GroupLifecycleService lifecycle;
    private final EscrowLedger escrowLedger;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Group create(@RequestHeader(CALLER) String caller,
                        @Valid @RequestBody GroupDtos.CreateGroupRequest body) {
        return registry.createGroup(caller, body.toConfig());
    }

    @GetMapping("/{id}")
    public Group get(@PathVariable long id) {
        return lifecycle.getGroup(id);
    }

    /** At most one filter applies; without one every group is listed. */
    @GetMapping
    public List<Group> list(@RequestParam(required = false) String creator,
                            @RequestParam(required = false) String member,
                            @RequestParam(required = false) GroupModel model) {
        int filters = (creator != null ? 1 : 0) + (member != null ? 1 : 0) + (model != null ? 1 : 0);
        if (filters > 1) {
            throw new InvalidInputException("use one of creator, member or model");
        }
        if (creator != null) return registry.groupsByCreator(creator);
        if (member != null) return registry.groupsByMember(member);
        if (model != null) return registry.groupsByModel(model);
        return registry.allGroups();
    }

    @GetMapping("/stats")
    public PlatformStats stats() {
        return registry.platformStats();
    }

    @PutMapping("/{id}/payout-order")
    public Group setPayoutOrder(@PathVariable long id, @RequestHeader(CALLER) String caller,
                                @Valid @RequestBody GroupDtos.PayoutOrderRequest body) {
        return lifecycle.setPayoutOrder(id, caller, body.order);
    }

    @PostMapping("/{id}/join")
    public Group join(@PathVariable long id, @RequestHeader(CALLER) String caller) {
        return lifecycle.join(id, caller);
    }

    @PostMapping("/{id}/contribute")
    public Contribution contribute(@PathVariable long id, @RequestHeader(CALLER) String caller) {
        return lifecycle.contribute(id, caller);
    }

    @PostMapping("/{id}/claim-payout")
    public GroupDtos.ClaimPayoutResponse claimPayout(@PathVariable long id, @RequestHeader(CALLER) String caller) {
        long amount = lifecycle.claimPayout(id, caller);
        return new GroupDtos.ClaimPayoutResponse(id, Addresses.normalize(caller), amount);
    }

    @PostMapping("/{id}/withdraw-matured")
    public Member withdrawMatured(@PathVariable long id, @RequestHeader(CALLER) String caller) {
        return lifecycle.withdrawMatured(id, caller);
    }

    @PostMapping("/{id}/early-withdraw")
    public Member earlyWithdraw(@PathVariable long id, @RequestHeader(CALLER) String caller) {
        return lifecycle.earlyWithdraw(id, caller);
    }

    @PostMapping("/{id}/members/{address}/enforce")
    public Contribution enforce(@PathVariable long id, @PathVariable String address) {
        return lifecycle.enforceMissedPayment(id, address);
    }

    @PostMapping("/{id}/pause")
    public Group pause(@PathVariable long id, @RequestHeader(CALLER) String caller) {
        return lifecycle.pause(id, caller);
    }

    @PostMapping("/{id}/resume")
    public Group resume(@PathVariable long id, @RequestHeader(CALLER) String caller) {
        return lifecycle.resume(id, caller);
    }

    @PostMapping("/{id}/cancel")
    public Group cancel(@PathVariable long id, @RequestHeader(CALLER) String caller) {
        return lifecycle.cancel(id, caller);
    }

    @PostMapping("/{id}/claims")
    @ResponseStatus(HttpStatus.CREATED)
    public InsuranceClaim submitClaim(@PathVariable long id, @RequestHeader(CALLER) String caller,
                                      @Valid @RequestBody ClaimDtos.SubmitClaimRequest body) {
        return lifecycle.submitClaim(id, caller, body.amount, body.evidenceReference);
    }

    @GetMapping("/{id}/members")
    public List<Member> members(@PathVariable long id) {
        return lifecycle.getMembers(id);
    }

    @GetMapping("/{id}/contributions")
    public List<Contribution> contributions(@PathVariable long id, @RequestParam(required = false) Integer cycle) {
        return lifecycle.getContributions(id, cycle);
    }

    @GetMapping("/{id}/payouts")
    public List<Payout> payouts(@PathVariable long id) {
        return lifecycle.getPayouts(id);
    }

    @GetMapping("/{id}/overdue")
    public Map<String, Object> overdue(@PathVariable long id) {
        List<String> members = lifecycle.overdueMembers(id);
        return Map.of("groupId", id, "members", members);
    }

    @GetMapping("/{id}/reconciliation")
    public Reconciliation reconciliation(@PathVariable long id) {
        return lifecycle.reconcile(id);
    }

    @GetMapping("/{id}/escrow")
    public EscrowBalance escrow(@PathVariable long id) {
        return escrowLedger.groupValue(id);
    }
}
