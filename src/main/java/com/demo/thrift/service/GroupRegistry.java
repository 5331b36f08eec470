package com.demo.thrift.service;

import com.demo.thrift.exception.InsufficientBalanceException;
import com.demo.thrift.exception.InvalidInputException;
import com.demo.thrift.model.EscrowBalance;
import com.demo.thrift.model.Group;
import com.demo.thrift.model.GroupConfig;
import com.demo.thrift.model.GroupModel;
import com.demo.thrift.model.GroupStatus;
import com.demo.thrift.model.Member;
import com.demo.thrift.repository.EscrowBalanceRepository;
import com.demo.thrift.repository.GroupRepository;
import com.demo.thrift.repository.MemberRepository;
import com.demo.thrift.service.dto.PlatformStats;
import com.demo.thrift.service.support.Addresses;
import com.demo.thrift.tx.LedgerTransactions;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Allocates group ids and is the only place that issues ledger grants. Creating a group opens its
 * escrow account and insurance pool and hands the grant to the lifecycle service. A non-zero
 * {@link ProtocolPolicy#groupCreationFee()} is taken from the creator and paid to the treasury.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GroupRegistry {

    private final LedgerTransactions transactions;
    private final LedgerAccess access;
    private final GroupRepository groups;
    private final MemberRepository members;
    private final EscrowBalanceRepository escrowBalances;
    private final EscrowLedger escrowLedger;
    private final InsuranceLedger insuranceLedger;
    private final GroupLifecycleService lifecycle;
    private final ValueTransfer valueTransfer;
    private final ProtocolPolicy policy;

    public Group createGroup(String caller, GroupConfig config) {
        String creator = Addresses.normalize(caller);
        if (config == null) {
            throw new InvalidInputException("config is required");
        }
        return transactions.execute("registry", () -> {
            long fee = policy.groupCreationFee();
            if (fee > 0 && !valueTransfer.transferFrom(creator, policy.treasury(), fee)) {
                throw new InsufficientBalanceException(creator + " cannot pay the creation fee of " + fee);
            }
            long id = groups.nextId();
            GroupGrant grant = access.issue(id);
            escrowLedger.openGroup(grant);
            insuranceLedger.openPool(grant, config.model() == GroupModel.EMERGENCY_LIQUIDITY);
            Group group = lifecycle.open(grant, creator, config);
            log.info("Created {} group {} by {}", config.model(), id, creator);
            return group;
        });
    }

    public List<Group> groupsByCreator(String creator) {
        String address = Addresses.normalize(creator);
        return transactions.read(() -> groups.findAll(g -> g.getCreator().equals(address)));
    }

    public List<Group> groupsByMember(String member) {
        String address = Addresses.normalize(member);
        return transactions.read(() -> {
            Set<Long> ids = new HashSet<>();
            for (Member m : members.findByAddress(address)) {
                ids.add(m.getGroupId());
            }
            return groups.findAll(g -> ids.contains(g.getId()));
        });
    }

    public List<Group> groupsByModel(GroupModel model) {
        return transactions.read(() -> groups.findAll(g -> g.getConfig().model() == model));
    }

    public List<Group> allGroups() {
        return transactions.read(groups::findAll);
    }

    public PlatformStats platformStats() {
        return transactions.read(() -> {
            PlatformStats stats = new PlatformStats();
            Set<String> addresses = new HashSet<>();
            for (Group g : groups.findAll()) {
                stats.totalGroups++;
                if (g.getStatus() == GroupStatus.ACTIVE) stats.activeGroups++;
                if (g.getStatus() == GroupStatus.COMPLETED) stats.completedGroups++;
                if (g.getStatus() == GroupStatus.CANCELLED) stats.cancelledGroups++;
                stats.groupsByModel.merge(g.getConfig().model(), 1L, Long::sum);
                addresses.addAll(g.getMembers());
            }
            for (EscrowBalance b : escrowBalances.findAll()) {
                stats.totalValueLocked += b.total();
            }
            stats.totalMembers = addresses.size();
            return stats;
        });
    }
}
