package com.demo.thrift.service;

import com.demo.thrift.exception.InsufficientBalanceException;
import com.demo.thrift.exception.InvalidInputException;
import com.demo.thrift.exception.NotFoundException;
import com.demo.thrift.exception.PreconditionFailedException;
import com.demo.thrift.exception.UnauthorizedException;
import com.demo.thrift.model.Contribution;
import com.demo.thrift.model.ContributionStatus;
import com.demo.thrift.model.EscrowBalance;
import com.demo.thrift.model.Group;
import com.demo.thrift.model.GroupConfig;
import com.demo.thrift.model.GroupModel;
import com.demo.thrift.model.GroupStatus;
import com.demo.thrift.model.InsuranceClaim;
import com.demo.thrift.model.Member;
import com.demo.thrift.model.Payout;
import com.demo.thrift.repository.ContributionRepository;
import com.demo.thrift.repository.GroupRepository;
import com.demo.thrift.repository.MemberRepository;
import com.demo.thrift.repository.PayoutRepository;
import com.demo.thrift.service.dto.Reconciliation;
import com.demo.thrift.service.support.Addresses;
import com.demo.thrift.service.support.Bps;
import com.demo.thrift.tx.JournaledMap;
import com.demo.thrift.tx.LedgerTransactions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Membership, cycles, contributions and payouts of every group.
 *
 * <p>Each mutating operation runs under the {@code group:<id>} guard and is all-or-nothing: the
 * ledgers it calls share its journal, so a failure anywhere leaves every ledger untouched. Groups
 * become usable only after {@link GroupRegistry} attached them with their ledger grant.
 */
@Slf4j
@Service
public class GroupLifecycleService {

    private final LedgerTransactions transactions;
    private final GroupRepository groups;
    private final MemberRepository members;
    private final ContributionRepository contributions;
    private final PayoutRepository payouts;
    private final StakeLedger stakeLedger;
    private final EscrowLedger escrowLedger;
    private final InsuranceLedger insuranceLedger;
    private final ProtocolPolicy policy;
    private final Clock clock;
    private final JournaledMap<Long, GroupGrant> grants;

    public GroupLifecycleService(LedgerTransactions transactions, GroupRepository groups, MemberRepository members,
                                 ContributionRepository contributions, PayoutRepository payouts,
                                 StakeLedger stakeLedger, EscrowLedger escrowLedger, InsuranceLedger insuranceLedger,
                                 ProtocolPolicy policy, Clock clock) {
        this.transactions = transactions;
        this.groups = groups;
        this.members = members;
        this.contributions = contributions;
        this.payouts = payouts;
        this.stakeLedger = stakeLedger;
        this.escrowLedger = escrowLedger;
        this.insuranceLedger = insuranceLedger;
        this.policy = policy;
        this.clock = clock;
        this.grants = new JournaledMap<>(transactions);
    }

    /** Creates the group record for a freshly granted id. Called by the registry only. */
    Group open(GroupGrant grant, String creator, GroupConfig config) {
        return inGroup(grant.groupId(), () -> {
            if (grants.containsKey(grant.groupId())) {
                throw new PreconditionFailedException("Group " + grant.groupId() + " already exists");
            }
            grants.put(grant.groupId(), grant);
            Group group = Group.builder()
                    .id(grant.groupId())
                    .creator(creator)
                    .config(config)
                    .status(GroupStatus.CREATED)
                    .createdAt(clock.instant())
                    .build();
            return groups.save(group);
        });
    }

    // ------------------------------------------------------------------ membership

    /** Fixes the rotation before activation. Allowed once, by the creator, while CREATED. */
    public Group setPayoutOrder(long groupId, String caller, List<String> order) {
        String who = Addresses.normalize(caller);
        if (order == null || order.isEmpty()) {
            throw new InvalidInputException("order is required");
        }
        List<String> normalized = new ArrayList<>(Addresses.normalizeAll(order));
        return inGroup(groupId, () -> {
            Group group = group(groupId);
            if (!group.getCreator().equals(who)) {
                throw new UnauthorizedException("Only the creator may set the payout order");
            }
            requireStatus(group, GroupStatus.CREATED);
            if (!group.getPayoutOrder().isEmpty()) {
                throw new PreconditionFailedException("Payout order already set");
            }
            if (normalized.size() != order.size() || normalized.size() != group.getConfig().groupSize()) {
                throw new InvalidInputException(
                        "order must list " + group.getConfig().groupSize() + " distinct addresses");
            }
            if (!normalized.containsAll(group.getMembers())) {
                throw new PreconditionFailedException("order must include every member who already joined");
            }
            return groups.save(group.toBuilder().payoutOrder(List.copyOf(normalized)).build());
        });
    }

    public Group join(long groupId, String caller) {
        String member = Addresses.normalize(caller);
        return inGroup(groupId, () -> {
            Group group = group(groupId);
            requireStatus(group, GroupStatus.CREATED);
            if (group.hasMember(member)) {
                throw new PreconditionFailedException(member + " already joined group " + groupId);
            }
            if (group.isFull()) {
                throw new PreconditionFailedException("Group " + groupId + " is full");
            }
            if (!group.getPayoutOrder().isEmpty() && !group.getPayoutOrder().contains(member)) {
                throw new PreconditionFailedException(member + " is not in the payout order");
            }
            if (stakeLedger.isBlacklisted(groupId, member)) {
                throw new PreconditionFailedException(member + " is blacklisted");
            }
            long stake = group.getConfig().stakeRequired();
            if (stake > 0) {
                if (!stakeLedger.canStake(member, stake)) {
                    throw new InsufficientBalanceException(member + " cannot post the stake of " + stake);
                }
                stakeLedger.depositStake(grant(groupId), member, stake);
            }
            Instant now = clock.instant();
            members.save(Member.builder()
                    .groupId(groupId)
                    .address(member)
                    .stakeAmount(stake)
                    .trustScore(stakeLedger.trustScore(member))
                    .joinedAt(now)
                    .active(true)
                    .build());

            List<String> joined = new ArrayList<>(group.getMembers());
            joined.add(member);
            Group updated = group.toBuilder().members(List.copyOf(joined)).build();
            if (updated.isFull()) {
                updated = activate(updated, now);
            }
            log.info("{} joined group {} ({}/{})", member, groupId, joined.size(), group.getConfig().groupSize());
            return groups.save(updated);
        });
    }

    private Group activate(Group group, Instant now) {
        List<String> order = group.getPayoutOrder().isEmpty() ? group.getMembers() : group.getPayoutOrder();
        Group.GroupBuilder b = group.toBuilder()
                .status(GroupStatus.ACTIVE)
                .members(List.copyOf(order))
                .currentCycle(1)
                .cycleStartTime(now)
                .activatedAt(now);
        if (group.getConfig().model() == GroupModel.FIXED_SAVINGS) {
            b.maturityTime(now.plus(group.getConfig().lockDuration()));
        }
        log.info("Group {} activated with {} members", group.getId(), order.size());
        return b.build();
    }

    // ------------------------------------------------------------------ contributions

    public Contribution contribute(long groupId, String caller) {
        String who = Addresses.normalize(caller);
        return inGroup(groupId, () -> {
            Group group = group(groupId);
            requireStatus(group, GroupStatus.ACTIVE);
            Member member = activeMember(groupId, who);
            Instant now = clock.instant();
            if (group.isMatured(now)) {
                throw new PreconditionFailedException("Group " + groupId + " has matured");
            }
            if (now.isBefore(group.getCycleStartTime()) || now.isAfter(group.contributionDeadline())) {
                throw new PreconditionFailedException("Contribution window for cycle "
                        + group.getCurrentCycle() + " is closed");
            }
            if (contributions.exists(groupId, group.getCurrentCycle(), who)) {
                throw new PreconditionFailedException(who + " already contributed in cycle " + group.getCurrentCycle());
            }

            GroupConfig config = group.getConfig();
            GroupGrant grant = grant(groupId);
            long premium = Bps.of(config.contributionAmount(), config.effectiveInsuranceBps());
            long net = config.contributionAmount() - premium;
            if (premium > 0) {
                insuranceLedger.depositPremium(grant, who, premium);
            }
            if (net > 0) {
                escrowLedger.deposit(grant, who, net);
            }
            Contribution c = contributions.insert(new Contribution(groupId, group.getCurrentCycle(), who, net,
                    premium, now, ContributionStatus.PAID));
            int trust = stakeLedger.rewardTrust(grant, who);
            members.save(member.toBuilder()
                    .totalContributed(member.getTotalContributed() + net)
                    .trustScore(trust)
                    .build());
            log.debug("{} contributed {} (premium {}) to group {} cycle {}", who, net, premium, groupId,
                    group.getCurrentCycle());
            resolveIfSettled(group);
            return c;
        });
    }

    /**
     * Settles a missed contribution once the window has closed: the stake is slashed into escrow and
     * any shortfall is paid by the insurance pool when the group is insured and the pool can cover it.
     */
    public Contribution enforceMissedPayment(long groupId, String target) {
        String who = Addresses.normalize(target);
        return inGroup(groupId, () -> {
            Group group = group(groupId);
            requireStatus(group, GroupStatus.ACTIVE);
            Instant now = clock.instant();
            if (group.isMatured(now)) {
                throw new PreconditionFailedException("Group " + groupId + " has matured");
            }
            Member member = members.find(groupId, who)
                    .orElseThrow(() -> new NotFoundException(who + " is not a member of group " + groupId));
            if (!member.isActive()) {
                throw new PreconditionFailedException(who + " is no longer active in group " + groupId);
            }
            int cycle = group.getCurrentCycle();
            if (contributions.exists(groupId, cycle, who)) {
                throw new PreconditionFailedException(who + " already settled cycle " + cycle);
            }
            if (!now.isAfter(group.contributionDeadline())) {
                throw new PreconditionFailedException("Contribution window for cycle " + cycle + " is still open");
            }

            GroupConfig config = group.getConfig();
            GroupGrant grant = grant(groupId);
            long due = config.contributionAmount();
            long slashed = stakeLedger.slashStake(grant, who, due, EscrowLedger.VAULT_ACCOUNT);
            if (slashed > 0) {
                escrowLedger.creditTransferred(grant, slashed);
            }
            long shortfall = due - slashed;
            long covered = 0;
            if (shortfall > 0 && config.insuranceEnabled()
                    && insuranceLedger.coverShortfall(grant, shortfall, EscrowLedger.VAULT_ACCOUNT)) {
                escrowLedger.creditTransferred(grant, shortfall);
                covered = shortfall;
            }
            ContributionStatus status = covered > 0 ? ContributionStatus.COVERED_BY_INSURANCE : ContributionStatus.DEFAULTED;
            Contribution c = contributions.insert(new Contribution(groupId, cycle, who, slashed + covered, 0, now, status));
            members.save(member.toBuilder()
                    .totalContributed(member.getTotalContributed() + slashed + covered)
                    .stakeAmount(member.getStakeAmount() - slashed)
                    .trustScore(stakeLedger.trustScore(who))
                    .build());
            log.info("Missed payment of {} in group {} cycle {}: slashed {}, covered {} ({})",
                    who, groupId, cycle, slashed, covered, status);
            resolveIfSettled(group);
            return c;
        });
    }

    private void resolveIfSettled(Group group) {
        int cycle = group.getCurrentCycle();
        for (Member m : members.findByGroup(group.getId())) {
            if (m.isActive() && !contributions.exists(group.getId(), cycle, m.getAddress())) {
                return;
            }
        }
        switch (group.getConfig().model()) {
            case ROTATIONAL -> resolveRotation(group);
            case FIXED_SAVINGS -> groups.save(nextCycle(group));
            case EMERGENCY_LIQUIDITY -> {
                if (cycle >= group.getConfig().groupSize()) {
                    settleResidual(group);
                    complete(group);
                } else {
                    groups.save(nextCycle(group));
                }
            }
        }
    }

    private void resolveRotation(Group group) {
        long groupId = group.getId();
        int cycle = group.getCurrentCycle();
        long gross = 0;
        for (Contribution c : contributions.findByGroupAndCycle(groupId, cycle)) {
            gross += c.amount();
        }
        String recipient = group.getMembers().get(group.getNextPayoutIndex());
        Instant now = clock.instant();
        if (gross > 0) {
            long fee = Bps.of(gross, group.getConfig().platformFeeBps());
            escrowLedger.accruePayout(grant(groupId), recipient, gross, fee, policy.treasury());
            payouts.insert(new Payout(groupId, cycle, recipient, gross - fee, fee, false, now, null));
            log.info("Cycle {} of group {} pays {} to {} (fee {})", cycle, groupId, gross - fee, recipient, fee);
        }
        Group advanced = group.toBuilder().nextPayoutIndex(group.getNextPayoutIndex() + 1).build();
        if (advanced.getNextPayoutIndex() >= advanced.getMembers().size()) {
            complete(advanced);
        } else {
            groups.save(nextCycle(advanced));
        }
    }

    private Group nextCycle(Group group) {
        return group.toBuilder()
                .currentCycle(group.getCurrentCycle() + 1)
                .cycleStartTime(clock.instant())
                .build();
    }

    private void complete(Group group) {
        GroupGrant grant = grant(group.getId());
        for (Member m : members.findByGroup(group.getId())) {
            stakeLedger.releaseStake(grant, m.getAddress());
            members.save(m.toBuilder().stakeAmount(0).build());
        }
        escrowLedger.releaseCreatorFees(grant, group.getCreator());
        groups.save(group.toBuilder().status(GroupStatus.COMPLETED).closedAt(clock.instant()).build());
        log.info("Group {} completed after cycle {}", group.getId(), group.getCurrentCycle());
    }

    // ------------------------------------------------------------------ payouts and withdrawals

    /** Pays the caller everything credited to them by past rotations. Allowed in any status. */
    public long claimPayout(long groupId, String caller) {
        String who = Addresses.normalize(caller);
        return inGroup(groupId, () -> {
            group(groupId);
            Member member = member(groupId, who);
            long amount = escrowLedger.claimPayout(grant(groupId), who);
            Instant now = clock.instant();
            for (Payout p : payouts.findPending(groupId, who)) {
                payouts.save(p.markExecuted(now));
            }
            members.save(member.toBuilder().totalReceived(member.getTotalReceived() + amount).build());
            log.info("{} claimed {} from group {}", who, amount, groupId);
            return amount;
        });
    }

    /** Fixed savings after maturity: contributed principal plus a pro-rata slice of the yield reserve. */
    public Member withdrawMatured(long groupId, String caller) {
        String who = Addresses.normalize(caller);
        return inGroup(groupId, () -> {
            Group group = group(groupId);
            requireModel(group, GroupModel.FIXED_SAVINGS);
            requireStatus(group, GroupStatus.ACTIVE);
            if (!group.isMatured(clock.instant())) {
                throw new PreconditionFailedException("Group " + groupId + " matures at " + group.getMaturityTime());
            }
            Member member = member(groupId, who);
            if (member.isWithdrawn()) {
                throw new PreconditionFailedException(who + " already withdrew");
            }
            long eligible = 0;
            for (Member m : members.findByGroup(groupId)) {
                if (!m.isWithdrawn()) {
                    eligible += m.getTotalContributed();
                }
            }
            GroupGrant grant = grant(groupId);
            long principal = member.getTotalContributed();
            long yieldShare = Bps.prorate(escrowLedger.balance(groupId).yieldReserve(), principal, eligible);
            if (principal > 0) {
                escrowLedger.withdraw(grant, who, principal);
            }
            if (yieldShare > 0) {
                escrowLedger.withdrawYield(grant, who, yieldShare);
            }
            stakeLedger.releaseStake(grant, who);
            Member saved = members.save(member.toBuilder()
                    .totalReceived(member.getTotalReceived() + principal + yieldShare)
                    .yieldReceived(member.getYieldReceived() + yieldShare)
                    .stakeAmount(0)
                    .withdrawn(true)
                    .active(false)
                    .build());
            log.info("{} withdrew {} + {} yield from matured group {}", who, principal, yieldShare, groupId);
            if (members.findByGroup(groupId).stream().allMatch(Member::isWithdrawn)) {
                complete(group);
            }
            return saved;
        });
    }

    /** Fixed savings before maturity: contributed principal minus the early-withdrawal penalty. */
    public Member earlyWithdraw(long groupId, String caller) {
        String who = Addresses.normalize(caller);
        return inGroup(groupId, () -> {
            Group group = group(groupId);
            requireModel(group, GroupModel.FIXED_SAVINGS);
            if (group.getStatus() != GroupStatus.ACTIVE && group.getStatus() != GroupStatus.PAUSED) {
                throw new PreconditionFailedException("Group " + groupId + " is " + group.getStatus());
            }
            if (group.isMatured(clock.instant())) {
                throw new PreconditionFailedException("Group " + groupId + " has matured; use withdrawMatured");
            }
            Member member = member(groupId, who);
            if (member.isWithdrawn()) {
                throw new PreconditionFailedException(who + " already withdrew");
            }
            GroupGrant grant = grant(groupId);
            long contributed = member.getTotalContributed();
            long penalty = Bps.of(contributed, group.getConfig().earlyWithdrawalPenaltyBps());
            long payout = contributed - penalty;
            if (penalty > 0) {
                escrowLedger.forfeitToInsurance(grant, penalty);
            }
            if (payout > 0) {
                escrowLedger.withdraw(grant, who, payout);
            }
            stakeLedger.releaseStake(grant, who);
            Member saved = members.save(member.toBuilder()
                    .totalReceived(member.getTotalReceived() + payout)
                    .stakeAmount(0)
                    .withdrawn(true)
                    .active(false)
                    .build());
            log.info("{} left group {} early: paid {}, penalty {}", who, groupId, payout, penalty);

            if (members.findByGroup(groupId).stream().noneMatch(Member::isActive)) {
                complete(group);
            } else if (group.getStatus() == GroupStatus.ACTIVE) {
                resolveIfSettled(group);
            }
            return saved;
        });
    }

    // ------------------------------------------------------------------ administration

    public Group pause(long groupId, String caller) {
        String who = Addresses.normalize(caller);
        return inGroup(groupId, () -> {
            Group group = group(groupId);
            requireCreatorOrAdmin(group, who);
            requireStatus(group, GroupStatus.ACTIVE);
            log.info("Group {} paused by {}", groupId, who);
            return groups.save(group.toBuilder().status(GroupStatus.PAUSED).build());
        });
    }

    /** Reopens a paused group; the current cycle's window restarts now. */
    public Group resume(long groupId, String caller) {
        String who = Addresses.normalize(caller);
        return inGroup(groupId, () -> {
            Group group = group(groupId);
            requireCreatorOrAdmin(group, who);
            requireStatus(group, GroupStatus.PAUSED);
            log.info("Group {} resumed by {}", groupId, who);
            Group resumed = groups.save(group.toBuilder()
                    .status(GroupStatus.ACTIVE)
                    .cycleStartTime(clock.instant())
                    .build());
            // members may have left while paused, settling the cycle
            resolveIfSettled(resumed);
            return group(groupId);
        });
    }

    /**
     * Irreversibly cancels a group. Stakes are returned and the remaining principal and yield
     * reserve are refunded pro rata to what each member has not yet got back. Pending rotational
     * payouts stay claimable.
     */
    public Group cancel(long groupId, String caller) {
        String who = Addresses.normalize(caller);
        return inGroup(groupId, () -> {
            Group group = group(groupId);
            if (!group.getCreator().equals(who)) {
                throw new UnauthorizedException("Only the creator may cancel group " + groupId);
            }
            if (group.getStatus().isTerminal()) {
                throw new PreconditionFailedException("Group " + groupId + " is already " + group.getStatus());
            }
            settleResidual(group);
            GroupGrant grant = grant(groupId);
            // a cancelled group forfeits the creator's fee share
            escrowLedger.releaseCreatorFees(grant, policy.treasury());
            for (Member m : members.findByGroup(groupId)) {
                stakeLedger.releaseStake(grant, m.getAddress());
                members.save(m.toBuilder()
                        .stakeAmount(0)
                        .active(false)
                        .build());
            }
            log.info("Group {} cancelled by {}", groupId, who);
            return groups.save(group.toBuilder().status(GroupStatus.CANCELLED).closedAt(clock.instant()).build());
        });
    }

    private void settleResidual(Group group) {
        long groupId = group.getId();
        EscrowBalance balance = escrowLedger.balance(groupId);
        Map<String, Long> weights = new LinkedHashMap<>();
        long totalWeight = 0;
        for (Member m : members.findByGroup(groupId)) {
            long unrecovered = m.isWithdrawn() ? 0
                    : m.getTotalContributed() - m.principalReceived() - escrowLedger.pendingFor(groupId, m.getAddress());
            if (unrecovered > 0) {
                weights.put(m.getAddress(), unrecovered);
                totalWeight += unrecovered;
            }
        }
        if (totalWeight == 0) {
            return;
        }
        GroupGrant grant = grant(groupId);
        long principalLeft = balance.principal();
        long yieldLeft = balance.yieldReserve();
        int remaining = weights.size();
        for (Map.Entry<String, Long> e : weights.entrySet()) {
            remaining--;
            long principal = remaining == 0 ? principalLeft
                    : Bps.prorate(balance.principal(), e.getValue(), totalWeight);
            long yield = remaining == 0 ? yieldLeft
                    : Bps.prorate(balance.yieldReserve(), e.getValue(), totalWeight);
            principalLeft -= principal;
            yieldLeft -= yield;
            if (principal > 0) {
                escrowLedger.withdraw(grant, e.getKey(), principal);
            }
            if (yield > 0) {
                escrowLedger.withdrawYield(grant, e.getKey(), yield);
            }
            Member m = member(groupId, e.getKey());
            members.save(m.toBuilder()
                    .totalReceived(m.getTotalReceived() + principal + yield)
                    .yieldReceived(m.getYieldReceived() + yield)
                    .build());
            log.debug("Refunded {} + {} yield to {} from group {}", principal, yield, e.getKey(), groupId);
        }
    }

    /** Emergency and hardship claims go through the group so that only its active members can file. */
    public InsuranceClaim submitClaim(long groupId, String caller, long amount, String evidenceReference) {
        String who = Addresses.normalize(caller);
        return inGroup(groupId, () -> {
            Group group = group(groupId);
            if (group.getStatus().isTerminal()) {
                throw new PreconditionFailedException("Group " + groupId + " is " + group.getStatus());
            }
            activeMember(groupId, who);
            return insuranceLedger.submitClaim(grant(groupId), who, amount, evidenceReference);
        });
    }

    // ------------------------------------------------------------------ queries

    public Group getGroup(long groupId) {
        return transactions.read(() -> group(groupId));
    }

    public List<Member> getMembers(long groupId) {
        return transactions.read(() -> {
            group(groupId);
            return members.findByGroup(groupId);
        });
    }

    public Member getMember(long groupId, String address) {
        String who = Addresses.normalize(address);
        return transactions.read(() -> member(groupId, who));
    }

    /** All contributions of the group, or of one cycle when {@code cycle} is given. */
    public List<Contribution> getContributions(long groupId, Integer cycle) {
        return transactions.read(() -> {
            group(groupId);
            return cycle == null ? contributions.findByGroup(groupId) : contributions.findByGroupAndCycle(groupId, cycle);
        });
    }

    public List<Payout> getPayouts(long groupId) {
        return transactions.read(() -> {
            group(groupId);
            return payouts.findByGroup(groupId);
        });
    }

    /** Active members who let the current cycle's window close without paying. */
    public List<String> overdueMembers(long groupId) {
        return transactions.read(() -> {
            Group group = group(groupId);
            List<String> overdue = new ArrayList<>();
            if (group.getStatus() != GroupStatus.ACTIVE || !clock.instant().isAfter(group.contributionDeadline())) {
                return overdue;
            }
            for (Member m : members.findByGroup(groupId)) {
                if (m.isActive() && !contributions.exists(groupId, group.getCurrentCycle(), m.getAddress())) {
                    overdue.add(m.getAddress());
                }
            }
            return overdue;
        });
    }

    public Reconciliation reconcile(long groupId) {
        return transactions.read(() -> {
            group(groupId);
            long contributed = 0, returned = 0;
            for (Member m : members.findByGroup(groupId)) {
                contributed += m.getTotalContributed();
                returned += m.principalReceived();
            }
            EscrowBalance b = escrowLedger.balance(groupId);
            return new Reconciliation(groupId, contributed, returned, b.feesPaid(), b.penaltiesForfeited(),
                    b.principal(), b.pendingPayouts());
        });
    }

    // ------------------------------------------------------------------ helpers

    private <T> T inGroup(long groupId, Supplier<T> work) {
        return transactions.execute("group:" + groupId, work);
    }

    private Group group(long groupId) {
        return groups.findById(groupId).orElseThrow(() -> new NotFoundException("Group not found: " + groupId));
    }

    private GroupGrant grant(long groupId) {
        return grants.get(groupId).orElseThrow(() -> new NotFoundException("Group not found: " + groupId));
    }

    private Member member(long groupId, String address) {
        return members.find(groupId, address)
                .orElseThrow(() -> new UnauthorizedException(address + " is not a member of group " + groupId));
    }

    private Member activeMember(long groupId, String address) {
        Member m = member(groupId, address);
        if (!m.isActive()) {
            throw new PreconditionFailedException(address + " is no longer active in group " + groupId);
        }
        return m;
    }

    private static void requireStatus(Group group, GroupStatus expected) {
        if (group.getStatus() != expected) {
            throw new PreconditionFailedException("Group " + group.getId() + " is " + group.getStatus()
                    + ", expected " + expected);
        }
    }

    private static void requireModel(Group group, GroupModel expected) {
        if (group.getConfig().model() != expected) {
            throw new PreconditionFailedException("Only " + expected + " groups support this operation");
        }
    }

    private void requireCreatorOrAdmin(Group group, String caller) {
        if (!group.getCreator().equals(caller) && !policy.isAdmin(caller)) {
            throw new UnauthorizedException(caller + " may not manage group " + group.getId());
        }
    }
}
