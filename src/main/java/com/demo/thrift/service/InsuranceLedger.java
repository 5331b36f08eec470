package com.demo.thrift.service;

import com.demo.thrift.exception.InsufficientBalanceException;
import com.demo.thrift.exception.InvalidInputException;
import com.demo.thrift.exception.NotFoundException;
import com.demo.thrift.exception.PreconditionFailedException;
import com.demo.thrift.exception.UnauthorizedException;
import com.demo.thrift.model.ClaimStatus;
import com.demo.thrift.model.InsuranceClaim;
import com.demo.thrift.model.InsurancePool;
import com.demo.thrift.repository.ClaimRepository;
import com.demo.thrift.repository.InsurancePoolRepository;
import com.demo.thrift.service.dto.PoolHealth;
import com.demo.thrift.service.support.Addresses;
import com.demo.thrift.service.support.Bps;
import com.demo.thrift.service.support.ClaimIds;
import com.demo.thrift.tx.JournaledCell;
import com.demo.thrift.tx.LedgerTransactions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Premium pools and the claim workflow.
 *
 * <p>Each premium is split: {@code minReserveBps} goes to the group's reserve fund, the rest to its
 * claimable balance. Claims and missed-payment cover are paid from the claimable balance only, so
 * the total paid out of a pool never exceeds the premiums it collected.
 */
@Slf4j
@Service
public class InsuranceLedger {

    public static final String POOL_ACCOUNT = "thrift:insurance-pool";

    private final LedgerTransactions transactions;
    private final LedgerAccess access;
    private final InsurancePoolRepository pools;
    private final ClaimRepository claims;
    private final ValueTransfer valueTransfer;
    private final ProtocolPolicy policy;
    private final Clock clock;
    private final JournaledCell<Long> claimSequence;

    public InsuranceLedger(LedgerTransactions transactions, LedgerAccess access, InsurancePoolRepository pools,
                           ClaimRepository claims, ValueTransfer valueTransfer, ProtocolPolicy policy, Clock clock) {
        this.transactions = transactions;
        this.access = access;
        this.pools = pools;
        this.claims = claims;
        this.valueTransfer = valueTransfer;
        this.policy = policy;
        this.clock = clock;
        this.claimSequence = new JournaledCell<>(transactions, 0L);
    }

    public void openPool(GroupGrant grant, boolean emergencyMode) {
        transactions.run(scope(grant), () -> {
            access.verify(grant);
            if (pools.find(grant.groupId()).isPresent()) {
                throw new PreconditionFailedException("Insurance pool already open for group " + grant.groupId());
            }
            pools.save(InsurancePool.builder().groupId(grant.groupId()).emergencyMode(emergencyMode).build());
        });
    }

    /** Pulls {@code amount} from {@code payer} into the pool. */
    public void depositPremium(GroupGrant grant, String payer, long amount) {
        transactions.run(scope(grant), () -> {
            access.verify(grant);
            if (amount <= 0) {
                throw new InvalidInputException("premium must be positive");
            }
            InsurancePool pool = pool(grant.groupId());
            if (!valueTransfer.transferFrom(payer, POOL_ACCOUNT, amount)) {
                throw new InsufficientBalanceException(payer + " cannot cover a premium of " + amount);
            }
            long reserve = Bps.of(amount, policy.minReserveBps());
            pools.save(pool.toBuilder()
                    .groupBalance(pool.groupBalance() + amount - reserve)
                    .reserveFund(pool.reserveFund() + reserve)
                    .totalPremiums(pool.totalPremiums() + amount)
                    .build());
        });
    }

    /**
     * Pays a missed contribution's shortfall to {@code beneficiary} if the claimable balance covers
     * all of it. Returns {@code false}, changing nothing, otherwise.
     */
    public boolean coverShortfall(GroupGrant grant, long amount, String beneficiary) {
        return transactions.execute(scope(grant), () -> {
            access.verify(grant);
            if (amount <= 0) {
                throw new InvalidInputException("shortfall must be positive");
            }
            InsurancePool pool = pool(grant.groupId());
            if (pool.groupBalance() < amount) {
                log.info("Insurance pool of group {} cannot cover shortfall {} (balance {})",
                        grant.groupId(), amount, pool.groupBalance());
                return false;
            }
            pools.save(pool.toBuilder()
                    .groupBalance(pool.groupBalance() - amount)
                    .totalClaimsPaid(pool.totalClaimsPaid() + amount)
                    .totalShortfallCovered(pool.totalShortfallCovered() + amount)
                    .build());
            pay(beneficiary, amount);
            log.info("Insurance covered shortfall {} in group {}", amount, grant.groupId());
            return true;
        });
    }

    public InsuranceClaim submitClaim(GroupGrant grant, String claimant, long amount, String evidenceReference) {
        return transactions.execute(scope(grant), () -> {
            access.verify(grant);
            if (amount <= 0) {
                throw new InvalidInputException("claim amount must be positive");
            }
            if (evidenceReference == null || evidenceReference.isBlank()) {
                throw new InvalidInputException("evidenceReference is required");
            }
            InsurancePool pool = pool(grant.groupId());
            long claimed = claimedBy(grant.groupId(), claimant);
            if (claimed + amount > policy.claimCap()) {
                throw new PreconditionFailedException("Claim exceeds the cap of " + policy.claimCap()
                        + " per member (already claimed " + claimed + ")");
            }
            if (pool.emergencyMode() && amount > policy.emergencyCap()) {
                throw new PreconditionFailedException("Claim exceeds the emergency cap of " + policy.emergencyCap());
            }
            Instant now = clock.instant();
            claims.findLatest(grant.groupId(), claimant).ifPresent(last -> {
                if (now.isBefore(last.getSubmittedAt().plus(policy.claimCooldown()))) {
                    throw new PreconditionFailedException("Claim cooldown active until "
                            + last.getSubmittedAt().plus(policy.claimCooldown()));
                }
            });
            long sequence = claimSequence.get() + 1;
            claimSequence.set(sequence);
            InsuranceClaim claim = InsuranceClaim.builder()
                    .id(ClaimIds.claimId(claimant, grant.groupId(), amount, evidenceReference, sequence))
                    .claimant(claimant)
                    .groupId(grant.groupId())
                    .amount(amount)
                    .evidenceReference(evidenceReference)
                    .status(ClaimStatus.SUBMITTED)
                    .submittedAt(now)
                    .build();
            claims.save(claim);
            log.info("Claim {} submitted by {} in group {} for {}", claim.getId(), claimant, grant.groupId(), amount);
            return claim;
        });
    }

    /** Total of the member's claims in the group that were not rejected. */
    private long claimedBy(long groupId, String claimant) {
        long total = 0;
        for (InsuranceClaim c : claims.findByClaimant(claimant)) {
            if (c.getGroupId() == groupId && c.getStatus() != ClaimStatus.REJECTED) {
                total += c.getAmount();
            }
        }
        return total;
    }

    /**
     * Records one processor's vote. {@code approvedAmount}, when given, lowers the claim amount.
     * The vote that reaches the approval threshold moves the claim to APPROVED.
     */
    public InsuranceClaim approveClaim(String caller, String claimId, Long approvedAmount) {
        String approver = Addresses.normalize(caller);
        InsuranceClaim claim = claim(claimId);
        return transactions.execute(claimScope(claim), () -> {
            InsuranceClaim current = claim(claimId);
            requireProcessor(approver);
            if (current.getStatus() != ClaimStatus.SUBMITTED) {
                throw new PreconditionFailedException("Claim is " + current.getStatus());
            }
            if (current.hasApproved(approver)) {
                throw new PreconditionFailedException(approver + " already approved this claim");
            }
            long amount = current.getAmount();
            if (approvedAmount != null) {
                if (approvedAmount <= 0 || approvedAmount > amount) {
                    throw new InvalidInputException("approvedAmount must be within 1.." + amount);
                }
                amount = approvedAmount;
            }
            Set<String> approvals = new HashSet<>(current.getApprovals());
            approvals.add(approver);
            InsuranceClaim.InsuranceClaimBuilder next = current.toBuilder()
                    .amount(amount)
                    .approvals(Set.copyOf(approvals));
            if (approvals.size() >= policy.approvalThreshold()) {
                next.status(ClaimStatus.APPROVED).processedAt(clock.instant());
                log.info("Claim {} approved for {}", claimId, amount);
            }
            return claims.save(next.build());
        });
    }

    public InsuranceClaim rejectClaim(String caller, String claimId, String reason) {
        String processor = Addresses.normalize(caller);
        InsuranceClaim claim = claim(claimId);
        return transactions.execute(claimScope(claim), () -> {
            InsuranceClaim current = claim(claimId);
            requireProcessor(processor);
            if (current.getStatus() != ClaimStatus.SUBMITTED && current.getStatus() != ClaimStatus.APPROVED) {
                throw new PreconditionFailedException("Claim is " + current.getStatus());
            }
            log.info("Claim {} rejected by {}", claimId, processor);
            return claims.save(current.toBuilder()
                    .status(ClaimStatus.REJECTED)
                    .rejectionReason(reason)
                    .processedAt(clock.instant())
                    .build());
        });
    }

    /** Pays an approved claim to its claimant. Callable by a processor or by the claimant. */
    public InsuranceClaim executeClaimPayout(String caller, String claimId) {
        String who = Addresses.normalize(caller);
        InsuranceClaim claim = claim(claimId);
        return transactions.execute(claimScope(claim), () -> {
            InsuranceClaim current = claim(claimId);
            if (!who.equals(current.getClaimant()) && !policy.isClaimProcessor(who)) {
                throw new UnauthorizedException(who + " may not execute this claim");
            }
            if (current.getStatus() != ClaimStatus.APPROVED) {
                throw new PreconditionFailedException("Claim is " + current.getStatus());
            }
            InsurancePool pool = pool(current.getGroupId());
            if (pool.groupBalance() < current.getAmount()) {
                throw new InsufficientBalanceException("Pool balance " + pool.groupBalance()
                        + " cannot cover claim of " + current.getAmount());
            }
            pools.save(pool.toBuilder()
                    .groupBalance(pool.groupBalance() - current.getAmount())
                    .totalClaimsPaid(pool.totalClaimsPaid() + current.getAmount())
                    .build());
            pay(current.getClaimant(), current.getAmount());
            log.info("Claim {} paid {} to {}", claimId, current.getAmount(), current.getClaimant());
            return claims.save(current.toBuilder().status(ClaimStatus.PAID).processedAt(clock.instant()).build());
        });
    }

    /** Admin-only withdrawal from the non-claimable reserve fund. */
    public InsurancePool withdrawReserve(String caller, long groupId, String recipient, long amount) {
        String admin = Addresses.normalize(caller);
        String to = Addresses.normalize(recipient);
        return transactions.execute("insurance:" + groupId, () -> {
            if (!policy.isAdmin(admin)) {
                throw new UnauthorizedException(admin + " is not an admin");
            }
            if (amount <= 0) {
                throw new InvalidInputException("amount must be positive");
            }
            InsurancePool pool = pool(groupId);
            if (pool.reserveFund() < amount) {
                throw new InsufficientBalanceException("Reserve fund is " + pool.reserveFund());
            }
            InsurancePool saved = pools.save(pool.toBuilder().reserveFund(pool.reserveFund() - amount).build());
            pay(to, amount);
            log.warn("Reserve withdrawal of {} from group {} to {} by {}", amount, groupId, to, admin);
            return saved;
        });
    }

    public InsurancePool pool(long groupId) {
        return pools.find(groupId)
                .orElseThrow(() -> new NotFoundException("No insurance pool for group " + groupId));
    }

    public InsuranceClaim claim(String claimId) {
        return claims.findById(claimId)
                .orElseThrow(() -> new NotFoundException("Claim not found: " + claimId));
    }

    public List<InsuranceClaim> claimsByMember(String member) {
        String address = Addresses.normalize(member);
        return transactions.read(() -> claims.findByClaimant(address));
    }

    public List<InsuranceClaim> claimsByGroup(long groupId) {
        return transactions.read(() -> claims.findByGroup(groupId));
    }

    public PoolHealth health(long groupId) {
        return transactions.read(() -> {
            InsurancePool p = pool(groupId);
            return new PoolHealth(groupId, p.groupBalance(), p.reserveFund(), p.totalPremiums(),
                    p.totalClaimsPaid(), Bps.ratio(p.totalClaimsPaid(), p.totalPremiums()));
        });
    }

    /** Totals across every group. */
    public PoolHealth health() {
        return transactions.read(() -> {
            long balance = 0, reserve = 0, premiums = 0, paid = 0;
            for (InsurancePool p : pools.findAll()) {
                balance += p.groupBalance();
                reserve += p.reserveFund();
                premiums += p.totalPremiums();
                paid += p.totalClaimsPaid();
            }
            return new PoolHealth(null, balance, reserve, premiums, paid, Bps.ratio(paid, premiums));
        });
    }

    private void requireProcessor(String address) {
        if (!policy.isClaimProcessor(address)) {
            throw new UnauthorizedException(address + " is not a claim processor");
        }
    }

    private void pay(String to, long amount) {
        if (!valueTransfer.transfer(POOL_ACCOUNT, to, amount)) {
            throw new InsufficientBalanceException("Insurance account cannot pay out " + amount);
        }
    }

    private static String claimScope(InsuranceClaim claim) {
        return "insurance:" + claim.getGroupId();
    }

    private static String scope(GroupGrant grant) {
        return "insurance:" + (grant == null ? "?" : grant.groupId());
    }
}
