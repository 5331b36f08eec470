package com.demo.thrift.service;

import com.demo.thrift.exception.InsufficientBalanceException;
import com.demo.thrift.exception.InvalidInputException;
import com.demo.thrift.exception.PreconditionFailedException;
import com.demo.thrift.exception.UnauthorizedException;
import com.demo.thrift.model.Reputation;
import com.demo.thrift.model.StakeRecord;
import com.demo.thrift.repository.ReputationRepository;
import com.demo.thrift.repository.StakeRepository;
import com.demo.thrift.service.dto.StakeInfo;
import com.demo.thrift.service.support.Addresses;
import com.demo.thrift.service.support.Bps;
import com.demo.thrift.tx.LedgerTransactions;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Collateral per (group, member) plus the platform-wide trust score and blacklist of each address.
 *
 * <p>Staked funds sit in {@link #VAULT_ACCOUNT}. A slash moves the penalty straight to the
 * beneficiary named by the group (its escrow vault). Trust scores stay within
 * {@code [0, maxTrust]}; the blacklist is sticky until an admin whitelists the address.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StakeLedger {

    public static final String VAULT_ACCOUNT = "thrift:stake-vault";

    private final LedgerTransactions transactions;
    private final LedgerAccess access;
    private final StakeRepository stakes;
    private final ReputationRepository reputations;
    private final ValueTransfer valueTransfer;
    private final ProtocolPolicy policy;

    public void depositStake(GroupGrant grant, String member, long amount) {
        transactions.run(scope(grant), () -> {
            access.verify(grant);
            if (amount <= 0) {
                throw new InvalidInputException("stake amount must be positive");
            }
            if (isBlacklisted(grant.groupId(), member)) {
                throw new PreconditionFailedException(member + " is blacklisted");
            }
            if (!valueTransfer.transferFrom(member, VAULT_ACCOUNT, amount)) {
                throw new InsufficientBalanceException(member + " cannot cover a stake of " + amount);
            }
            StakeRecord current = record(grant.groupId(), member);
            stakes.save(current.toBuilder().amount(current.amount() + amount).build());
        });
    }

    public void withdrawStake(GroupGrant grant, String member, long amount) {
        transactions.run(scope(grant), () -> {
            access.verify(grant);
            if (amount <= 0) {
                throw new InvalidInputException("withdrawal amount must be positive");
            }
            payBack(grant.groupId(), member, amount);
        });
    }

    /** Returns whatever stake the member still has in the group; zero is a no-op. */
    public long releaseStake(GroupGrant grant, String member) {
        return transactions.execute(scope(grant), () -> {
            access.verify(grant);
            long amount = record(grant.groupId(), member).amount();
            if (amount > 0) {
                payBack(grant.groupId(), member, amount);
                log.debug("Released stake {} of {} in group {}", amount, member, grant.groupId());
            }
            return amount;
        });
    }

    /**
     * Penalises a missed payment: {@code min(stake * penaltyBps, missed, stake)} goes to
     * {@code beneficiary}. The default is counted and trust drops even when nothing is left to take.
     */
    public long slashStake(GroupGrant grant, String member, long missedAmount, String beneficiary) {
        return transactions.execute(scope(grant), () -> {
            access.verify(grant);
            if (missedAmount <= 0) {
                throw new InvalidInputException("missed amount must be positive");
            }
            StakeRecord current = record(grant.groupId(), member);
            long slashed = Math.min(Math.min(Bps.of(current.amount(), policy.stakePenaltyBps()), missedAmount),
                    current.amount());
            int defaults = current.defaultCount() + 1;
            boolean blacklist = current.blacklisted() || defaults >= policy.blacklistThreshold();
            stakes.save(current.toBuilder()
                    .amount(current.amount() - slashed)
                    .defaultCount(defaults)
                    .blacklisted(blacklist)
                    .build());

            Reputation rep = reputationOf(member);
            reputations.save(rep.toBuilder()
                    .trustScore(policy.clampTrust((long) rep.trustScore() - policy.trustPenalty()))
                    .totalDefaults(rep.totalDefaults() + 1)
                    .blacklisted(rep.blacklisted() || blacklist)
                    .build());

            if (slashed > 0 && !valueTransfer.transfer(VAULT_ACCOUNT, beneficiary, slashed)) {
                throw new InsufficientBalanceException("Stake vault cannot pay out " + slashed);
            }
            log.info("Slashed {} from {} in group {} (defaults={})", slashed, member, grant.groupId(), defaults);
            if (blacklist && !current.blacklisted()) {
                log.info("Blacklisted {} after {} defaults", member, defaults);
            }
            return slashed;
        });
    }

    /** On-time contribution; returns the new trust score. */
    public int rewardTrust(GroupGrant grant, String member) {
        return transactions.execute(scope(grant), () -> {
            access.verify(grant);
            Reputation rep = reputationOf(member);
            int next = policy.clampTrust((long) rep.trustScore() + policy.trustReward());
            reputations.save(rep.toBuilder().trustScore(next).build());
            return next;
        });
    }

    /** Clears the blacklist of an address everywhere. Default counts and trust are left alone. */
    public void whitelist(String caller, String address) {
        String admin = Addresses.normalize(caller);
        String target = Addresses.normalize(address);
        transactions.run("stake:whitelist", () -> {
            if (!policy.isAdmin(admin)) {
                throw new UnauthorizedException(admin + " is not an admin");
            }
            reputations.save(reputationOf(target).toBuilder().blacklisted(false).build());
            for (StakeRecord s : stakes.findByMember(target)) {
                if (s.blacklisted()) {
                    stakes.save(s.toBuilder().blacklisted(false).build());
                }
            }
            log.info("Whitelisted {} by {}", target, admin);
        });
    }

    public boolean isBlacklisted(long groupId, String member) {
        return reputationOf(member).blacklisted() || record(groupId, member).blacklisted();
    }

    public boolean canStake(String member, long amount) {
        return valueTransfer.balanceOf(member) >= amount;
    }

    public int trustScore(String address) {
        return reputationOf(address).trustScore();
    }

    public Reputation reputationOf(String address) {
        return reputations.find(address).orElseGet(() -> Reputation.builder()
                .address(address)
                .trustScore(policy.initialTrust())
                .build());
    }

    public StakeInfo stakeInfo(long groupId, String address) {
        String member = Addresses.normalize(address);
        return transactions.read(() -> {
            StakeRecord s = record(groupId, member);
            return new StakeInfo(groupId, member, s.amount(), s.defaultCount(),
                    isBlacklisted(groupId, member), trustScore(member));
        });
    }

    private void payBack(long groupId, String member, long amount) {
        StakeRecord current = record(groupId, member);
        if (current.amount() < amount) {
            throw new InsufficientBalanceException(
                    "Stake of " + member + " is " + current.amount() + ", cannot withdraw " + amount);
        }
        stakes.save(current.toBuilder().amount(current.amount() - amount).build());
        if (!valueTransfer.transfer(VAULT_ACCOUNT, member, amount)) {
            throw new InsufficientBalanceException("Stake vault cannot pay out " + amount);
        }
    }

    private StakeRecord record(long groupId, String member) {
        return stakes.find(groupId, member).orElseGet(() -> StakeRecord.empty(groupId, member));
    }

    private static String scope(GroupGrant grant) {
        return "stake:" + (grant == null ? "?" : grant.groupId());
    }
}
