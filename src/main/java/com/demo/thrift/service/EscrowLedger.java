package com.demo.thrift.service;

import com.demo.thrift.exception.InsufficientBalanceException;
import com.demo.thrift.exception.InvalidInputException;
import com.demo.thrift.exception.NotFoundException;
import com.demo.thrift.exception.PreconditionFailedException;
import com.demo.thrift.model.EscrowBalance;
import com.demo.thrift.repository.EscrowBalanceRepository;
import com.demo.thrift.service.dto.VaultStats;
import com.demo.thrift.service.support.Bps;
import com.demo.thrift.tx.JournaledMap;
import com.demo.thrift.tx.LedgerTransactions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.TreeMap;

/**
 * Per-group principal, yield reserve and pending payouts, all held in one vault account.
 *
 * <p>After every inflow the vault keeps {@code liquidityBufferBps} of its total assets on hand and
 * deploys the rest to the {@link YieldAdapter}. Outflows larger than what is on hand pull the
 * difference back from the adapter first.
 */
@Slf4j
@Service
public class EscrowLedger {

    public static final String VAULT_ACCOUNT = "thrift:escrow-vault";

    private final LedgerTransactions transactions;
    private final LedgerAccess access;
    private final EscrowBalanceRepository balances;
    private final ValueTransfer valueTransfer;
    private final YieldAdapter yieldAdapter;
    private final InsuranceLedger insurance;
    private final ProtocolPolicy policy;
    private final JournaledMap<Long, GroupGrant> openGroups;

    public EscrowLedger(LedgerTransactions transactions, LedgerAccess access, EscrowBalanceRepository balances,
                        ValueTransfer valueTransfer, YieldAdapter yieldAdapter, InsuranceLedger insurance,
                        ProtocolPolicy policy) {
        this.transactions = transactions;
        this.access = access;
        this.balances = balances;
        this.valueTransfer = valueTransfer;
        this.yieldAdapter = yieldAdapter;
        this.insurance = insurance;
        this.policy = policy;
        this.openGroups = new JournaledMap<>(transactions);
    }

    public void openGroup(GroupGrant grant) {
        transactions.run(scope(grant), () -> {
            access.verify(grant);
            if (balances.find(grant.groupId()).isPresent()) {
                throw new PreconditionFailedException("Escrow already open for group " + grant.groupId());
            }
            balances.save(EscrowBalance.empty(grant.groupId()));
            openGroups.put(grant.groupId(), grant);
        });
    }

    /** Pulls {@code amount} from {@code payer} into the group's principal. */
    public void deposit(GroupGrant grant, String payer, long amount) {
        transactions.run(scope(grant), () -> {
            access.verify(grant);
            requirePositive(amount);
            EscrowBalance b = balance(grant.groupId());
            if (!valueTransfer.transferFrom(payer, VAULT_ACCOUNT, amount)) {
                throw new InsufficientBalanceException(payer + " cannot cover a deposit of " + amount);
            }
            balances.save(b.toBuilder().principal(b.principal() + amount).build());
            sweep();
        });
    }

    /** Books funds that another ledger already moved into the vault (slashed stake, insurance cover). */
    public void creditTransferred(GroupGrant grant, long amount) {
        transactions.run(scope(grant), () -> {
            access.verify(grant);
            requirePositive(amount);
            EscrowBalance b = balance(grant.groupId());
            balances.save(b.toBuilder().principal(b.principal() + amount).build());
            sweep();
        });
    }

    public void withdraw(GroupGrant grant, String to, long amount) {
        transactions.run(scope(grant), () -> {
            access.verify(grant);
            requirePositive(amount);
            EscrowBalance b = balance(grant.groupId());
            if (b.principal() < amount) {
                throw new InsufficientBalanceException(
                        "Group " + grant.groupId() + " principal is " + b.principal() + ", cannot withdraw " + amount);
            }
            balances.save(b.toBuilder().principal(b.principal() - amount).build());
            payOut(to, amount);
        });
    }

    public void withdrawYield(GroupGrant grant, String to, long amount) {
        transactions.run(scope(grant), () -> {
            access.verify(grant);
            requirePositive(amount);
            EscrowBalance b = balance(grant.groupId());
            if (b.yieldReserve() < amount) {
                throw new InsufficientBalanceException(
                        "Group " + grant.groupId() + " yield reserve is " + b.yieldReserve());
            }
            balances.save(b.toBuilder().yieldReserve(b.yieldReserve() - amount).build());
            payOut(to, amount);
        });
    }

    /**
     * Moves a rotational pot out of principal: {@code fee} goes to {@code treasury} less the
     * creator's {@code creatorFeeShareBps} cut, which stays held for the group; the rest waits in
     * the pending bucket until {@code recipient} claims it.
     */
    public void accruePayout(GroupGrant grant, String recipient, long gross, long fee, String treasury) {
        transactions.run(scope(grant), () -> {
            access.verify(grant);
            requirePositive(gross);
            if (fee < 0 || fee > gross) {
                throw new InvalidInputException("fee must be within 0.." + gross);
            }
            EscrowBalance b = balance(grant.groupId());
            if (b.principal() < gross) {
                throw new InsufficientBalanceException(
                        "Group " + grant.groupId() + " principal is " + b.principal() + ", payout needs " + gross);
            }
            long net = gross - fee;
            long creatorCut = Bps.of(fee, policy.creatorFeeShareBps());
            balances.save(b.toBuilder()
                    .principal(b.principal() - gross)
                    .pendingPayouts(b.pendingPayouts() + net)
                    .feesPaid(b.feesPaid() + fee)
                    .creatorFeesHeld(b.creatorFeesHeld() + creatorCut)
                    .build());
            balances.savePending(grant.groupId(), recipient, balances.pendingFor(grant.groupId(), recipient) + net);
            if (fee - creatorCut > 0) {
                payOut(treasury, fee - creatorCut);
            }
        });
    }

    /** Pays out everything pending for {@code recipient}; returns the amount. */
    public long claimPayout(GroupGrant grant, String recipient) {
        return transactions.execute(scope(grant), () -> {
            access.verify(grant);
            long amount = balances.pendingFor(grant.groupId(), recipient);
            if (amount == 0) {
                throw new PreconditionFailedException("No pending payout for " + recipient);
            }
            EscrowBalance b = balance(grant.groupId());
            balances.save(b.toBuilder().pendingPayouts(b.pendingPayouts() - amount).build());
            balances.savePending(grant.groupId(), recipient, 0L);
            payOut(recipient, amount);
            return amount;
        });
    }

    /** Pays out the held creator fee share to {@code to}; returns the amount, zero when nothing is held. */
    public long releaseCreatorFees(GroupGrant grant, String to) {
        return transactions.execute(scope(grant), () -> {
            access.verify(grant);
            EscrowBalance b = balance(grant.groupId());
            long amount = b.creatorFeesHeld();
            if (amount == 0) {
                return 0L;
            }
            balances.save(b.toBuilder().creatorFeesHeld(0).build());
            payOut(to, amount);
            log.info("Released {} of held platform fees of group {} to {}", amount, grant.groupId(), to);
            return amount;
        });
    }

    /** Early-withdrawal penalty: leaves principal and lands in the group's insurance pool as a premium. */
    public void forfeitToInsurance(GroupGrant grant, long amount) {
        transactions.run(scope(grant), () -> {
            access.verify(grant);
            requirePositive(amount);
            EscrowBalance b = balance(grant.groupId());
            if (b.principal() < amount) {
                throw new InsufficientBalanceException("Group " + grant.groupId() + " principal is " + b.principal());
            }
            balances.save(b.toBuilder()
                    .principal(b.principal() - amount)
                    .penaltiesForfeited(b.penaltiesForfeited() + amount)
                    .build());
            ensureOnHand(amount);
            insurance.depositPremium(grant, VAULT_ACCOUNT, amount);
        });
    }

    /**
     * Harvests the shared adapter and spreads the result over every open group in proportion to
     * the capital it holds in the vault (principal, yield reserve and pending payouts). Each
     * group's slice is split again: {@code groupYieldShareBps} to its yield reserve, the rest to
     * its insurance pool. {@code groupId} only names the group triggering the harvest; it gets no
     * more than its proportional slice. Returns the harvested amount.
     */
    public long harvestYield(long groupId) {
        return transactions.execute("escrow:harvest", () -> {
            if (!openGroups.containsKey(groupId)) {
                throw new NotFoundException("No escrow for group " + groupId);
            }
            Map<Long, Long> weights = new TreeMap<>();
            long totalWeight = 0;
            for (EscrowBalance b : balances.findAll()) {
                if (b.total() > 0 && openGroups.containsKey(b.groupId())) {
                    weights.put(b.groupId(), b.total());
                    totalWeight += b.total();
                }
            }
            if (totalWeight == 0) {
                return 0L;
            }
            long harvested = yieldAdapter.harvest();
            if (harvested == 0) {
                return 0L;
            }
            long left = harvested;
            int remaining = weights.size();
            for (Map.Entry<Long, Long> e : weights.entrySet()) {
                remaining--;
                long slice = remaining == 0 ? left : Bps.prorate(harvested, e.getValue(), totalWeight);
                left -= slice;
                if (slice > 0) {
                    credit(e.getKey(), slice);
                }
            }
            log.info("Harvested {} across {} groups (triggered by group {})", harvested, weights.size(), groupId);
            sweep();
            return harvested;
        });
    }

    private void credit(long groupId, long yield) {
        GroupGrant grant = openGroups.get(groupId)
                .orElseThrow(() -> new NotFoundException("No escrow for group " + groupId));
        long groupShare = Bps.of(yield, policy.groupYieldShareBps());
        long insuranceShare = yield - groupShare;
        EscrowBalance b = balance(groupId);
        balances.save(b.toBuilder()
                .yieldReserve(b.yieldReserve() + groupShare)
                .yieldHarvested(b.yieldHarvested() + yield)
                .build());
        if (insuranceShare > 0) {
            insurance.depositPremium(grant, VAULT_ACCOUNT, insuranceShare);
        }
        log.debug("Group {} receives {} of the harvest ({} to yield reserve, {} to insurance)",
                groupId, yield, groupShare, insuranceShare);
    }

    public EscrowBalance balance(long groupId) {
        return balances.find(groupId)
                .orElseThrow(() -> new NotFoundException("No escrow for group " + groupId));
    }

    public long pendingFor(long groupId, String recipient) {
        return balances.pendingFor(groupId, recipient);
    }

    /** Principal, yield reserve and pending payouts of one group. */
    public EscrowBalance groupValue(long groupId) {
        return transactions.read(() -> balance(groupId));
    }

    /** Total vault assets minus the liquidity buffer. */
    public long getIdleFunds() {
        return transactions.read(() -> {
            long total = totalAssets();
            return total - Bps.of(total, policy.liquidityBufferBps());
        });
    }

    public VaultStats vaultStats() {
        return transactions.read(() -> {
            long onHand = valueTransfer.balanceOf(VAULT_ACCOUNT);
            long deployed = yieldAdapter.balance();
            long total = onHand + deployed;
            long escrowed = 0;
            for (EscrowBalance b : balances.findAll()) {
                escrowed += b.total();
            }
            return new VaultStats(onHand, deployed, total, total - Bps.of(total, policy.liquidityBufferBps()),
                    escrowed, policy.liquidityBufferBps(), yieldAdapter.apy());
        });
    }

    private long totalAssets() {
        return valueTransfer.balanceOf(VAULT_ACCOUNT) + yieldAdapter.balance();
    }

    private void sweep() {
        long onHand = valueTransfer.balanceOf(VAULT_ACCOUNT);
        long buffer = Bps.of(onHand + yieldAdapter.balance(), policy.liquidityBufferBps());
        long excess = onHand - buffer;
        if (excess > 0) {
            yieldAdapter.deposit(excess);
            log.debug("Swept {} idle funds into the yield adapter (buffer {})", excess, buffer);
        }
    }

    private void ensureOnHand(long amount) {
        long onHand = valueTransfer.balanceOf(VAULT_ACCOUNT);
        if (onHand >= amount) {
            return;
        }
        long shortfall = amount - onHand;
        if (yieldAdapter.balance() < shortfall) {
            throw new InsufficientBalanceException("Vault cannot raise " + amount + " (short " + shortfall + ")");
        }
        yieldAdapter.withdraw(shortfall);
        log.debug("Pulled {} back from the yield adapter", shortfall);
    }

    private void payOut(String to, long amount) {
        ensureOnHand(amount);
        if (!valueTransfer.transfer(VAULT_ACCOUNT, to, amount)) {
            throw new InsufficientBalanceException("Vault cannot pay out " + amount);
        }
    }

    private static void requirePositive(long amount) {
        if (amount <= 0) {
            throw new InvalidInputException("amount must be positive");
        }
    }

    private static String scope(GroupGrant grant) {
        return "escrow:" + (grant == null ? "?" : grant.groupId());
    }
}
