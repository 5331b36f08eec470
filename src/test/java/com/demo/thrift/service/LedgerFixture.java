package com.demo.thrift.service;

import com.demo.thrift.adapter.AccruingYieldAdapter;
import com.demo.thrift.adapter.InMemoryValueTransfer;
import com.demo.thrift.model.Group;
import com.demo.thrift.model.GroupConfig;
import com.demo.thrift.model.GroupModel;
import com.demo.thrift.repository.ClaimRepository;
import com.demo.thrift.repository.ContributionRepository;
import com.demo.thrift.repository.EscrowBalanceRepository;
import com.demo.thrift.repository.GroupRepository;
import com.demo.thrift.repository.InsurancePoolRepository;
import com.demo.thrift.repository.MemberRepository;
import com.demo.thrift.repository.PayoutRepository;
import com.demo.thrift.repository.ReputationRepository;
import com.demo.thrift.repository.StakeRepository;
import com.demo.thrift.support.MutableClock;
import com.demo.thrift.tx.LedgerTransactions;

import java.time.Duration;
import java.time.Instant;
import java.util.Set;
import java.util.function.Function;

/** Hand-wired ledgers on the in-memory asset, a mutable clock and a configurable yield adapter. */
public class LedgerFixture {

    public static final String CREATOR = address(1000);
    public static final String ALICE = address(1111);
    public static final String BOB = address(2222);
    public static final String CAROL = address(3333);
    public static final String DAVE = address(4444);
    public static final String ADMIN = address(9009);
    public static final String PROCESSOR_1 = address(8001);
    public static final String PROCESSOR_2 = address(8002);
    public static final String TREASURY = address(7007);

    public final MutableClock clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));
    public final LedgerTransactions transactions = new LedgerTransactions();
    public final InMemoryValueTransfer valueTransfer = new InMemoryValueTransfer(transactions);
    public final LedgerAccess access = new LedgerAccess(transactions);
    public final GroupRepository groups = new GroupRepository(transactions);
    public final MemberRepository members = new MemberRepository(transactions);
    public final ContributionRepository contributions = new ContributionRepository(transactions);
    public final PayoutRepository payouts = new PayoutRepository(transactions);
    public final StakeRepository stakes = new StakeRepository(transactions);
    public final ReputationRepository reputations = new ReputationRepository(transactions);
    public final EscrowBalanceRepository escrowBalances = new EscrowBalanceRepository(transactions);
    public final InsurancePoolRepository pools = new InsurancePoolRepository(transactions);
    public final ClaimRepository claims = new ClaimRepository(transactions);

    public final ProtocolPolicy policy;
    public final YieldAdapter yieldAdapter;
    public final StakeLedger stakeLedger;
    public final InsuranceLedger insuranceLedger;
    public final EscrowLedger escrowLedger;
    public final GroupLifecycleService lifecycle;
    public final GroupRegistry registry;

    public LedgerFixture() {
        this(testPolicy(), fx -> new AccruingYieldAdapter(fx.valueTransfer, fx.transactions, fx.clock, 500));
    }

    public LedgerFixture(ProtocolPolicy policy) {
        this(policy, fx -> new AccruingYieldAdapter(fx.valueTransfer, fx.transactions, fx.clock, 500));
    }

    public LedgerFixture(ProtocolPolicy policy, Function<LedgerFixture, YieldAdapter> yieldFactory) {
        this.policy = policy;
        this.yieldAdapter = yieldFactory.apply(this);
        this.stakeLedger = new StakeLedger(transactions, access, stakes, reputations, valueTransfer, policy);
        this.insuranceLedger = new InsuranceLedger(transactions, access, pools, claims, valueTransfer, policy, clock);
        this.escrowLedger = new EscrowLedger(transactions, access, escrowBalances, valueTransfer, yieldAdapter,
                insuranceLedger, policy);
        this.lifecycle = new GroupLifecycleService(transactions, groups, members, contributions, payouts,
                stakeLedger, escrowLedger, insuranceLedger, policy, clock);
        this.registry = new GroupRegistry(transactions, access, groups, members, escrowBalances, escrowLedger,
                insuranceLedger, lifecycle, valueTransfer, policy);
    }

    public static String address(int n) {
        return String.format("0x%040d", n);
    }

    public static ProtocolPolicy testPolicy() {
        return ProtocolPolicy.defaults().toBuilder()
                .admins(Set.of(ADMIN))
                .claimProcessors(Set.of(PROCESSOR_1, PROCESSOR_2))
                .treasury(TREASURY)
                .build();
    }

    public static GroupConfig.GroupConfigBuilder config(GroupModel model) {
        return GroupConfig.builder()
                .model(model)
                .contributionAmount(100)
                .cycleInterval(Duration.ofDays(7))
                .gracePeriod(Duration.ofDays(1))
                .groupSize(3);
    }

    /** Issues a bare grant and opens escrow and insurance for it, bypassing the lifecycle. */
    public GroupGrant openLedgers(long groupId, boolean emergencyMode) {
        return transactions.execute("test", () -> {
            GroupGrant grant = access.issue(groupId);
            escrowLedger.openGroup(grant);
            insuranceLedger.openPool(grant, emergencyMode);
            return grant;
        });
    }

    public void fund(String account, long amount) {
        valueTransfer.mint(account, amount);
    }

    public long balance(String account) {
        return valueTransfer.balanceOf(account);
    }

    /** Creates a group, funds every member with {@code funding} and joins them in order. */
    public Group activeGroup(GroupConfig config, long funding, String... joiners) {
        Group group = registry.createGroup(CREATOR, config);
        for (String m : joiners) {
            fund(m, funding);
            lifecycle.join(group.getId(), m);
        }
        return lifecycle.getGroup(group.getId());
    }
}
