package com.demo.thrift.service;

import com.demo.thrift.service.dto.StakeInfo;
import net.jqwik.api.*;
import net.jqwik.api.constraints.*;

import java.util.List;

import static com.demo.thrift.service.LedgerFixture.ALICE;

/**
 * Bounds of the stake ledger: a slash never exceeds {@code min(stake, missed, stake * penaltyBps)}
 * and never leaves a negative stake; trust stays within [0, max] whatever happens.
 */
class StakeLedgerPropertyTest {

    @Property(tries = 200)
    void slashIsBoundedAndNeverNegative(
            @ForAll @LongRange(min = 0, max = 1_000_000_000L) long stake,
            @ForAll @LongRange(min = 1, max = 1_000_000_000L) long missed,
            @ForAll @IntRange(min = 0, max = 10_000) int penaltyBps) {

        LedgerFixture fx = new LedgerFixture(LedgerFixture.testPolicy().toBuilder()
                .stakePenaltyBps(penaltyBps)
                .build());
        GroupGrant grant = fx.openLedgers(1, false);
        if (stake > 0) {
            fx.fund(ALICE, stake);
            fx.stakeLedger.depositStake(grant, ALICE, stake);
        }

        long slashed = fx.stakeLedger.slashStake(grant, ALICE, missed, EscrowLedger.VAULT_ACCOUNT);

        long bound = Math.min(Math.min(stake, missed), stake * penaltyBps / 10_000);
        StakeInfo info = fx.stakeLedger.stakeInfo(1, ALICE);
        assert slashed == bound : "slashed " + slashed + " expected " + bound;
        assert info.amount() == stake - slashed;
        assert info.amount() >= 0;
    }

    @Property(tries = 100)
    void trustStaysWithinBounds(@ForAll @Size(max = 60) List<Boolean> rewards) {
        LedgerFixture fx = new LedgerFixture();
        GroupGrant grant = fx.openLedgers(1, false);

        for (boolean reward : rewards) {
            if (reward) {
                fx.stakeLedger.rewardTrust(grant, ALICE);
            } else {
                fx.stakeLedger.slashStake(grant, ALICE, 100, EscrowLedger.VAULT_ACCOUNT);
            }
            int trust = fx.stakeLedger.trustScore(ALICE);
            assert trust >= 0 && trust <= 1_000 : "trust out of range: " + trust;
        }
    }
}
