package com.demo.thrift.model;

import com.demo.thrift.exception.InvalidInputException;
import lombok.Builder;

import java.time.Duration;

/**
 * Immutable group parameters, fixed at creation. Amounts are in the smallest unit of the
 * settlement asset; all {@code *Bps} values are basis points (10000 = 100%).
 */
@Builder(toBuilder = true)
public record GroupConfig(
        GroupModel model,
        long contributionAmount,
        Duration cycleInterval,
        int groupSize,
        Duration lockDuration,
        Duration gracePeriod,
        long stakeRequired,
        boolean insuranceEnabled,
        int insuranceBps,
        int platformFeeBps,
        int earlyWithdrawalPenaltyBps
) {

    public static final int MIN_GROUP_SIZE = 3;
    public static final int MAX_GROUP_SIZE = 50;
    public static final int MAX_BPS = 10_000;

    public GroupConfig {
        if (model == null) {
            throw new InvalidInputException("model is required");
        }
        if (contributionAmount <= 0) {
            throw new InvalidInputException("contributionAmount must be positive");
        }
        if (cycleInterval == null || cycleInterval.isZero() || cycleInterval.isNegative()) {
            throw new InvalidInputException("cycleInterval must be positive");
        }
        if (groupSize < MIN_GROUP_SIZE || groupSize > MAX_GROUP_SIZE) {
            throw new InvalidInputException(
                    "groupSize must be between " + MIN_GROUP_SIZE + " and " + MAX_GROUP_SIZE);
        }
        lockDuration = lockDuration == null ? Duration.ZERO : lockDuration;
        gracePeriod = gracePeriod == null ? Duration.ZERO : gracePeriod;
        if (lockDuration.isNegative() || gracePeriod.isNegative()) {
            throw new InvalidInputException("durations must not be negative");
        }
        if (model == GroupModel.FIXED_SAVINGS && lockDuration.isZero()) {
            throw new InvalidInputException("FIXED_SAVINGS groups need a lockDuration");
        }
        if (stakeRequired < 0) {
            throw new InvalidInputException("stakeRequired must not be negative");
        }
        checkBps("insuranceBps", insuranceBps);
        checkBps("platformFeeBps", platformFeeBps);
        checkBps("earlyWithdrawalPenaltyBps", earlyWithdrawalPenaltyBps);
    }

    /** Premium actually charged per contribution; zero when insurance is off. */
    public int effectiveInsuranceBps() {
        return insuranceEnabled ? insuranceBps : 0;
    }

    private static void checkBps(String name, int bps) {
        if (bps < 0 || bps > MAX_BPS) {
            throw new InvalidInputException(name + " must be within 0.." + MAX_BPS);
        }
    }
}
