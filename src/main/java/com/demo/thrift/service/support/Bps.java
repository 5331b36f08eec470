package com.demo.thrift.service.support;

import java.math.BigInteger;

/** Basis point arithmetic on minor units. Results round down. */
public final class Bps {

    public static final int DENOMINATOR = 10_000;

    private Bps() {}

    public static long of(long amount, int bps) {
        return Math.multiplyExact(amount, (long) bps) / DENOMINATOR;
    }

    /** {@code pool * part / whole}, computed without overflow; zero when {@code whole} is zero. */
    public static long prorate(long pool, long part, long whole) {
        if (whole <= 0 || pool <= 0 || part <= 0) {
            return 0;
        }
        return BigInteger.valueOf(pool)
                .multiply(BigInteger.valueOf(part))
                .divide(BigInteger.valueOf(whole))
                .longValueExact();
    }

    /** {@code used / total} in bps, capped at 100%. */
    public static int ratio(long used, long total) {
        if (total <= 0) {
            return 0;
        }
        return (int) Math.min(DENOMINATOR, prorate(DENOMINATOR, used, total));
    }
}
