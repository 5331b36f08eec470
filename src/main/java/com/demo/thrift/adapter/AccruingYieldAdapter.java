package com.demo.thrift.adapter;

import com.demo.thrift.exception.InsufficientBalanceException;
import com.demo.thrift.exception.InvalidInputException;
import com.demo.thrift.service.EscrowLedger;
import com.demo.thrift.service.YieldAdapter;
import com.demo.thrift.service.support.Bps;
import com.demo.thrift.tx.JournaledCell;
import com.demo.thrift.tx.LedgerTransactions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Simulated strategy paying simple interest at a fixed APY on the deployed amount. Interest accrues
 * with clock time and is minted into the escrow vault on {@link #harvest()}, so harvesting twice at
 * the same instant returns zero the second time.
 */
@Slf4j
@Component
public class AccruingYieldAdapter implements YieldAdapter {

    public static final String STRATEGY_ACCOUNT = "thrift:yield-strategy";

    private static final BigInteger YEAR_MILLIS = BigInteger.valueOf(Duration.ofDays(365).toMillis());

    private final InMemoryValueTransfer valueTransfer;
    private final Clock clock;
    private final int apyBps;
    private final JournaledCell<Position> position;

    public AccruingYieldAdapter(InMemoryValueTransfer valueTransfer, LedgerTransactions transactions, Clock clock,
                                @Value("${thrift.yield.apy-bps:500}") int apyBps) {
        if (apyBps < 0) {
            throw new InvalidInputException("apy must not be negative");
        }
        this.valueTransfer = valueTransfer;
        this.clock = clock;
        this.apyBps = apyBps;
        this.position = new JournaledCell<>(transactions, new Position(0, 0, clock.instant()));
    }

    @Override
    public void deposit(long amount) {
        if (amount <= 0) {
            throw new InvalidInputException("amount must be positive");
        }
        Position p = accrued();
        if (!valueTransfer.transferFrom(EscrowLedger.VAULT_ACCOUNT, STRATEGY_ACCOUNT, amount)) {
            throw new InsufficientBalanceException("Vault cannot deploy " + amount);
        }
        position.set(new Position(p.deployed() + amount, p.unharvested(), p.asOf()));
    }

    @Override
    public void withdraw(long amount) {
        if (amount <= 0) {
            throw new InvalidInputException("amount must be positive");
        }
        Position p = accrued();
        if (p.deployed() < amount) {
            throw new InsufficientBalanceException("Strategy holds " + p.deployed() + ", cannot withdraw " + amount);
        }
        if (!valueTransfer.transfer(STRATEGY_ACCOUNT, EscrowLedger.VAULT_ACCOUNT, amount)) {
            throw new InsufficientBalanceException("Strategy account cannot pay " + amount);
        }
        position.set(new Position(p.deployed() - amount, p.unharvested(), p.asOf()));
    }

    @Override
    public long harvest() {
        Position p = accrued();
        long amount = p.unharvested();
        if (amount > 0) {
            valueTransfer.mint(EscrowLedger.VAULT_ACCOUNT, amount);
            log.debug("Harvested {} interest on {}", amount, p.deployed());
        }
        position.set(new Position(p.deployed(), 0, p.asOf()));
        return amount;
    }

    @Override
    public long balance() {
        return position.get().deployed();
    }

    @Override
    public int apy() {
        return apyBps;
    }

    private Position accrued() {
        Position p = position.get();
        Instant now = clock.instant();
        long elapsed = Duration.between(p.asOf(), now).toMillis();
        if (elapsed <= 0 || p.deployed() == 0) {
            return new Position(p.deployed(), p.unharvested(), now.isAfter(p.asOf()) ? now : p.asOf());
        }
        long interest = BigInteger.valueOf(p.deployed())
                .multiply(BigInteger.valueOf(apyBps))
                .multiply(BigInteger.valueOf(elapsed))
                .divide(BigInteger.valueOf(Bps.DENOMINATOR).multiply(YEAR_MILLIS))
                .longValueExact();
        return new Position(p.deployed(), p.unharvested() + interest, now);
    }

    private record Position(long deployed, long unharvested, Instant asOf) {}
}
