package com.demo.thrift.tx;

import com.demo.thrift.exception.PreconditionFailedException;
import com.demo.thrift.exception.ReentrantCallException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class LedgerTransactionsTest {

    private LedgerTransactions transactions;
    private JournaledMap<String, Long> map;
    private JournaledCell<Long> cell;

    @BeforeEach
    void setUp() {
        transactions = new LedgerTransactions();
        map = new JournaledMap<>(transactions);
        cell = new JournaledCell<>(transactions, 0L);
    }

    @Nested
    @DisplayName("Commit and rollback")
    class CommitRollback {

        @Test
        @DisplayName("Writes of a successful operation stay")
        void commits() {
            transactions.run("group:1", () -> {
                map.put("a", 1L);
                cell.set(5L);
            });

            assertThat(map.get("a")).contains(1L);
            assertThat(cell.get()).isEqualTo(5L);
            assertThat(transactions.inTransaction()).isFalse();
        }

        @Test
        @DisplayName("A failing operation restores every value it touched")
        void rollsBackOnFailure() {
            transactions.run("group:1", () -> map.put("a", 1L));

            assertThatThrownBy(() -> transactions.run("group:1", () -> {
                map.put("a", 2L);
                map.put("b", 3L);
                cell.set(9L);
                throw new PreconditionFailedException("nope");
            })).isInstanceOf(PreconditionFailedException.class);

            assertThat(map.get("a")).contains(1L);
            assertThat(map.containsKey("b")).isFalse();
            assertThat(cell.get()).isZero();
        }

        @Test
        @DisplayName("Writes of nested calls that already returned are undone with the outer call")
        void nestedCommittedWritesRollBackWithOuter() {
            assertThatThrownBy(() -> transactions.run("group:1", () -> {
                transactions.run("escrow:1", () -> map.put("inner", 1L));
                throw new IllegalStateException("late failure");
            })).isInstanceOf(IllegalStateException.class);

            assertThat(map.size()).isZero();
        }

        @Test
        @DisplayName("A caught nested failure only rolls back to its own savepoint")
        void nestedFailureRollsBackToSavepoint() {
            transactions.run("group:1", () -> {
                map.put("outer", 1L);
                try {
                    transactions.run("escrow:1", () -> {
                        map.put("inner", 2L);
                        throw new PreconditionFailedException("inner");
                    });
                } catch (PreconditionFailedException expected) {
                    map.put("handled", 3L);
                }
            });

            assertThat(map.values()).containsExactly(1L, 3L);
        }
    }

    @Nested
    @DisplayName("Reentrancy guard")
    class Guard {

        @Test
        @DisplayName("Re-entering a held scope is rejected and nothing is kept")
        void rejectsReentry() {
            assertThatThrownBy(() -> transactions.run("group:7", () -> {
                map.put("x", 1L);
                transactions.run("escrow:7", () -> transactions.run("group:7", () -> map.put("y", 2L)));
            }))
                    .isInstanceOf(ReentrantCallException.class)
                    .satisfies(e -> assertThat(((ReentrantCallException) e).getScope()).isEqualTo("group:7"));

            assertThat(map.size()).isZero();
        }

        @Test
        @DisplayName("Different scopes nest freely and a scope can be taken again after release")
        void distinctScopesNest() {
            long result = transactions.execute("group:1", () -> {
                transactions.run("stake:1", () -> map.put("s", 1L));
                transactions.run("stake:1", () -> map.put("t", 2L));
                return transactions.execute("escrow:1", () -> 42L);
            });

            assertThat(result).isEqualTo(42L);
            assertThat(map.size()).isEqualTo(2);
        }
    }

    @Test
    @DisplayName("Journaled state cannot be written outside an operation")
    void writesOutsideTransactionFail() {
        assertThatThrownBy(() -> map.put("a", 1L))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("outside a transaction");
        assertThatThrownBy(() -> cell.set(1L)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Reads wait for the lock but need no scope")
    void readsOutsideScopes() {
        transactions.run("group:1", () -> map.put("a", 1L));

        assertThat(transactions.read(() -> map.get("a").orElse(0L))).isEqualTo(1L);
    }
}
