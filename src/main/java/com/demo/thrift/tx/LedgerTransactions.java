package com.demo.thrift.tx;

import com.demo.thrift.exception.ReentrantCallException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Serial, all-or-nothing execution of ledger operations.
 *
 * <p>Every mutating entry point runs inside {@link #execute(String, Supplier)} with a guard scope
 * (for example {@code group:7}). Operations are totally ordered by a single fair lock. A thread that
 * already holds a scope and tries to enter it again, typically from inside an external transfer or
 * yield callback, is rejected with {@link ReentrantCallException}.
 *
 * <p>Writes made through {@link JournaledMap} and {@link JournaledCell} register undo entries with
 * the running transaction. When an operation throws, everything it wrote, including nested
 * operations that had already returned, is restored before the exception leaves
 * {@code execute}. Nested operations share the outer journal: a failure inside a nested call only
 * rolls back to the savepoint taken when that call started.
 */
@Slf4j
@Component
public class LedgerTransactions {

    private final ReentrantLock lock = new ReentrantLock(true);
    private final ThreadLocal<Context> current = new ThreadLocal<>();

    public <T> T execute(String guardScope, Supplier<T> work) {
        lock.lock();
        Context ctx = current.get();
        boolean outermost = ctx == null;
        if (outermost) {
            ctx = new Context();
            current.set(ctx);
        }
        try {
            if (!ctx.scopes.add(guardScope)) {
                log.warn("Rejected reentrant call into {}", guardScope);
                throw new ReentrantCallException(guardScope);
            }
            int savepoint = ctx.undo.size();
            try {
                return work.get();
            } catch (RuntimeException | Error e) {
                int undone = ctx.rollbackTo(savepoint);
                log.debug("Rolled back {} write(s) in {}: {}", undone, guardScope, e.toString());
                throw e;
            } finally {
                ctx.scopes.remove(guardScope);
            }
        } finally {
            if (outermost) {
                current.remove();
            }
            lock.unlock();
        }
    }

    public void run(String guardScope, Runnable work) {
        execute(guardScope, () -> {
            work.run();
            return null;
        });
    }

    /** Consistent read: waits for any running operation to finish, takes no guard. */
    public <T> T read(Supplier<T> query) {
        lock.lock();
        try {
            return query.get();
        } finally {
            lock.unlock();
        }
    }

    public boolean inTransaction() {
        return current.get() != null;
    }

    void recordUndo(Runnable undo) {
        Context ctx = current.get();
        if (ctx == null) {
            throw new IllegalStateException("Ledger state mutated outside a transaction");
        }
        ctx.undo.add(undo);
    }

    private static final class Context {
        private final Set<String> scopes = new HashSet<>();
        private final List<Runnable> undo = new ArrayList<>();

        int rollbackTo(int savepoint) {
            int undone = 0;
            for (int i = undo.size() - 1; i >= savepoint; i--) {
                undo.remove(i).run();
                undone++;
            }
            return undone;
        }
    }
}
