package com.trustplatform.common.store;

import com.trustplatform.common.history.AgentLedger;
import com.trustplatform.common.policy.ReputationPolicy;

import java.util.Collection;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Per-agent score storage with striped locking.
 *
 * <p>Agents hash onto a fixed table of {@link ReentrantLock}s. Every
 * read-modify-write of an agent's {@link AgentLedger} runs inside
 * {@link #withLock(String, Supplier)}, so two updates for the same agent never
 * interleave while updates for agents on different stripes run in parallel.
 * Fair locks keep per-agent admission order equal to arrival order.
 *
 * <p>Reads through {@link #get(String)} never create a ledger.
 */
public final class ScoreStore {

    public static final int DEFAULT_LOCK_STRIPES = 64;

    private final ReputationPolicy policy;
    private final ConcurrentHashMap<String, AgentLedger> ledgers = new ConcurrentHashMap<>();
    private final ReentrantLock[] stripes;
    private final int mask;

    public ScoreStore(ReputationPolicy policy) {
        this(policy, DEFAULT_LOCK_STRIPES);
    }

    /**
     * @param lockStripes number of lock stripes; rounded up to a power of two
     */
    public ScoreStore(ReputationPolicy policy, int lockStripes) {
        if (lockStripes <= 0) {
            throw new IllegalArgumentException("lockStripes must be positive, got " + lockStripes);
        }
        this.policy = policy;
        int size = Integer.highestOneBit(lockStripes);
        if (size < lockStripes) size <<= 1;
        this.stripes = new ReentrantLock[size];
        for (int i = 0; i < size; i++) {
            stripes[i] = new ReentrantLock(true);
        }
        this.mask = size - 1;
    }

    /** Current score, or the policy default for an unseen agent. No side effects. */
    public double get(String agentId) {
        AgentLedger ledger = ledgers.get(agentId);
        return ledger == null ? policy.defaultRepId() : ledger.score();
    }

    public Optional<AgentLedger> find(String agentId) {
        return Optional.ofNullable(ledgers.get(agentId));
    }

    /** Returns the agent's ledger, creating it at the default score. Call under the agent lock. */
    public AgentLedger ledgerFor(String agentId) {
        return ledgers.computeIfAbsent(agentId, id -> new AgentLedger(
            id, policy.defaultRepId(),
            policy.validationHistoryCapacity(), policy.updateHistoryCapacity()));
    }

    /** Runs {@code action} while holding the stripe lock for {@code agentId}. */
    public <T> T withLock(String agentId, Supplier<T> action) {
        ReentrantLock lock = lockFor(agentId);
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public Collection<AgentLedger> ledgers() {
        return ledgers.values();
    }

    public int size() {
        return ledgers.size();
    }

    int stripeCount() {
        return stripes.length;
    }

    private ReentrantLock lockFor(String agentId) {
        int h = agentId.hashCode();
        h ^= (h >>> 16);
        return stripes[h & mask];
    }
}
