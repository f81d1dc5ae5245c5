package com.agentstudio.observability.delegation;

import com.agentstudio.observability.RunObserverProperties;
import com.agentstudio.observability.run.RunState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * TTL-bounded FIFO of Task handoffs awaiting their subagent start, plus the persisted
 * subagent parent stack. Both live inside the {@link RunState}; this class only holds the
 * rules for mutating them.
 *
 * @author Agent Studio 2025-2026
 */
public class PendingDelegationQueue {

    private static final Logger log = LoggerFactory.getLogger(PendingDelegationQueue.class);

    private final RunObserverProperties.Delegation config;
    private final Clock clock;

    public PendingDelegationQueue(RunObserverProperties.Delegation config, Clock clock) {
        this.config = config;
        this.clock = clock;
    }

    /**
     * Queues a delegation issued by {@code parent} to {@code agent}. The oldest entries are
     * dropped once the queue exceeds its cap.
     *
     * @return the queued entry
     */
    public PendingDelegation enqueue(RunState state, String agent, String parent) {
        PendingDelegation entry = new PendingDelegation(agent, parent, clock.millis());
        List<PendingDelegation> queue = state.getPendingSubagents();
        queue.add(entry);
        int cap = Math.max(1, config.getMaxPending());
        while (queue.size() > cap) {
            PendingDelegation dropped = queue.remove(0);
            log.debug("Pending delegation queue full, dropped {} -> {}", dropped.parent(), dropped.agent());
        }
        return entry;
    }

    /**
     * Removes entries older than the TTL.
     *
     * @return number of expired entries removed
     */
    public int pruneExpired(RunState state) {
        long now = clock.millis();
        long ttlMs = config.getTtl().toMillis();
        int removed = 0;
        Iterator<PendingDelegation> it = state.getPendingSubagents().iterator();
        while (it.hasNext()) {
            PendingDelegation entry = it.next();
            if (now - entry.ts() > ttlMs) {
                it.remove();
                removed++;
            }
        }
        if (removed > 0) {
            log.debug("Expired {} pending delegation(s)", removed);
        }
        return removed;
    }

    /**
     * Consumes one pending delegation after dropping expired ones.
     * <p>
     * With no {@code agentName} the oldest valid entry is consumed. With an agent name only the
     * oldest entry for that agent is consumed, leaving the rest in order.
     *
     * @param agentName the starting agent when the host named it, else null
     * @return the consumed entry, if any
     */
    public Optional<PendingDelegation> consume(RunState state, String agentName) {
        pruneExpired(state);
        List<PendingDelegation> queue = state.getPendingSubagents();
        for (int i = 0; i < queue.size(); i++) {
            PendingDelegation entry = queue.get(i);
            if (agentName == null || agentName.equals(entry.agent())) {
                queue.remove(i);
                return Optional.of(entry);
            }
        }
        return Optional.empty();
    }

    /**
     * Pushes the agent that was current before a subagent started.
     */
    public void pushParent(RunState state, String parent) {
        List<String> stack = state.getSubagentParentStack();
        stack.add(parent);
        int cap = Math.max(1, config.getMaxParentStack());
        while (stack.size() > cap) {
            stack.remove(0);
        }
    }

    /**
     * Pops the most recent parent, if the stack is not empty.
     */
    public Optional<String> popParent(RunState state) {
        List<String> stack = state.getSubagentParentStack();
        if (stack.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(stack.remove(stack.size() - 1));
    }

    /**
     * Unwinds one level for an agent that stops while another agent is current, as happens
     * with parallel subagents finishing out of order. The most recent entry naming the stopped
     * agent is removed, so the child it was the return target for falls back to the stopped
     * agent's own parent. Without such an entry the level below the top is dropped. The top
     * entry belongs to the current agent and is kept.
     */
    public void unwindParent(RunState state, String stoppedAgent) {
        List<String> stack = state.getSubagentParentStack();
        int index = stack.lastIndexOf(stoppedAgent);
        if (index >= 0) {
            stack.remove(index);
        } else if (stack.size() >= 2) {
            stack.remove(stack.size() - 2);
        }
    }
}
