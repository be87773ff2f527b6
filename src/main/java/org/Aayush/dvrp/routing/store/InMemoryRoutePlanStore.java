package org.Aayush.dvrp.routing.store;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Concurrent in-memory {@link RoutePlanStore}.
 *
 * <p>Plans are immutable and published with a single {@code putIfAbsent}, which gives the
 * all-or-nothing write contract.</p>
 */
public final class InMemoryRoutePlanStore implements RoutePlanStore {
    private final ConcurrentMap<String, StoredRoutePlan> plans = new ConcurrentHashMap<>();

    @Override
    public boolean exists(String solutionId) {
        return solutionId != null && plans.containsKey(solutionId);
    }

    @Override
    public boolean save(StoredRoutePlan plan) {
        Objects.requireNonNull(plan, "plan");
        return plans.putIfAbsent(plan.solutionId(), plan) == null;
    }

    @Override
    public Optional<StoredRoutePlan> find(String solutionId) {
        if (solutionId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(plans.get(solutionId));
    }

    /**
     * @return number of stored plans.
     */
    public int size() {
        return plans.size();
    }
}
