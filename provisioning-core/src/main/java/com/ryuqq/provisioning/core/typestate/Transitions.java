package com.ryuqq.provisioning.core.typestate;

import com.ryuqq.provisioning.core.event.AppDomainEvent;
import com.ryuqq.provisioning.core.model.AppSnapshot;
import com.ryuqq.provisioning.core.reducer.AppReducer;

import java.util.List;

/**
 * Shared plumbing for typestate operations: reduce, then check the result.
 *
 * <p>A failed check is a reducer/typestate mismatch, a programming error.
 * It is never reachable from user input.</p>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
final class Transitions {

    private Transitions() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    static AppSnapshot reduce(AppSnapshot current, AppDomainEvent event) {
        AppSnapshot next = AppReducer.apply(current, event);
        if (!next.satisfiesInvariant()) {
            throw new IllegalStateException(
                String.format("Invariant violated after %s: %s → %s", event.type(), current, next)
            );
        }
        return next;
    }

    static void requireKind(AppSnapshot snapshot, AppKind expected) {
        AppKind actual = AppKind.of(snapshot);
        if (actual != expected) {
            throw new IllegalStateException(
                String.format("Snapshot does not match %s variant (was %s): %s", expected, actual, snapshot)
            );
        }
    }

    static List<AppDomainEvent> copyEvents(List<AppDomainEvent> events) {
        if (events == null) {
            throw new IllegalArgumentException("events cannot be null");
        }
        return List.copyOf(events);
    }
}
