package com.keystone.core.recovery;

import com.keystone.core.error.OrchestrationException;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * A unit of work the {@link RecoveryManager} may re-invoke. Implementations expose the
 * reduced-scope, alternative and subdivided variants the fallback actions need; the
 * defaults mean "not available", in which case the fallback propagates the failure.
 *
 * @param <T> result type
 */
public interface RecoverableOperation<T> {

    String name();

    /**
     * @throws OrchestrationException on failure; collaborator errors must already be converted
     */
    T execute();

    default Optional<RecoverableOperation<T>> simplified() {
        return Optional.empty();
    }

    default Optional<RecoverableOperation<T>> alternate(String alternateId) {
        return Optional.empty();
    }

    default List<RecoverableOperation<T>> subdivide() {
        return List.of();
    }

    /**
     * Combines the results of independently attempted subdivisions. Called with at least one result.
     */
    default T combine(List<T> results, List<OrchestrationException> failures) {
        throw new UnsupportedOperationException(name() + " does not support subdivision");
    }

    static <T> RecoverableOperation<T> of(String name, Supplier<T> body) {
        return new RecoverableOperation<>() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public T execute() {
                return body.get();
            }
        };
    }
}
