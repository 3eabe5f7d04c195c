package io.marketlens.infrastructure.fetch;

import io.marketlens.domain.common.Deadline;

@FunctionalInterface
public interface GuardedCall<T> {

    T call(Deadline deadline) throws Exception;
}
