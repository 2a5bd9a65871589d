package com.suitebridge.core.model;

import java.util.Optional;

/**
 * Generic status notification delivered to the host event sink.
 * <p>
 * {@code duration} is {@code -1} exactly when the status is {@link Status#IGNORED}.
 * Only failures and errors carry a throwable.
 */
public record StatusEvent(
        Status status,
        String fullyQualifiedName,
        Fingerprint fingerprint,
        long duration,
        Optional<Throwable> throwable,
        Selector selector
) {

    public StatusEvent {
        throwable = throwable == null ? Optional.empty() : throwable;
    }
}
