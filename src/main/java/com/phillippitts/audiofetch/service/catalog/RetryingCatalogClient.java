package com.phillippitts.audiofetch.service.catalog;

import com.phillippitts.audiofetch.domain.TrackDescriptor;
import com.phillippitts.audiofetch.exception.UpstreamFailure;
import com.phillippitts.audiofetch.exception.UpstreamUnavailableException;
import com.phillippitts.audiofetch.util.Sleeper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Decorates a {@link CatalogClient} with retries for rate limiting and transient failures.
 * Other failure kinds, and the last failure once attempts run out, are rethrown unchanged.
 */
public class RetryingCatalogClient implements CatalogClient {

    private static final Logger LOG = LogManager.getLogger(RetryingCatalogClient.class);

    private final CatalogClient delegate;
    private final RetryPolicy policy;
    private final Sleeper sleeper;

    public RetryingCatalogClient(CatalogClient delegate, RetryPolicy policy, Sleeper sleeper) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    @Override
    public void authenticate() {
        call("authenticate", () -> {
            delegate.authenticate();
            return null;
        });
    }

    @Override
    public TrackDescriptor resolveTrack(String trackUrl) {
        return call("resolveTrack", () -> delegate.resolveTrack(trackUrl));
    }

    @Override
    public List<TrackDescriptor> resolveCollection(String collectionUrl) {
        return call("resolveCollection", () -> delegate.resolveCollection(collectionUrl));
    }

    private <T> T call(String operation, Supplier<T> action) {
        int attempts = 0;
        while (true) {
            try {
                attempts++;
                return action.get();
            } catch (UpstreamUnavailableException e) {
                if (!policy.shouldRetry(e, attempts)) {
                    throw e;
                }
                Duration delay = policy.delayBefore(e, attempts - 1);
                LOG.warn("Catalog {} failed ({}), retry {}/{} in {} ms", operation, e.getKind(), attempts,
                        policy.maxAttempts() - 1, delay.toMillis());
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new UpstreamUnavailableException(UpstreamFailure.UNAVAILABLE,
                            "Interrupted while waiting to retry " + operation, ie);
                }
            }
        }
    }
}
