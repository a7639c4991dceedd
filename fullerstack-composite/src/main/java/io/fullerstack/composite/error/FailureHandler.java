package io.fullerstack.composite.error;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Receives failures from recomputes that no caller is waiting on, such as a recompute
 * triggered by a provider change or a membership change.
 */
@FunctionalInterface
public interface FailureHandler {

    /**
     * Handler that logs the failure at ERROR and otherwise ignores it.
     */
    FailureHandler LOGGING = new FailureHandler() {
        private final Logger logger = LoggerFactory.getLogger(FailureHandler.class);

        @Override
        public void onFailure(ProviderReadException failure) {
            logger.error("Background recompute of composite '{}' failed; keeping last snapshot",
                failure.getCompositeName(), failure);
        }
    };

    void onFailure(ProviderReadException failure);
}
