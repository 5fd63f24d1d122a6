package com.modelgate.governance;

import java.io.IOException;
import java.util.Optional;

/**
 * Resolves the registered version a candidate is compared against.
 */
@FunctionalInterface
public interface BaselineSource {
    BaselineSource NONE = (modelName, version, alias) -> Optional.empty();

    /**
     * @param version explicit baseline version, takes precedence over {@code alias}
     * @param alias   alias to resolve when no version is given; an unbound alias yields empty
     */
    Optional<BaselineReference> resolve(String modelName, Integer version, String alias) throws IOException;

    record BaselineReference(String modelName, int version, String runId) {
    }
}
