package com.modelgate.pipeline;

import java.io.IOException;
import java.util.Map;

@FunctionalInterface
public interface IterationListener {
    IterationListener NONE = (iteration, metrics) -> {
    };

    void onIteration(int iteration, Map<String, Double> metrics) throws IOException;
}
