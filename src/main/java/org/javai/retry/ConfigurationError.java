package org.javai.retry;

import java.util.List;

/**
 * Thrown by {@link PolicyBuilder#build()} when the accumulated configuration is incomplete
 * or invalid. Lists every problem found, not only the first.
 */
public class ConfigurationError extends RuntimeException {

    private final List<String> problems;

    public ConfigurationError(List<String> problems) {
        super("Invalid policy configuration: " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> problems() {
        return problems;
    }
}
