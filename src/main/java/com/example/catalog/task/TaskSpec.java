package com.example.catalog.task;

import java.util.Set;

/**
 * Identity of a cacheable task.
 *
 * @param name               task identity; bump the suffix when the task body
 *                           changes meaning so stale entries stop matching
 * @param excludedArguments  argument names left out of the fingerprint
 */
public record TaskSpec(String name, Set<String> excludedArguments) {

    public TaskSpec {
        excludedArguments = Set.copyOf(excludedArguments);
    }

    public static TaskSpec of(String name, String... excludedArguments) {
        return new TaskSpec(name, Set.of(excludedArguments));
    }
}
