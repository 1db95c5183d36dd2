package io.routine4j.core;

import io.routine4j.JobTask;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

public class TaskRegistry {

    private final Map<String, JobTask> tasksByName;

    public TaskRegistry(List<JobTask> tasks) {
        this.tasksByName = tasks.stream()
                .collect(Collectors.toUnmodifiableMap(
                        JobTask::name,
                        Function.identity(),
                        (a, b) -> {
                            throw new IllegalStateException("Duplicate JobTask name: " + a.name());
                        }
                ));
    }

    public boolean contains(String name) {
        return name != null && tasksByName.containsKey(name);
    }

    public Set<String> names() {
        return tasksByName.keySet();
    }

    public JobTask getRequired(String name) {
        JobTask task = tasksByName.get(name);
        if (task == null) {
            throw new IllegalStateException("No JobTask registered for name: " + name);
        }
        return task;
    }
}
