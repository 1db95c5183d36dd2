package io.routine4j.tasks;

import io.routine4j.JobTask;
import io.routine4j.TaskContext;

/**
 * Default task: prints a greeting.
 */
public class HelloWorldTask implements JobTask {

    public static final String NAME = "hello-world";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void execute(TaskContext context) {
        context.out().print("Hello World");
    }
}
