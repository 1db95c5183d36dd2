package io.routine4j.core;

import io.routine4j.JobTask;
import io.routine4j.TaskContext;
import io.routine4j.tasks.HelloWorldTask;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TaskRegistryTest {

    @Test
    void lookupShouldResolveByName() {
        HelloWorldTask hello = new HelloWorldTask();
        TaskRegistry registry = new TaskRegistry(List.of(hello));

        assertSame(hello, registry.getRequired(HelloWorldTask.NAME));
        assertTrue(registry.contains(HelloWorldTask.NAME));
        assertFalse(registry.contains("other"));
        assertFalse(registry.contains(null));
    }

    @Test
    void missingTaskShouldFail() {
        TaskRegistry registry = new TaskRegistry(List.of());

        assertThrows(IllegalStateException.class, () -> registry.getRequired("nothing"));
    }

    @Test
    void duplicateNamesShouldBeRejected() {
        JobTask impostor = new JobTask() {
            @Override
            public String name() {
                return HelloWorldTask.NAME;
            }

            @Override
            public void execute(TaskContext context) {
                // not called
            }
        };

        assertThrows(IllegalStateException.class, () -> new TaskRegistry(List.of(new HelloWorldTask(), impostor)));
    }
}
