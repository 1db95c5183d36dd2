package io.routine4j;


public interface JobTask {
    String name();

    void execute(TaskContext context) throws Exception;
}
