package io.routine4j.config;

import io.routine4j.JobTask;
import io.routine4j.Routines;
import io.routine4j.core.TaskRegistry;
import io.routine4j.internal.DefaultRoutines;
import io.routine4j.internal.JobRegistry;
import io.routine4j.internal.RunExecutor;
import io.routine4j.internal.memory.InMemoryJobStore;
import io.routine4j.internal.memory.InMemoryLogStore;
import io.routine4j.spi.JobStore;
import io.routine4j.spi.LogStore;
import io.routine4j.tasks.HelloWorldTask;
import io.routine4j.utils.NextRunCalculator;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

import java.time.Clock;
import java.util.List;

/**
 * Spring Boot auto-configuration entrypoint for Routine components.
 *
 * <p>Stores default to in-memory; {@link RoutineMongoStoreConfig} contributes Mongo stores instead when
 * {@code routine.store=mongo}.
 */
@AutoConfiguration(afterName = "org.springframework.boot.autoconfigure.data.mongo.MongoDataAutoConfiguration")
@EnableConfigurationProperties
@Import(RoutineMongoStoreConfig.class)
@ConditionalOnClass(Routines.class)
@ConditionalOnProperty(prefix = "routine", name = "enabled", havingValue = "true", matchIfMissing = true)
public class RoutineConfig {

    @Bean
    @ConditionalOnMissingBean
    @ConfigurationProperties(prefix = "routine")
    public RoutineProperties routineProperties() {
        return new RoutineProperties();
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock routineClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean(name = "helloWorldTask")
    public HelloWorldTask helloWorldTask() {
        return new HelloWorldTask();
    }

    @Bean
    @ConditionalOnMissingBean
    public TaskRegistry taskRegistry(ObjectProvider<List<JobTask>> tasksProvider) {
        List<JobTask> tasks = tasksProvider.getIfAvailable(List::of);
        return new TaskRegistry(tasks);
    }

    @Bean
    @ConditionalOnMissingBean
    public NextRunCalculator nextRunCalculator(RoutineProperties props) {
        return new NextRunCalculator(props.zoneId());
    }

    @Bean
    @ConditionalOnMissingBean
    public JobStore jobStore() {
        return new InMemoryJobStore();
    }

    @Bean
    @ConditionalOnMissingBean
    public LogStore logStore(RoutineProperties props, Clock clock) {
        return new InMemoryLogStore(props.getLogRetention(), clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public JobRegistry jobRegistry(JobStore jobStore, NextRunCalculator calculator, TaskRegistry tasks,
                                   RoutineProperties props, Clock clock) {
        return new JobRegistry(jobStore, calculator, tasks, props.getDefaultTask(), clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public RunExecutor runExecutor(RoutineProperties props, JobRegistry registry, LogStore logStore,
                                   TaskRegistry tasks, Clock clock) {
        return new RunExecutor(props, registry, logStore, tasks, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public Routines routines(RoutineProperties props, JobRegistry registry, RunExecutor executor,
                             LogStore logStore, Clock clock) {
        return new DefaultRoutines(props, registry, executor, logStore, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public RoutineLifecycle routineLifecycle(Routines routines) {
        return new RoutineLifecycle(routines);
    }
}
