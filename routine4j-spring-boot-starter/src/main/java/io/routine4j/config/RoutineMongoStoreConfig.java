package io.routine4j.config;

import io.routine4j.internal.mongo.MongoJobStore;
import io.routine4j.internal.mongo.MongoLogStore;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.time.Clock;

/**
 * Mongo-backed stores, active when {@code routine.store=mongo} and a {@link MongoTemplate} is available.
 * Imported by {@link RoutineConfig} so these stores are registered before its in-memory fallbacks.
 */
@Configuration(proxyBeanMethods = false)
@ConditionalOnClass({MongoTemplate.class, MongoJobStore.class})
@ConditionalOnBean(MongoTemplate.class)
@ConditionalOnProperty(prefix = "routine", name = "store", havingValue = "mongo")
public class RoutineMongoStoreConfig {

    @Bean
    @ConditionalOnMissingBean
    public MongoJobStore mongoJobStore(MongoTemplate mongoTemplate) {
        return new MongoJobStore(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    public MongoLogStore mongoLogStore(MongoTemplate mongoTemplate, RoutineProperties props, Clock clock) {
        return new MongoLogStore(mongoTemplate, props.getLogRetention(), clock);
    }

    @Bean
    @ConditionalOnMissingBean
    protected RoutineMongoIndexConfig routineMongoIndexConfig(MongoTemplate mongoTemplate) {
        return new RoutineMongoIndexConfig(mongoTemplate);
    }

    @Bean
    @ConditionalOnProperty(prefix = "routine", name = "ensure-indexes-on-startup", havingValue = "true")
    public SmartInitializingSingleton routineIndexesInitializer(RoutineMongoIndexConfig indexConfig) {
        return indexConfig::ensureIndexes;
    }
}
