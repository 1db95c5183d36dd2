package io.routine4j.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(RoutineWebProperties.class)
public class RoutineServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(RoutineServerApplication.class, args);
    }
}
