package io.routine4j.server.web;

import io.routine4j.server.RoutineWebProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Lets the browser client call the API from its own origin.
 */
@Configuration
public class CorsConfig implements WebMvcConfigurer {

    private final RoutineWebProperties props;

    public CorsConfig(RoutineWebProperties props) {
        this.props = props;
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/**")
                .allowedOrigins(props.getAllowedOrigins().toArray(new String[0]))
                .allowedMethods("GET", "POST", "OPTIONS")
                .allowedHeaders("*");
    }
}
