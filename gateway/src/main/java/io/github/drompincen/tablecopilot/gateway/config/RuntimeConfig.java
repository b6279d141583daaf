package io.github.drompincen.tablecopilot.gateway.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class RuntimeConfig {

    /** Local wall clock; schedule times are local and minute-precise. */
    @Bean
    Clock clock() {
        return Clock.systemDefaultZone();
    }
}
