package se.snapup_be.configuration;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Server clock. Escrow windows, payment expiry and rate windows all read time from
 * this bean, so tests can swap in a controllable one.
 */
@Configuration
public class ClockConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
