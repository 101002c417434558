package com.edgewatch.service.core.config;

import java.time.Clock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Time source for deadlines, cooldowns and query defaults. An application may register its own. */
@Configuration
public class ClockConfig {

    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock edgeWatchClock() {
        return Clock.systemUTC();
    }
}
