package com.argus.app.config;

import com.argus.activity.memory.InMemoryActivityHub;
import com.argus.app.session.LiveSessionRegistry;
import com.argus.app.stream.ActivityStreamRegistry;
import com.argus.common.config.ConfigService;
import com.argus.common.infra.ScheduledTimers;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Spring configuration for the activity backend, viewers and producers.
 */
@Configuration
public class ActivityBeanConfig {

    @Value("${argus.config.path:~/.argus/argus.json}")
    private String configPath;

    @Bean
    public ConfigService configService() {
        return new ConfigService(Path.of(configPath));
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public InMemoryActivityHub activityHub(Clock clock) {
        return new InMemoryActivityHub(clock);
    }

    @Bean(destroyMethod = "close")
    public ScheduledTimers streamTimers() {
        return new ScheduledTimers("argus-stream-timers");
    }

    @Bean
    public ActivityStreamRegistry activityStreamRegistry(InMemoryActivityHub hub,
                                                         ScheduledTimers streamTimers,
                                                         ConfigService configService,
                                                         Clock clock) {
        return new ActivityStreamRegistry(hub, hub, streamTimers, configService, clock);
    }

    @Bean
    public LiveSessionRegistry liveSessionRegistry(InMemoryActivityHub hub, Clock clock) {
        return new LiveSessionRegistry(hub, clock);
    }
}
