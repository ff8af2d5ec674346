package com.keystone.core.config;

import com.keystone.core.recovery.Sleeper;
import com.keystone.core.resources.JvmResourceSampler;
import com.keystone.core.resources.ResourceSampler;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Infrastructure beans shared by the orchestration core. Each can be replaced by declaring
 * a bean of the same type, which is how tests pin the clock and the resource sampler.
 */
@Configuration
public class KeystoneConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock keystoneClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public ResourceSampler resourceSampler() {
        return new JvmResourceSampler(Path.of("."));
    }

    @Bean
    @ConditionalOnMissingBean
    public Sleeper recoverySleeper() {
        return Sleeper.THREAD;
    }
}
