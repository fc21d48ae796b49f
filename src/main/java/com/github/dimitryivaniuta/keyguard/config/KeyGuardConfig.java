package com.github.dimitryivaniuta.keyguard.config;

import com.github.dimitryivaniuta.keyguard.clock.SystemTimeSource;
import com.github.dimitryivaniuta.keyguard.clock.TimeSource;
import com.github.dimitryivaniuta.keyguard.credential.CredentialCodec;
import com.github.dimitryivaniuta.keyguard.key.InMemoryKeyRecordStore;
import com.github.dimitryivaniuta.keyguard.key.KeyRecordStore;
import com.github.dimitryivaniuta.keyguard.lifecycle.IpAllowListMatcher;
import com.github.dimitryivaniuta.keyguard.lifecycle.KeyLifecycle;
import com.github.dimitryivaniuta.keyguard.lifecycle.LastUsedRecorder;
import com.github.dimitryivaniuta.keyguard.metrics.KeyGuardMetrics;
import com.github.dimitryivaniuta.keyguard.ratelimit.RateLimitManager;
import com.github.dimitryivaniuta.keyguard.ratelimit.RateLimitRuleResolver;
import com.github.dimitryivaniuta.keyguard.ratelimit.backend.FixedWindowBackend;
import com.github.dimitryivaniuta.keyguard.ratelimit.backend.RateLimitBackend;
import com.github.dimitryivaniuta.keyguard.ratelimit.backend.SlidingWindowBackend;
import com.github.dimitryivaniuta.keyguard.ratelimit.backend.TokenBucketBackend;
import com.github.dimitryivaniuta.keyguard.ratelimit.penalty.PenaltyTracker;
import com.github.dimitryivaniuta.keyguard.store.CaffeineCounterStore;
import com.github.dimitryivaniuta.keyguard.store.CounterStore;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.List;

/**
 * Wiring of the decision core. Stores are plain beans so a deployment can replace them with
 * networked implementations.
 */
@Configuration
public class KeyGuardConfig {

    public static final String LAST_USED_EXECUTOR = "keyGuardLastUsedExecutor";

    @Bean
    @ConditionalOnMissingBean
    public TimeSource timeSource() {
        return new SystemTimeSource();
    }

    @Bean
    public CredentialCodec credentialCodec(KeyGuardProperties props) {
        KeyGuardProperties.Credential c = props.getCredential();
        return new CredentialCodec(c.getSigningKey(), c.getMaxSecretLength());
    }

    @Bean
    @ConditionalOnMissingBean
    public KeyRecordStore keyRecordStore() {
        return new InMemoryKeyRecordStore();
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public CounterStore counterStore(KeyGuardProperties props) {
        KeyGuardProperties.Counters c = props.getCounters();
        return new CaffeineCounterStore(c.getMinimumTtl(), c.getMaximumSize());
    }

    @Bean
    public PenaltyTracker penaltyTracker(CounterStore counterStore, KeyGuardProperties props) {
        return new PenaltyTracker(counterStore, props.getPenalty().toPolicy());
    }

    @Bean
    public RateLimitManager rateLimitManager(CounterStore counterStore,
                                             PenaltyTracker penaltyTracker,
                                             KeyGuardMetrics metrics) {
        List<RateLimitBackend> backends = List.of(
                new FixedWindowBackend(counterStore),
                new SlidingWindowBackend(counterStore),
                new TokenBucketBackend(counterStore));
        return new RateLimitManager(backends, penaltyTracker, metrics);
    }

    @Bean
    public RateLimitRuleResolver rateLimitRuleResolver(KeyGuardProperties props) {
        return new RateLimitRuleResolver(props.getRateLimit());
    }

    @Bean
    public KeyLifecycle keyLifecycle(KeyGuardProperties props) {
        return new KeyLifecycle(new IpAllowListMatcher(), props.getLifecycle().getExpiringSoon());
    }

    @Bean(name = LAST_USED_EXECUTOR)
    public ThreadPoolTaskExecutor lastUsedExecutor() {
        ThreadPoolTaskExecutor ex = new ThreadPoolTaskExecutor();
        ex.setThreadNamePrefix("key-last-used-");
        ex.setCorePoolSize(2);
        ex.setMaxPoolSize(4);
        ex.setQueueCapacity(10_000);
        ex.setWaitForTasksToCompleteOnShutdown(true);
        ex.setAwaitTerminationSeconds(5);
        return ex;
    }

    @Bean
    public LastUsedRecorder lastUsedRecorder(KeyRecordStore keyRecordStore,
                                             @Qualifier(LAST_USED_EXECUTOR) ThreadPoolTaskExecutor executor) {
        return new LastUsedRecorder(keyRecordStore, executor);
    }
}
