package com.fieldops.scheduling.config;

import com.fieldops.scheduling.lease.InMemoryTenantLeaseManager;
import com.fieldops.scheduling.lease.RedissonTenantLeaseManager;
import com.fieldops.scheduling.lease.TenantLeaseManager;
import com.fieldops.scheduling.location.RedisTechnicianLocationStore;
import com.fieldops.scheduling.location.TechnicianLocationStore;
import com.fieldops.scheduling.travel.HaversineTravelTimeEstimator;
import com.fieldops.scheduling.travel.HttpTravelTimeProvider;
import com.fieldops.scheduling.travel.ResilientTravelTimeService;
import com.fieldops.scheduling.weather.HttpWeatherSignalProvider;
import com.fieldops.scheduling.weather.WeatherSignalService;
import com.fieldops.shared.featureflag.FeatureFlagService;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RedissonClient;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Wires the external-facing collaborators: provider clients with their resilience guards,
 * the location store, the tenant lease backend and the worker pools.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(SchedulingProperties.class)
public class SchedulingConfig {

    static final String TRAVEL_CIRCUIT = "travel-time-provider";
    static final String API_KEY_HEADER = "X-Api-Key";

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    // --- worker pools ---

    /**
     * Location writes. Bounded queue; when full the caller's thread performs the write.
     */
    @Bean(name = "locationWriterExecutor", destroyMethod = "shutdown")
    public ExecutorService locationWriterExecutor(SchedulingProperties properties) {
        int threads = Math.max(1, properties.getLocation().getWriterThreads());
        return new ThreadPoolExecutor(threads, threads, 0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(10_000), named("location-writer"),
                new ThreadPoolExecutor.CallerRunsPolicy());
    }

    /** Outbound travel-time and weather calls; isolated so a slow provider cannot starve requests. */
    @Bean(name = "providerExecutor", destroyMethod = "shutdown")
    public ExecutorService providerExecutor() {
        return new ThreadPoolExecutor(4, 16, 60L, TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(256), named("provider-call"),
                new ThreadPoolExecutor.AbortPolicy());
    }

    // --- travel time ---

    @Bean
    public HaversineTravelTimeEstimator haversineTravelTimeEstimator(SchedulingProperties properties) {
        return new HaversineTravelTimeEstimator(properties.getTravel().getFallbackSpeedKmh());
    }

    @Bean
    public ResilientTravelTimeService resilientTravelTimeService(SchedulingProperties properties,
                                                                 HaversineTravelTimeEstimator estimator,
                                                                 CircuitBreakerRegistry circuitBreakerRegistry,
                                                                 @Qualifier("providerExecutor") ExecutorService executor) {
        SchedulingProperties.Travel travel = properties.getTravel();
        HttpTravelTimeProvider provider = null;
        if (StringUtils.hasText(travel.getProviderUrl())) {
            provider = new HttpTravelTimeProvider(restClient(travel.getProviderUrl(), travel.getApiKey(), travel.getTimeout()));
            log.info("Travel-time provider configured at {}", travel.getProviderUrl());
        } else {
            log.info("No travel-time provider configured, using great-circle estimates at {} km/h",
                    travel.getFallbackSpeedKmh());
        }
        CircuitBreaker circuitBreaker = circuitBreakerRegistry.circuitBreaker(TRAVEL_CIRCUIT);
        return new ResilientTravelTimeService(provider, estimator, timeLimiter(travel.getTimeout()),
                circuitBreaker, executor);
    }

    // --- weather ---

    @Bean
    public WeatherSignalService weatherSignalService(SchedulingProperties properties,
                                                     @Qualifier("providerExecutor") ExecutorService executor,
                                                     FeatureFlagService featureFlagService) {
        SchedulingProperties.Weather weather = properties.getWeather();
        HttpWeatherSignalProvider provider = StringUtils.hasText(weather.getProviderUrl())
                ? new HttpWeatherSignalProvider(restClient(weather.getProviderUrl(), weather.getApiKey(), weather.getTimeout()))
                : null;
        if (provider == null) {
            log.info("No weather provider configured, weather adjustments disabled");
        }
        return new WeatherSignalService(provider, timeLimiter(weather.getTimeout()), executor, featureFlagService);
    }

    // --- location ---

    @Bean
    public TechnicianLocationStore technicianLocationStore(StringRedisTemplate redisTemplate,
                                                           KafkaTemplate<String, Object> kafkaTemplate,
                                                           SchedulingProperties properties) {
        return new RedisTechnicianLocationStore(redisTemplate, kafkaTemplate, properties.getLocation().getTtl());
    }

    // --- tenant lease ---

    /**
     * LOCAL keeps leases in this JVM; REDIS shares them across replicas through Redisson.
     */
    @Bean
    public TenantLeaseManager tenantLeaseManager(SchedulingProperties properties,
                                                 ObjectProvider<RedissonClient> redissonClient) {
        SchedulingProperties.Lease lease = properties.getLease();
        if (lease.getMode() == SchedulingProperties.Lease.Mode.REDIS) {
            log.info("Tenant leases backed by Redis (leaseTime={})", lease.getLeaseTime());
            return new RedissonTenantLeaseManager(redissonClient.getObject(), lease.getLeaseTime());
        }
        log.info("Tenant leases held in process");
        return new InMemoryTenantLeaseManager();
    }

    // --- helpers ---

    private static TimeLimiter timeLimiter(Duration timeout) {
        return TimeLimiter.of(TimeLimiterConfig.custom()
                .timeoutDuration(timeout)
                .cancelRunningFuture(true)
                .build());
    }

    private static RestClient restClient(String baseUrl, String apiKey, Duration timeout) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) timeout.toMillis());
        requestFactory.setReadTimeout((int) timeout.toMillis());
        RestClient.Builder builder = RestClient.builder()
                .baseUrl(baseUrl)
                .requestFactory(requestFactory);
        if (StringUtils.hasText(apiKey)) {
            builder.defaultHeader(API_KEY_HEADER, apiKey);
        }
        return builder.build();
    }

    static CustomizableThreadFactory named(String prefix) {
        CustomizableThreadFactory factory = new CustomizableThreadFactory(prefix + "-");
        factory.setDaemon(true);
        return factory;
    }
}
