package com.khaounen.edgeguard.security.admission;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.khaounen.edgeguard.admin.ExclusionAdminController;
import com.khaounen.edgeguard.admin.TelemetryStatusController;
import com.khaounen.edgeguard.config.RequestContextFilter;
import com.khaounen.edgeguard.security.alert.ExclusionAlertDispatcher;
import com.khaounen.edgeguard.security.alert.ExclusionAlertProperties;
import com.khaounen.edgeguard.security.concurrency.ConcurrencyGate;
import com.khaounen.edgeguard.security.escalation.ViolationEscalator;
import com.khaounen.edgeguard.security.exclusion.ExclusionListener;
import com.khaounen.edgeguard.security.exclusion.ExclusionRegistry;
import com.khaounen.edgeguard.security.exclusion.IpsetPacketFilterBackend;
import com.khaounen.edgeguard.security.exclusion.NoOpPacketFilterBackend;
import com.khaounen.edgeguard.security.exclusion.PacketFilterBackend;
import com.khaounen.edgeguard.security.exclusion.PacketFilterSynchronizer;
import com.khaounen.edgeguard.security.filters.AdmissionFilter;
import com.khaounen.edgeguard.security.ratelimit.CompositeRateLimiter;
import com.khaounen.edgeguard.security.ratelimit.RateLimiter;
import com.khaounen.edgeguard.security.ratelimit.SlidingWindowRateLimiter;
import com.khaounen.edgeguard.security.ratelimit.TokenBucketRateLimiter;
import com.khaounen.edgeguard.store.CaffeineAddressStateStore;
import com.khaounen.edgeguard.store.IdleEvictable;
import com.khaounen.edgeguard.telemetry.HostStatsProvider;
import com.khaounen.edgeguard.telemetry.HostTelemetrySampler;
import com.khaounen.edgeguard.telemetry.MetricsCsvWriter;
import com.khaounen.edgeguard.telemetry.ProcfsHostStatsProvider;
import com.khaounen.edgeguard.telemetry.TelemetrySink;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.mail.javamail.JavaMailSender;

import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Slf4j
@AutoConfiguration
@EnableConfigurationProperties({EdgeGuardProperties.class, ExclusionAlertProperties.class})
public class EdgeGuardAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock edgeGuardClock() {
        return Clock.systemUTC();
    }

    @Bean(name = "edgeGuardRequestContextFilter")
    @ConditionalOnMissingBean
    public RequestContextFilter requestContextFilter(EdgeGuardProperties properties) {
        return new RequestContextFilter(properties.isTrustForwardedHeaders());
    }

    @Bean
    @ConditionalOnMissingBean
    public PacketFilterBackend packetFilterBackend(EdgeGuardProperties properties) {
        EdgeGuardProperties.PacketFilter packetFilter = properties.getPacketFilter();
        if (!packetFilter.isEnabled()) {
            return new NoOpPacketFilterBackend();
        }
        return new IpsetPacketFilterBackend(
                packetFilter.getCommand(),
                packetFilter.getSetName(),
                Duration.ofMillis(packetFilter.getTimeoutMs())
        );
    }

    @Bean
    @ConditionalOnMissingBean
    public PacketFilterSynchronizer packetFilterSynchronizer(PacketFilterBackend backend) {
        return new PacketFilterSynchronizer(backend);
    }

    @Bean
    @ConditionalOnMissingBean
    public ExclusionRegistry exclusionRegistry(
            PacketFilterSynchronizer synchronizer,
            EdgeGuardProperties properties,
            Clock clock
    ) {
        ExclusionRegistry registry = new ExclusionRegistry(new CaffeineAddressStateStore<>("exclusions"), synchronizer);
        EdgeGuardProperties.PacketFilter packetFilter = properties.getPacketFilter();
        if (packetFilter.isEnabled() && packetFilter.isReconcileOnStartup()) {
            registry.reconcile(clock.instant());
        }
        return registry;
    }

    @Bean
    @ConditionalOnMissingBean
    public TokenBucketRateLimiter tokenBucketRateLimiter(EdgeGuardProperties properties) {
        EdgeGuardProperties.RateLimit rateLimit = properties.getRateLimit();
        return new TokenBucketRateLimiter(
                rateLimit.getRateBase(),
                rateLimit.getRateBurst(),
                new CaffeineAddressStateStore<>("buckets")
        );
    }

    @Bean
    @ConditionalOnMissingBean
    public SlidingWindowRateLimiter slidingWindowRateLimiter(EdgeGuardProperties properties) {
        EdgeGuardProperties.RateLimit rateLimit = properties.getRateLimit();
        return new SlidingWindowRateLimiter(
                Duration.ofSeconds(rateLimit.getWindowSeconds()),
                rateLimit.getWindowMaxRequests(),
                new CaffeineAddressStateStore<>("windows")
        );
    }

    @Bean
    @Primary
    @ConditionalOnMissingBean(name = "edgeGuardRateLimiter")
    public RateLimiter edgeGuardRateLimiter(
            EdgeGuardProperties properties,
            TokenBucketRateLimiter tokenBucket,
            SlidingWindowRateLimiter slidingWindow
    ) {
        return switch (properties.getRateLimit().getStrategy()) {
            case TOKEN_BUCKET -> tokenBucket;
            case SLIDING_WINDOW -> slidingWindow;
            case BOTH -> new CompositeRateLimiter(slidingWindow, tokenBucket);
        };
    }

    @Bean
    @ConditionalOnMissingBean
    public ConcurrencyGate concurrencyGate(EdgeGuardProperties properties, Clock clock) {
        EdgeGuardProperties.Concurrency concurrency = properties.getConcurrency();
        return new ConcurrencyGate(
                concurrency.getPerAddressLimit(),
                concurrency.getGlobalLimit(),
                new CaffeineAddressStateStore<>("concurrency"),
                clock
        );
    }

    @Bean
    @ConditionalOnMissingBean
    public ViolationEscalator violationEscalator(ExclusionRegistry registry, EdgeGuardProperties properties) {
        EdgeGuardProperties.Escalation escalation = properties.getEscalation();
        return new ViolationEscalator(
                new CaffeineAddressStateStore<>("violations"),
                registry,
                escalation.getBanThreshold(),
                Duration.ofSeconds(escalation.getBanSeconds()),
                escalation.isBanPermanent(),
                escalation.getProfile()
        );
    }

    @Bean
    @ConditionalOnMissingBean
    public ExclusionAlertDispatcher exclusionAlertDispatcher(
            ExclusionAlertProperties properties,
            ObjectProvider<ObjectMapper> objectMapperProvider,
            ObjectProvider<JavaMailSender> mailSenderProvider
    ) {
        return new ExclusionAlertDispatcher(properties, objectMapperProvider, mailSenderProvider);
    }

    @Bean
    public SmartInitializingSingleton exclusionListenerRegistration(
            ExclusionRegistry registry,
            ObjectProvider<ExclusionListener> listeners
    ) {
        return () -> listeners.orderedStream().forEach(registry::addListener);
    }

    @Bean
    @ConditionalOnMissingBean
    public AdmissionEngine admissionEngine(
            ExclusionRegistry registry,
            ConcurrencyGate concurrencyGate,
            RateLimiter rateLimiter,
            ViolationEscalator escalator,
            EdgeGuardProperties properties
    ) {
        return new AdmissionEngine(registry, concurrencyGate, rateLimiter, escalator, properties);
    }

    @Bean
    @ConditionalOnMissingBean
    public AdmissionFilter admissionFilter(EdgeGuardProperties properties, AdmissionEngine engine, Clock clock) {
        return new AdmissionFilter(properties, engine, clock);
    }

    @Bean(initMethod = "start")
    @ConditionalOnMissingBean
    public IdleStateSweeper idleStateSweeper(
            ExclusionRegistry registry,
            TokenBucketRateLimiter tokenBucket,
            SlidingWindowRateLimiter slidingWindow,
            ConcurrencyGate concurrencyGate,
            ViolationEscalator escalator,
            EdgeGuardProperties properties,
            Clock clock
    ) {
        List<IdleEvictable> evictables = new ArrayList<>(List.of(tokenBucket, slidingWindow, concurrencyGate, escalator));
        EdgeGuardProperties.State state = properties.getState();
        return new IdleStateSweeper(registry, evictables, state.getIdleTtl(), state.getSweepInterval(), clock);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "edge-guard.admin", name = "enabled", havingValue = "true")
    public ExclusionAdminController exclusionAdminController(
            ExclusionRegistry registry,
            ConcurrencyGate concurrencyGate,
            EdgeGuardProperties properties,
            Clock clock
    ) {
        log.warn("edge-guard admin endpoints are enabled and unauthenticated; expose them on a trusted network only");
        return new ExclusionAdminController(registry, concurrencyGate, properties, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "edge-guard.telemetry", name = "enabled", havingValue = "true")
    public HostStatsProvider hostStatsProvider() {
        return new ProcfsHostStatsProvider();
    }

    @Bean(initMethod = "start")
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "edge-guard.telemetry", name = "enabled", havingValue = "true")
    public HostTelemetrySampler hostTelemetrySampler(
            HostStatsProvider provider,
            EdgeGuardProperties properties,
            Clock clock
    ) {
        EdgeGuardProperties.Telemetry telemetry = properties.getTelemetry();
        List<TelemetrySink> sinks = new ArrayList<>();
        if (telemetry.getCsvFile() != null && !telemetry.getCsvFile().isBlank()) {
            sinks.add(new MetricsCsvWriter(Paths.get(telemetry.getCsvFile())));
        }
        return new HostTelemetrySampler(provider, sinks, telemetry.getInterval(), telemetry.getLinkSpeedMbps(), clock);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "edge-guard.telemetry", name = "enabled", havingValue = "true")
    public TelemetryStatusController telemetryStatusController(HostTelemetrySampler sampler) {
        return new TelemetryStatusController(sampler);
    }
}
