package com.appreview.cdi;

import com.appreview.approval.LoggingConflictNotifier;
import com.appreview.approval.ReviewApprovalService;
import com.appreview.audit.AuditService;
import com.appreview.catalog.AppCatalog;
import com.appreview.catalog.InMemoryAppCatalog;
import com.appreview.directory.ActorDirectory;
import com.appreview.directory.InMemoryActorDirectory;
import com.appreview.lock.LocalReviewLock;
import com.appreview.lock.LockConfig;
import com.appreview.metrics.MetricsService;
import com.appreview.metrics.MicrometerMetricsService;
import com.appreview.metrics.NoOpMetricsService;
import com.appreview.rest.security.ApiKeyAuthFilter;
import com.appreview.rest.security.CorsConfig;
import com.appreview.rest.security.CorsFilter;
import com.appreview.rest.security.SecurityConfig;
import com.appreview.review.InMemoryReviewStore;
import com.appreview.review.ReviewStore;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * CDI producer that wires the review approval engine from MicroProfile Config properties.
 *
 * <pre>
 * review-approval.roster.supervisors=sup1,sup2,sup3
 * review-approval.roster.admins=admin1
 * review-approval.apps=app-1,app-2
 * review-approval.lock.timeout-ms=5000
 * review-approval.security.api-keys=ra-key-sup1=sup1,ra-key-admin=admin1
 * </pre>
 *
 * <p>The roster and app catalog are seeded in memory; deployments backed by a user
 * database or app registry replace the {@link ActorDirectory} and {@link AppCatalog}
 * beans with their own alternatives.</p>
 */
@ApplicationScoped
public class ReviewApprovalProducer {

    private static final Logger log = LoggerFactory.getLogger(ReviewApprovalProducer.class);

    // ── Roster & Catalog ──────────────────────────────────────

    @Inject
    @ConfigProperty(name = "review-approval.roster.supervisors")
    Optional<List<String>> supervisors;

    @Inject
    @ConfigProperty(name = "review-approval.roster.admins")
    Optional<List<String>> admins;

    @Inject
    @ConfigProperty(name = "review-approval.apps")
    Optional<List<String>> apps;

    // ── Locking ───────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "review-approval.lock.timeout-ms", defaultValue = "5000")
    long lockTimeoutMs;

    @Inject
    @ConfigProperty(name = "review-approval.lock.fair", defaultValue = "true")
    boolean lockFair;

    // ── Metrics ───────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "review-approval.metrics.enabled", defaultValue = "true")
    boolean metricsEnabled;

    @Inject
    Instance<MeterRegistry> meterRegistries;

    // ── Security ──────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "review-approval.security.enabled", defaultValue = "true")
    boolean securityEnabled;

    @Inject
    @ConfigProperty(name = "review-approval.security.api-key-header", defaultValue = "X-API-Key")
    String apiKeyHeader;

    @Inject
    @ConfigProperty(name = "review-approval.security.actor-header", defaultValue = "X-Actor-Id")
    String actorHeader;

    @Inject
    @ConfigProperty(name = "review-approval.security.api-keys")
    Optional<List<String>> apiKeys;

    // ── CORS ──────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "review-approval.cors.enabled", defaultValue = "false")
    boolean corsEnabled;

    @Inject
    @ConfigProperty(name = "review-approval.cors.allowed-origins", defaultValue = "*")
    String corsAllowedOrigins;

    @Inject
    @ConfigProperty(name = "review-approval.cors.allowed-methods", defaultValue = "GET,POST,PUT,DELETE,OPTIONS")
    String corsAllowedMethods;

    @Inject
    @ConfigProperty(name = "review-approval.cors.allowed-headers", defaultValue = "Content-Type,X-API-Key")
    String corsAllowedHeaders;

    @Inject
    @ConfigProperty(name = "review-approval.cors.max-age", defaultValue = "3600")
    long corsMaxAge;

    // ══════════════════════════════════════════════════════════
    //  Producers
    // ══════════════════════════════════════════════════════════

    @Produces
    @ApplicationScoped
    public ActorDirectory actorDirectory() {
        InMemoryActorDirectory directory = new InMemoryActorDirectory(
                supervisors.orElse(List.of()), admins.orElse(List.of()));
        log.info("Actor directory seeded: supervisors={} admins={}",
                directory.listEligibleSupervisors().size(), admins.map(List::size).orElse(0));
        return directory;
    }

    @Produces
    @ApplicationScoped
    public AppCatalog appCatalog() {
        InMemoryAppCatalog catalog = new InMemoryAppCatalog();
        apps.ifPresent(ids -> ids.forEach(catalog::register));
        return catalog;
    }

    @Produces
    @ApplicationScoped
    public ReviewStore reviewStore() {
        return new InMemoryReviewStore();
    }

    @Produces
    @ApplicationScoped
    public AuditService auditService() {
        return new AuditService();
    }

    @Produces
    @ApplicationScoped
    public MetricsService metricsService() {
        if (!metricsEnabled) {
            log.info("Metrics disabled");
            return new NoOpMetricsService();
        }
        MeterRegistry registry = meterRegistries.isResolvable()
                ? meterRegistries.get()
                : new SimpleMeterRegistry();
        return new MicrometerMetricsService(registry);
    }

    @Produces
    @ApplicationScoped
    public ReviewApprovalService reviewApprovalService(ReviewStore store, ActorDirectory directory,
                                                       AppCatalog appCatalog, AuditService auditService,
                                                       MetricsService metricsService) {
        LockConfig lockConfig = new LockConfig(lockTimeoutMs, lockFair);
        log.info("Producing ReviewApprovalService: lockTimeoutMs={} fair={}", lockTimeoutMs, lockFair);
        return ReviewApprovalService.builder()
                .store(store)
                .directory(directory)
                .appCatalog(appCatalog)
                .reviewLock(new LocalReviewLock(lockConfig))
                .auditService(auditService)
                .metrics(metricsService)
                .conflictNotifier(new LoggingConflictNotifier())
                .build();
    }

    @Produces
    @ApplicationScoped
    public SecurityConfig securityConfig() {
        SecurityConfig config = SecurityConfig.builder()
                .enabled(securityEnabled)
                .apiKeyHeader(apiKeyHeader)
                .actorHeader(actorHeader)
                .addKeyMappings(apiKeys.orElse(List.of()))
                .build();
        log.info("Security config: enabled={} keyCount={}", config.isEnabled(), config.keyCount());
        if (!config.isEnabled()) {
            log.warn("Security disabled: callers are identified by the '{}' header", actorHeader);
        }
        return config;
    }

    @Produces
    @ApplicationScoped
    public CorsConfig corsConfig() {
        return new CorsConfig(corsEnabled, CorsConfig.parseOrigins(corsAllowedOrigins), corsAllowedMethods,
                corsAllowedHeaders, corsMaxAge);
    }

    @Produces
    @ApplicationScoped
    public ApiKeyAuthFilter apiKeyAuthFilter(SecurityConfig config, ActorDirectory directory) {
        return new ApiKeyAuthFilter(config, directory);
    }

    @Produces
    @ApplicationScoped
    public CorsFilter corsFilter(CorsConfig config) {
        return new CorsFilter(config);
    }
}
