package net.clusterpool.bootstrap.autoconfigure;

import net.clusterpool.adapter.aws.AwsControlPlaneClientFactory;
import net.clusterpool.adapter.aws.S3ContentStore;
import net.clusterpool.bootstrap.catalog.CatalogRegistrar;
import net.clusterpool.bootstrap.props.ClusterPoolProperties;
import net.clusterpool.core.metrics.LoggingMetricsSink;
import net.clusterpool.core.model.Credentials;
import net.clusterpool.core.quota.OperationKind;
import net.clusterpool.core.quota.QuotaBucket;
import net.clusterpool.core.quota.QuotaPolicy;
import net.clusterpool.core.service.*;
import net.clusterpool.core.spi.*;
import net.clusterpool.integration.spring.ClusterPoolSpringConfig;
import net.clusterpool.integration.spring.metrics.MicrometerMetricsSink;
import net.clusterpool.integration.spring.sched.ClusterPoolScheduler;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.core.io.ResourceLoader;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.util.EnumMap;
import java.util.Map;

@AutoConfiguration
@EnableConfigurationProperties(ClusterPoolProperties.class)
@Import(ClusterPoolSpringConfig.class) // integration-spring: repos/tx/clock/cipher wiring
public class ClusterPoolAutoConfiguration {
    private static final Logger log = LoggerFactory.getLogger(ClusterPoolAutoConfiguration.class);

    // --- SPI defaults ---

    @Bean
    @ConditionalOnMissingBean
    public QuotaPolicy quotaPolicy(ClusterPoolProperties props) {
        var quota = props.getQuota();
        Map<OperationKind, QuotaBucket> buckets = new EnumMap<>(OperationKind.class);
        for (var e : quota.getLimits().entrySet()) {
            buckets.put(OperationKind.fromKey(e.getKey()),
                    new QuotaBucket(e.getValue().getBurst(), e.getValue().getRefillPerSecond()));
        }
        return new QuotaPolicy(buckets, quota.getCoefficient());
    }

    @Bean
    @ConditionalOnMissingBean
    public PassSettings passSettings(QuotaPolicy quota, ClusterPoolProperties props) {
        var c = props.getCluster();
        return new PassSettings(quota, Sleeper.THREAD, c.getIdleGrace(), c.getDefaultLifetime());
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean(ControlPlaneClientFactory.class)
    public AwsControlPlaneClientFactory controlPlaneClientFactory(ClusterPoolProperties props) {
        return new AwsControlPlaneClientFactory(props.getAws().getEndpoint());
    }

    @Bean
    @ConditionalOnMissingBean(ContentStore.class)
    public S3ContentStore contentStore(ClusterPoolProperties props) {
        var c = props.getConfiguration();
        if (c.getAccessKeyId() == null || c.getAccessKeyId().isBlank()) {
            log.info("Configuration store uses the default AWS credential chain (region={})", props.getAws().getRegion());
            return S3ContentStore.forRegion(props.getAws().getRegion());
        }
        return S3ContentStore.forKey(new Credentials.AccessKey(
                c.getAccessKeyId(), c.getSecretAccessKey(), c.getSessionToken(), props.getAws().getRegion()));
    }

    @Bean
    @ConditionalOnMissingBean
    public MetricsSink metricsSink(ObjectProvider<MeterRegistry> registry) {
        MeterRegistry r = registry.getIfAvailable();
        return r == null ? new LoggingMetricsSink() : new MicrometerMetricsSink(r);
    }

    // --- core services ---

    @Bean
    @ConditionalOnMissingBean
    public EntityBinder entityBinder(ControlPlaneClientFactory factory) {
        return new EntityBinder(factory);
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public ReconciliationService reconciliation(ClusterRepository clusters,
                                                WorkUnitRepository workUnits,
                                                TxRunner tx,
                                                EntityBinder binder,
                                                Clock clock,
                                                PassSettings settings) {
        return new ReconciliationService(clusters, workUnits, tx, binder, clock, settings.idleGrace());
    }

    @Bean
    @ConditionalOnMissingBean
    public AssignmentService assignment(WorkUnitRepository workUnits,
                                        ClusterRepository clusters,
                                        TxRunner tx,
                                        EntityBinder binder,
                                        Clock clock,
                                        MetricsSink metrics) {
        return new AssignmentService(workUnits, clusters, tx, binder, clock, metrics);
    }

    @Bean
    @ConditionalOnMissingBean
    public ExpiryService expiry(ClusterRepository clusters, EntityBinder binder, Clock clock) {
        return new ExpiryService(clusters, binder, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public PassOrchestrator passOrchestrator(ReconciliationService reconciliation,
                                             AssignmentService assignment,
                                             ExpiryService expiry,
                                             TxRunner tx,
                                             PassSettings settings) {
        return new PassOrchestrator(reconciliation, assignment, expiry, tx, settings);
    }

    @Bean
    @ConditionalOnMissingBean
    public ClusterConfigurationService clusterConfigurations(ClusterConfigurationRepository configurations,
                                                             ContentStore store,
                                                             TxRunner tx,
                                                             Clock clock,
                                                             ClusterPoolProperties props) {
        return new ClusterConfigurationService(configurations, store, tx, clock,
                props.getConfiguration().getUriTemplate());
    }

    @Bean
    @ConditionalOnMissingBean
    public WorkUnitService workUnits(WorkUnitRepository workUnits,
                                     ClusterRepository clusters,
                                     TxRunner tx,
                                     EntityBinder binder,
                                     ClusterConfigurationService configurations,
                                     Clock clock,
                                     MetricsSink metrics,
                                     PassSettings settings) {
        return new WorkUnitService(workUnits, clusters, tx, binder, configurations, clock, metrics, settings);
    }

    @Bean
    @ConditionalOnMissingBean
    public ClusterService clusters(ClusterRepository clusters,
                                   TxRunner tx,
                                   EntityBinder binder,
                                   ClusterConfigurationService configurations,
                                   Clock clock,
                                   MetricsSink metrics,
                                   PassSettings settings) {
        return new ClusterService(clusters, tx, binder, configurations, clock, metrics, settings);
    }

    // --- scheduler (delay read from clusterpool.scheduler.delay-ms) ---

    @Configuration(proxyBeanMethods = false)
    @EnableScheduling
    @ConditionalOnProperty(prefix = "clusterpool.scheduler", name = "enabled", havingValue = "true")
    static class SchedulerConfiguration {
        @Bean
        public ClusterPoolScheduler clusterPoolScheduler(PassOrchestrator orchestrator) {
            return new ClusterPoolScheduler(orchestrator);
        }
    }

    // --- catalog ---

    @Bean
    public CatalogRegistrar catalogRegistrar(ClusterConfigurationService configurations, ResourceLoader resources) {
        return new CatalogRegistrar(configurations, resources);
    }

    @Bean
    @ConditionalOnProperty(prefix = "clusterpool.catalog", name = "enabled", havingValue = "true")
    public ApplicationRunner catalogRunner(CatalogRegistrar registrar, ClusterPoolProperties props) {
        log.info("Catalog runner: {} template(s) {}", props.getCatalog().getTemplates().size(),
                props.getCatalog().getTemplates());
        return args -> registrar.register(props.getCatalog());
    }
}
