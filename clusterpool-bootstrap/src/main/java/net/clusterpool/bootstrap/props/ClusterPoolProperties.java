package net.clusterpool.bootstrap.props;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@ConfigurationProperties("clusterpool")
public class ClusterPoolProperties {
    private Quota quota = new Quota();
    private ClusterDefaults cluster = new ClusterDefaults();
    private Scheduler scheduler = new Scheduler();
    private Aws aws = new Aws();
    private Configuration configuration = new Configuration();
    private Security security = new Security();
    private Catalog catalog = new Catalog();

    public Quota getQuota() { return quota; }
    public void setQuota(Quota quota) { this.quota = quota; }

    public ClusterDefaults getCluster() { return cluster; }
    public void setCluster(ClusterDefaults cluster) { this.cluster = cluster; }

    public Scheduler getScheduler() { return scheduler; }
    public void setScheduler(Scheduler scheduler) { this.scheduler = scheduler; }

    public Aws getAws() { return aws; }
    public void setAws(Aws aws) { this.aws = aws; }

    public Configuration getConfiguration() { return configuration; }
    public void setConfiguration(Configuration configuration) { this.configuration = configuration; }

    public Security getSecurity() { return security; }
    public void setSecurity(Security security) { this.security = security; }

    public Catalog getCatalog() { return catalog; }
    public void setCatalog(Catalog catalog) { this.catalog = catalog; }

    /**
     * Remote API budgets. {@code limits} is keyed by operation (create-cluster, add-work,
     * describe-cluster, terminate-cluster, cancel-work, describe-work); missing ones keep their defaults.
     */
    public static class Quota {
        private double coefficient = 1.0;
        private Map<String, Limit> limits = new LinkedHashMap<>();

        public double getCoefficient() { return coefficient; }
        public void setCoefficient(double coefficient) { this.coefficient = coefficient; }

        public Map<String, Limit> getLimits() { return limits; }
        public void setLimits(Map<String, Limit> limits) { this.limits = limits; }
    }

    public static class Limit {
        private int burst;
        private double refillPerSecond;

        public int getBurst() { return burst; }
        public void setBurst(int burst) { this.burst = burst; }

        public double getRefillPerSecond() { return refillPerSecond; }
        public void setRefillPerSecond(double refillPerSecond) { this.refillPerSecond = refillPerSecond; }
    }

    public static class ClusterDefaults {
        private Duration defaultLifetime = Duration.ofMinutes(240);
        private Duration idleGrace = Duration.ofMinutes(15);

        public Duration getDefaultLifetime() { return defaultLifetime; }
        public void setDefaultLifetime(Duration defaultLifetime) { this.defaultLifetime = defaultLifetime; }

        public Duration getIdleGrace() { return idleGrace; }
        public void setIdleGrace(Duration idleGrace) { this.idleGrace = idleGrace; }
    }

    public static class Scheduler {
        private boolean enabled = false;
        private long delayMs = 60_000;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public long getDelayMs() { return delayMs; }
        public void setDelayMs(long delayMs) { this.delayMs = delayMs; }
    }

    public static class Aws {
        private String region = "us-east-1";
        private URI endpoint; // EMR endpoint override, e.g. a local emulator

        public String getRegion() { return region; }
        public void setRegion(String region) { this.region = region; }

        public URI getEndpoint() { return endpoint; }
        public void setEndpoint(URI endpoint) { this.endpoint = endpoint; }
    }

    /** Template store. Without an access key the SDK's default credential chain is used. */
    public static class Configuration {
        private String uriTemplate = "s3://bi.config.dl/cluster-manager/{name}/{version}.json";
        private String accessKeyId;
        private String secretAccessKey;
        private String sessionToken;

        public String getUriTemplate() { return uriTemplate; }
        public void setUriTemplate(String uriTemplate) { this.uriTemplate = uriTemplate; }

        public String getAccessKeyId() { return accessKeyId; }
        public void setAccessKeyId(String accessKeyId) { this.accessKeyId = accessKeyId; }

        public String getSecretAccessKey() { return secretAccessKey; }
        public void setSecretAccessKey(String secretAccessKey) { this.secretAccessKey = secretAccessKey; }

        public String getSessionToken() { return sessionToken; }
        public void setSessionToken(String sessionToken) { this.sessionToken = sessionToken; }
    }

    public static class Security {
        private String credentialsKey;

        public String getCredentialsKey() { return credentialsKey; }
        public void setCredentialsKey(String credentialsKey) { this.credentialsKey = credentialsKey; }
    }

    public static class Catalog {
        private boolean enabled = false;
        private String owner = "catalog";
        private List<TemplateDef> templates = new ArrayList<>();

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getOwner() { return owner; }
        public void setOwner(String owner) { this.owner = owner; }

        public List<TemplateDef> getTemplates() { return templates; }
        public void setTemplates(List<TemplateDef> templates) { this.templates = templates; }
    }

    public static class TemplateDef {
        private String name;
        private String location; // classpath: or file: resource holding the launch config JSON

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public String getLocation() { return location; }
        public void setLocation(String location) { this.location = location; }

        @Override
        public String toString() {
            return "TemplateDef{name='" + name + "', location='" + location + "'}";
        }
    }
}
