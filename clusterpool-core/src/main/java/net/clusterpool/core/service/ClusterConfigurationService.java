package net.clusterpool.core.service;

import net.clusterpool.core.error.ConfigurationNotFoundException;
import net.clusterpool.core.error.InvalidConfigurationException;
import net.clusterpool.core.error.UnableToUploadContentException;
import net.clusterpool.core.json.Json;
import net.clusterpool.core.model.ClusterConfigRequest;
import net.clusterpool.core.model.ClusterConfiguration;
import net.clusterpool.core.model.LaunchConfig;
import net.clusterpool.core.spi.Clock;
import net.clusterpool.core.spi.ClusterConfigurationRepository;
import net.clusterpool.core.spi.ContentStore;
import net.clusterpool.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Named, versioned launch-configuration templates. Content lives in the {@link ContentStore};
 * the repository indexes name, version and location.
 */
public final class ClusterConfigurationService {
    private static final Logger log = LoggerFactory.getLogger(ClusterConfigurationService.class);

    public static final String DEFAULT_URI_TEMPLATE = "s3://bi.config.dl/cluster-manager/{name}/{version}.json";
    static final Set<String> CUSTOMIZABLE = Set.of("instance_type", "instance_count", "volume_size");

    private static final DateTimeFormatter VERSION =
            DateTimeFormatter.ofPattern("yyyyMMddHHmmssSSSSSS").withZone(ZoneOffset.UTC);

    private final ClusterConfigurationRepository configurations;
    private final ContentStore store;
    private final TxRunner tx;
    private final Clock clock;
    private final String uriTemplate;

    public ClusterConfigurationService(ClusterConfigurationRepository configurations, ContentStore store,
                                       TxRunner tx, Clock clock, String uriTemplate) {
        this.configurations = configurations;
        this.store = store;
        this.tx = tx;
        this.clock = clock;
        this.uriTemplate = uriTemplate == null ? DEFAULT_URI_TEMPLATE : uriTemplate;
    }

    /** Stores a new version of {@code name}; versions sort by registration time. */
    public ClusterConfiguration register(String name, LaunchConfig launchConfig, String actor) throws Exception {
        if (name == null || name.isBlank()) throw new InvalidConfigurationException("configuration name is required");
        var now = clock.now();
        String version = VERSION.format(now);
        String uri = uriTemplate.replace("{name}", name).replace("{version}", version);

        try {
            store.upload(uri, launchConfig.canonicalJson().getBytes(StandardCharsets.UTF_8));
        } catch (UnableToUploadContentException e) {
            log.error("Unable to upload config {} - msg: {}", name, e.getMessage());
            throw e;
        }
        ClusterConfiguration saved = tx.required(() ->
                configurations.insert(new ClusterConfiguration(null, name, version, uri, actor, now)));
        log.info("Registered configuration {} version {} at {}", name, version, uri);
        return saved;
    }

    public List<ClusterConfiguration> versions(String name) throws Exception {
        return tx.required(() -> configurations.findAllByName(name));
    }

    /**
     * Turns a request into a launch config. Inline configs are used as given. Templates are
     * fetched (latest version unless one is named), then extra bootstrap actions and
     * customizations are applied.
     */
    public LaunchConfig resolve(ClusterConfigRequest request) throws Exception {
        if (request == null) throw new InvalidConfigurationException("a launch config or a configuration name is required");
        if (request.isInline()) {
            if (request.name() != null) {
                throw new InvalidConfigurationException("You must provide either a launch config or a name. Not both.");
            }
            return LaunchConfig.of(request.inline());
        }
        if (request.name() == null || request.name().isBlank()) {
            throw new InvalidConfigurationException("a launch config or a configuration name is required");
        }

        ClusterConfiguration cfg = tx.required(() -> request.version() == null
                ? configurations.findLatest(request.name())
                : configurations.findByNameAndVersion(request.name(), request.version()))
                .orElseThrow(() -> new ConfigurationNotFoundException(request.version() == null
                        ? "Configuration " + request.name() + " does not exist"
                        : "Configuration " + request.name() + " with version: " + request.version() + " does not exist"));

        Map<String, Object> doc;
        try {
            doc = Json.readObject(new String(store.download(cfg.contentUri()), StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new ConfigurationNotFoundException("Unable to read configuration content at " + cfg.contentUri(), e);
        }

        appendBootstrapActions(doc, request.bootstrapActions());
        applyCustomizations(doc, request.customParameters());
        return LaunchConfig.of(doc);
    }

    @SuppressWarnings("unchecked")
    static void appendBootstrapActions(Map<String, Object> doc, List<Map<String, Object>> actions) {
        if (actions == null || actions.isEmpty()) return;
        Object existing = doc.get("BootstrapActions");
        List<Object> merged = existing instanceof List<?> l ? new ArrayList<>((List<Object>) l) : new ArrayList<>();
        merged.addAll(actions);
        doc.put("BootstrapActions", merged);
    }

    static void applyCustomizations(Map<String, Object> doc, Map<String, Object> params) throws InvalidConfigurationException {
        if (params == null || params.isEmpty()) return;
        for (var e : params.entrySet()) {
            if (!CUSTOMIZABLE.contains(e.getKey())) {
                throw new InvalidConfigurationException(e.getKey() + " is not a customizable parameter. "
                        + "Accepted parameters are: instance_count, instance_type, volume_size");
            }
        }
        try {
            for (var e : params.entrySet()) {
                Object value = e.getValue();
                if (value == null) continue;
                switch (e.getKey()) {
                    case "instance_type" -> instanceGroup(doc, 1).put("InstanceType", value);
                    case "instance_count" -> instanceGroup(doc, 1).put("InstanceCount", value);
                    case "volume_size" -> {
                        volumeSpec(instanceGroup(doc, 0)).put("SizeInGB", value);
                        volumeSpec(instanceGroup(doc, 1)).put("SizeInGB", value);
                    }
                    default -> { }
                }
            }
        } catch (ClassCastException | IndexOutOfBoundsException | NullPointerException ex) {
            throw new InvalidConfigurationException("The configuration does not have the instance groups to customize", ex);
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> instanceGroup(Map<String, Object> doc, int index) {
        Map<String, Object> instances = (Map<String, Object>) doc.get("Instances");
        List<Object> groups = (List<Object>) instances.get("InstanceGroups");
        return (Map<String, Object>) groups.get(index);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> volumeSpec(Map<String, Object> group) {
        Map<String, Object> ebs = (Map<String, Object>) group.get("EbsConfiguration");
        List<Object> devices = (List<Object>) ebs.get("EbsBlockDeviceConfigs");
        return (Map<String, Object>) ((Map<String, Object>) devices.get(0)).get("VolumeSpecification");
    }
}
