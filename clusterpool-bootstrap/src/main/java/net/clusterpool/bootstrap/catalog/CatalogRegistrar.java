package net.clusterpool.bootstrap.catalog;

import net.clusterpool.bootstrap.props.ClusterPoolProperties;
import net.clusterpool.core.error.ConfigurationNotFoundException;
import net.clusterpool.core.json.Json;
import net.clusterpool.core.model.ClusterConfigRequest;
import net.clusterpool.core.model.LaunchConfig;
import net.clusterpool.core.service.ClusterConfigurationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Registers the launch-configuration templates listed under {@code clusterpool.catalog.templates}.
 * A template whose content matches its latest registered version is left alone, so restarts do not
 * pile up identical versions.
 */
public class CatalogRegistrar {
    private static final Logger log = LoggerFactory.getLogger(CatalogRegistrar.class);

    private final ClusterConfigurationService configurations;
    private final ResourceLoader resources;

    public CatalogRegistrar(ClusterConfigurationService configurations, ResourceLoader resources) {
        this.configurations = configurations;
        this.resources = resources;
    }

    /** @return number of templates that got a new version */
    public int register(ClusterPoolProperties.Catalog catalog) throws Exception {
        int registered = 0;
        for (var t : catalog.getTemplates()) {
            if (registerTemplate(t, catalog.getOwner())) registered++;
        }
        return registered;
    }

    private boolean registerTemplate(ClusterPoolProperties.TemplateDef def, String owner) throws Exception {
        if (def.getName() == null || def.getLocation() == null) {
            throw new IllegalArgumentException("template.name and template.location are required");
        }
        LaunchConfig config = LaunchConfig.of(Json.readObject(read(def.getLocation())));

        try {
            LaunchConfig latest = configurations.resolve(ClusterConfigRequest.template(def.getName()));
            if (latest.hash().equals(config.hash())) {
                log.info("Catalog template '{}' is up to date", def.getName());
                return false;
            }
        } catch (ConfigurationNotFoundException e) {
            log.debug("Catalog template '{}' not registered yet", def.getName());
        }

        var saved = configurations.register(def.getName(), config, owner);
        log.info("Catalog registered: template='{}' version={}", def.getName(), saved.version());
        return true;
    }

    private String read(String location) throws IOException {
        Resource r = resources.getResource(location);
        if (!r.exists()) throw new IOException("catalog template not found: " + location);
        try (InputStream in = r.getInputStream()) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
