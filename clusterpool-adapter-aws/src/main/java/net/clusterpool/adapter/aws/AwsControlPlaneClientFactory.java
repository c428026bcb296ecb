package net.clusterpool.adapter.aws;

import net.clusterpool.core.model.Credentials;
import net.clusterpool.core.spi.ControlPlaneClient;
import net.clusterpool.core.spi.ControlPlaneClientFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.emr.EmrClient;

import java.lang.ref.Cleaner;
import java.net.URI;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * Builds an {@link EmrControlPlaneClient} per access key. SDK clients are kept in a small LRU
 * keyed by the access key, so repeated passes over the same entity reuse one HTTP connection pool.
 * <p>
 * Every handed-out client holds a lease on its SDK client. An SDK client evicted from the LRU stays
 * open until the last lease is released, i.e. until every entity bound to it has been collected,
 * or until the factory itself is closed.
 */
public final class AwsControlPlaneClientFactory implements ControlPlaneClientFactory, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(AwsControlPlaneClientFactory.class);

    static final int MAX_CACHED_CLIENTS = 64;

    private static final Cleaner CLEANER = Cleaner.create();

    private final Function<Credentials.AccessKey, EmrClient> builder;
    private final BiConsumer<Object, Runnable> onUnreachable;
    private final Set<Shared> retired = new HashSet<>();
    private final Map<Credentials.AccessKey, Shared> clients =
            new LinkedHashMap<>(16, 0.75f, true) {
                @Override
                protected boolean removeEldestEntry(Map.Entry<Credentials.AccessKey, Shared> eldest) {
                    if (size() <= MAX_CACHED_CLIENTS) return false;
                    Shared s = eldest.getValue();
                    if (s.leases == 0) {
                        s.close();
                    } else {
                        retired.add(s);
                    }
                    return true;
                }
            };

    /** @param endpointOverride alternate EMR endpoint (a local emulator, say); null for the regional default */
    public AwsControlPlaneClientFactory(URI endpointOverride) {
        this(key -> {
            var b = EmrClient.builder()
                    .region(Region.of(key.region()))
                    .credentialsProvider(StaticKeys.provider(key));
            if (endpointOverride != null) b.endpointOverride(endpointOverride);
            return b.build();
        });
    }

    AwsControlPlaneClientFactory(Function<Credentials.AccessKey, EmrClient> builder) {
        this(builder, CLEANER::register);
    }

    /** @param onUnreachable registers an action to run once the given client is unreachable */
    AwsControlPlaneClientFactory(Function<Credentials.AccessKey, EmrClient> builder,
                                 BiConsumer<Object, Runnable> onUnreachable) {
        this.builder = builder;
        this.onUnreachable = onUnreachable;
    }

    @Override
    public ControlPlaneClient forCredentials(Credentials credentials) {
        Shared shared;
        synchronized (clients) {
            shared = clients.computeIfAbsent(credentials.controlPlane(), k -> new Shared(builder.apply(k)));
            shared.leases++;
        }
        EmrControlPlaneClient client = new EmrControlPlaneClient(shared.emr);
        // the action must not reference the client itself
        onUnreachable.accept(client, () -> release(shared));
        return client;
    }

    private void release(Shared shared) {
        synchronized (clients) {
            shared.leases--;
            if (shared.leases == 0 && retired.remove(shared)) {
                shared.close();
            }
        }
    }

    int cachedClients() {
        synchronized (clients) { return clients.size(); }
    }

    int retiredClients() {
        synchronized (clients) { return retired.size(); }
    }

    @Override
    public void close() {
        synchronized (clients) {
            clients.values().forEach(Shared::close);
            clients.clear();
            retired.forEach(Shared::close);
            retired.clear();
        }
    }

    private static final class Shared {
        final EmrClient emr;
        int leases;
        boolean closed;

        Shared(EmrClient emr) {
            this.emr = emr;
        }

        void close() {
            if (closed) return;
            closed = true;
            try {
                emr.close();
            } catch (RuntimeException e) {
                log.warn("Failed to close EMR client - msg: {}", e.getMessage());
            }
        }
    }
}
