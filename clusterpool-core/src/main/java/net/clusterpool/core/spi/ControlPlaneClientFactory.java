package net.clusterpool.core.spi;

import net.clusterpool.core.model.Credentials;

/** Builds a private control-plane handle for one entity's credentials. */
@FunctionalInterface
public interface ControlPlaneClientFactory {
    ControlPlaneClient forCredentials(Credentials credentials);
}
