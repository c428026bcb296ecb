package net.clusterpool.integration.spring;

import net.clusterpool.adapter.jdbc.crypto.CredentialsCipher;
import net.clusterpool.adapter.jdbc.repo.JdbcClusterConfigurationRepository;
import net.clusterpool.adapter.jdbc.repo.JdbcClusterRepository;
import net.clusterpool.adapter.jdbc.repo.JdbcWorkUnitRepository;
import net.clusterpool.core.spi.Clock;
import net.clusterpool.core.spi.ClusterConfigurationRepository;
import net.clusterpool.core.spi.ClusterRepository;
import net.clusterpool.core.spi.TxRunner;
import net.clusterpool.core.spi.WorkUnitRepository;
import net.clusterpool.integration.spring.tx.SpringTxRunner;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;
import java.time.Instant;

@Configuration
public class ClusterPoolSpringConfig {

    @Bean
    public TxRunner txRunner(PlatformTransactionManager tm, DataSource ds) {
        return new SpringTxRunner(tm, ds);
    }

    // blank key: credentials sealed with a per-process key (logged at WARN)
    @Bean
    public CredentialsCipher credentialsCipher(@Value("${clusterpool.security.credentials-key:}") String key) {
        return CredentialsCipher.fromBase64(key);
    }

    // repositories from adapter-jdbc
    @Bean public WorkUnitRepository workUnitRepository(DataSource ds, CredentialsCipher cipher) { return new JdbcWorkUnitRepository(ds, cipher); }
    @Bean public ClusterRepository clusterRepository(DataSource ds, CredentialsCipher cipher) { return new JdbcClusterRepository(ds, cipher); }
    @Bean public ClusterConfigurationRepository clusterConfigurationRepository(DataSource ds) { return new JdbcClusterConfigurationRepository(ds); }

    @Bean public Clock systemClock() { return Instant::now; }
}
