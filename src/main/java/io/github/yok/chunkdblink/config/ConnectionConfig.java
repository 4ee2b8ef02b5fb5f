package io.github.yok.chunkdblink.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration class that holds the relational store connection settings loaded from the
 * {@code store} section of {@code application.yml}.
 *
 * <pre>
 * store:
 *   url: jdbc:h2:./data/chunkdblink
 *   user: sa
 *   password:
 *   driver-class: org.h2.Driver
 * </pre>
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties(prefix = "store")
@Data
public class ConnectionConfig {

    // JDBC connection URL (e.g., jdbc:h2:./data/chunkdblink)
    private String url = "jdbc:h2:./data/chunkdblink";

    // Database user name
    private String user = "sa";

    // Database password
    private String password = "";

    // Fully qualified JDBC driver class name; blank relies on JDBC 4 auto-loading
    private String driverClass;
}
