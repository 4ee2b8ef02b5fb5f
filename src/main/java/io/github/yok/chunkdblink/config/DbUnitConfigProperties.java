package io.github.yok.chunkdblink.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Holds properties applied to DBUnit's {@code DatabaseConfig} for chunk writes.
 *
 * <p>
 * Specify the following properties in {@code application.yml}.
 * </p>
 * <ul>
 * <li>{@code dbunit.config.allow-empty-fields}: Whether empty text values are written as-is</li>
 * <li>{@code dbunit.config.batched-statements}: Whether chunk rows are sent as JDBC batches</li>
 * <li>{@code dbunit.config.batch-size}: Rows per JDBC batch</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties(prefix = "dbunit.config")
@Getter
@Setter
@NoArgsConstructor
public class DbUnitConfigProperties {

    /**
     * Specifies whether DBUnit permits empty fields (i.e., {@code ""}).
     */
    private boolean allowEmptyFields = true;

    /**
     * Specifies whether chunk rows are inserted with batched statements.
     */
    private boolean batchedStatements = true;

    /**
     * Specifies the number of rows per JDBC batch.
     */
    private int batchSize = 1000;
}
