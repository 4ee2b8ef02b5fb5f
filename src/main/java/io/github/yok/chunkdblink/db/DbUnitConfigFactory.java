package io.github.yok.chunkdblink.db;

import io.github.yok.chunkdblink.config.DbUnitConfigProperties;
import lombok.extern.slf4j.Slf4j;
import org.dbunit.database.DatabaseConfig;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Factory class that applies the chunk-write settings to DBUnit's {@link DatabaseConfig}.
 *
 * <p>
 * Sets the store's data type factory and identifier escaping, the batching properties from
 * {@link DbUnitConfigProperties}, and the table types DBUnit lists when it looks up the target
 * table.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
public class DbUnitConfigFactory {

    // H2 2.x reports ordinary tables as "BASE TABLE"
    static final String[] TABLE_TYPES = {"TABLE", "BASE TABLE"};

    // Properties class that externalizes DBUnit settings
    private final DbUnitConfigProperties props;

    /**
     * Creates a factory applying the given properties.
     *
     * @param props DBUnit settings
     */
    @Autowired
    public DbUnitConfigFactory(DbUnitConfigProperties props) {
        this.props = props;
    }

    /**
     * No-args constructor using {@link DbUnitConfigProperties} defaults, for use outside the
     * Spring container.
     */
    public DbUnitConfigFactory() {
        this.props = new DbUnitConfigProperties();
    }

    /**
     * Applies the settings to the specified {@link DatabaseConfig}.
     *
     * @param cfg DBUnit {@link DatabaseConfig} object
     * @param dialect dialect of the target store
     */
    public void configure(DatabaseConfig cfg, StoreDialect dialect) {
        cfg.setProperty(DatabaseConfig.PROPERTY_DATATYPE_FACTORY, dialect.createDataTypeFactory());
        log.debug("DBUnit: DataTypeFactory for {}", dialect);

        // Column names come from CSV headers and may contain spaces or mixed case
        cfg.setProperty(DatabaseConfig.PROPERTY_ESCAPE_PATTERN, dialect.getEscapePattern());
        log.debug("DBUnit: escape pattern = {}", dialect.getEscapePattern());

        cfg.setProperty(DatabaseConfig.PROPERTY_TABLE_TYPE, TABLE_TYPES);

        cfg.setProperty(DatabaseConfig.FEATURE_ALLOW_EMPTY_FIELDS, props.isAllowEmptyFields());
        log.debug("DBUnit: allow empty fields = {}", props.isAllowEmptyFields());

        cfg.setProperty(DatabaseConfig.FEATURE_BATCHED_STATEMENTS, props.isBatchedStatements());
        log.debug("DBUnit: batched statements enabled = {}", props.isBatchedStatements());

        cfg.setProperty(DatabaseConfig.PROPERTY_BATCH_SIZE, props.getBatchSize());
        log.debug("DBUnit: batch size = {}", props.getBatchSize());
    }
}
