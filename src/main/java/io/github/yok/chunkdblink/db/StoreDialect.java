package io.github.yok.chunkdblink.db;

import io.github.yok.chunkdblink.dataset.Chunk;
import io.github.yok.chunkdblink.dataset.ColumnType;
import java.sql.DatabaseMetaData;
import java.sql.SQLException;
import java.util.Locale;
import java.util.stream.Collectors;
import lombok.AllArgsConstructor;
import lombok.Getter;
import org.apache.commons.lang3.StringUtils;
import org.dbunit.dataset.datatype.DefaultDataTypeFactory;
import org.dbunit.dataset.datatype.IDataTypeFactory;
import org.dbunit.ext.h2.H2DataTypeFactory;
import org.dbunit.ext.mysql.MySqlDataTypeFactory;
import org.dbunit.ext.postgresql.PostgresqlDataTypeFactory;

/**
 * SQL grammar differences between the supported relational stores.
 *
 * <p>
 * Only what the table loader needs is covered: identifier quoting and case folding, the SQL type
 * of each {@link ColumnType}, table and column DDL, and the DBUnit data type factory.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@AllArgsConstructor
public enum StoreDialect {

    H2('"', "TINYINT", "DOUBLE PRECISION", "VARCHAR"),

    POSTGRESQL('"', "SMALLINT", "DOUBLE PRECISION", "TEXT"),

    MYSQL('`', "TINYINT", "DOUBLE", "TEXT"),

    // Any other JDBC store, ANSI types only
    GENERIC('"', "SMALLINT", "DOUBLE PRECISION", "VARCHAR(4000)");

    // Identifier quote character
    private final char quote;

    // SQL type used for 8-bit integers
    private final String int8Type;

    // SQL type used for 64-bit floating point
    private final String float64Type;

    // SQL type used for text and categorical columns
    private final String textType;

    /**
     * Resolves the dialect of a store.
     *
     * <p>
     * Resolution priority is {@code driver-class} first, then JDBC URL.
     * </p>
     *
     * @param url JDBC URL
     * @param driverClass JDBC driver class name, may be blank
     * @return resolved dialect, {@link #GENERIC} when nothing matches
     */
    public static StoreDialect resolve(String url, String driverClass) {
        String driver = StringUtils.defaultString(driverClass).toLowerCase(Locale.ROOT);
        if (driver.contains("h2")) {
            return H2;
        }
        if (driver.contains("postgresql")) {
            return POSTGRESQL;
        }
        if (driver.contains("mysql") || driver.contains("mariadb")) {
            return MYSQL;
        }
        String lowerUrl = StringUtils.defaultString(url).toLowerCase(Locale.ROOT);
        if (lowerUrl.startsWith("jdbc:h2:")) {
            return H2;
        }
        if (lowerUrl.startsWith("jdbc:postgresql:")) {
            return POSTGRESQL;
        }
        if (lowerUrl.startsWith("jdbc:mysql:") || lowerUrl.startsWith("jdbc:mariadb:")) {
            return MYSQL;
        }
        return GENERIC;
    }

    /**
     * Quotes an identifier, doubling embedded quote characters.
     *
     * @param identifier table or column name
     * @return quoted identifier
     */
    public String quoteIdentifier(String identifier) {
        String q = String.valueOf(quote);
        return q + identifier.replace(q, q + q) + q;
    }

    /**
     * Folds an identifier to the case the store uses for unquoted identifiers.
     *
     * <p>
     * A table created under the folded name is found both by unquoted SQL and by DBUnit's
     * case-insensitive table lookup.
     * </p>
     *
     * @param identifier identifier as given by the caller
     * @param metaData metadata of the target store
     * @return upper-cased or lower-cased identifier, or {@code identifier} for mixed-case stores
     * @throws SQLException if the metadata cannot be read
     */
    public static String foldIdentifier(String identifier, DatabaseMetaData metaData)
            throws SQLException {
        if (metaData.storesUpperCaseIdentifiers()) {
            return identifier.toUpperCase(Locale.ROOT);
        }
        if (metaData.storesLowerCaseIdentifiers()) {
            return identifier.toLowerCase(Locale.ROOT);
        }
        return identifier;
    }

    /**
     * Returns the DBUnit escape pattern matching {@link #quoteIdentifier(String)}.
     *
     * @return escape pattern, {@code ?} standing for the identifier
     */
    public String getEscapePattern() {
        return quote + "?" + quote;
    }

    /**
     * Returns the SQL column type for a storage type.
     *
     * @param type storage type
     * @param widen when {@code true}, every integer width maps to {@code BIGINT}
     * @return SQL type
     */
    public String sqlType(ColumnType type, boolean widen) {
        if (widen && type.isInteger()) {
            return "BIGINT";
        }
        switch (type) {
            case BOOLEAN:
                return "BOOLEAN";
            case INT8:
                return int8Type;
            case INT16:
                return "SMALLINT";
            case INT32:
                return "INTEGER";
            case INT64:
                return "BIGINT";
            case FLOAT64:
                return float64Type;
            default:
                return textType;
        }
    }

    /**
     * Builds {@code DROP TABLE IF EXISTS}.
     *
     * @param table table name
     * @return DDL statement
     */
    public String dropTableSql(String table) {
        return "DROP TABLE IF EXISTS " + quoteIdentifier(table);
    }

    /**
     * Builds {@code CREATE TABLE} with one column per chunk column, in chunk order.
     *
     * @param table table name
     * @param chunk chunk whose columns define the schema
     * @param widen see {@link #sqlType(ColumnType, boolean)}
     * @return DDL statement
     */
    public String createTableSql(String table, Chunk chunk, boolean widen) {
        String columns = chunk.getColumns().stream()
                .map(c -> quoteIdentifier(c.getName()) + " " + sqlType(c.getType(), widen))
                .collect(Collectors.joining(", "));
        return "CREATE TABLE " + quoteIdentifier(table) + " (" + columns + ")";
    }

    /**
     * Builds the statement changing the SQL type of an existing column.
     *
     * @param table table name
     * @param column column name
     * @param sqlType new SQL type, as returned by {@link #sqlType(ColumnType, boolean)}
     * @return DDL statement
     */
    public String alterColumnTypeSql(String table, String column, String sqlType) {
        if (this == MYSQL) {
            return "ALTER TABLE " + quoteIdentifier(table) + " MODIFY COLUMN "
                    + quoteIdentifier(column) + " " + sqlType;
        }
        String sql = "ALTER TABLE " + quoteIdentifier(table) + " ALTER COLUMN "
                + quoteIdentifier(column) + " SET DATA TYPE " + sqlType;
        if (this == POSTGRESQL) {
            // Text to numeric has no implicit cast
            return sql + " USING " + quoteIdentifier(column) + "::" + sqlType;
        }
        return sql;
    }

    /**
     * Creates the DBUnit data type factory of this store.
     *
     * @return vendor-specific data type factory
     */
    public IDataTypeFactory createDataTypeFactory() {
        switch (this) {
            case H2:
                return new H2DataTypeFactory();
            case POSTGRESQL:
                return new PostgresqlDataTypeFactory();
            case MYSQL:
                return new MySqlDataTypeFactory();
            default:
                return new DefaultDataTypeFactory();
        }
    }
}
