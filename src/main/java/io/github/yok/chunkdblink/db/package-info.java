/**
 * Store access: connection handling, SQL dialects, and DBUnit integration.
 *
 * <p>
 * {@link io.github.yok.chunkdblink.db.StoreDialect} is resolved from the configured driver class
 * or JDBC URL and supplies identifier quoting, DDL types, and the DBUnit data type factory.
 * </p>
 */
package io.github.yok.chunkdblink.db;
