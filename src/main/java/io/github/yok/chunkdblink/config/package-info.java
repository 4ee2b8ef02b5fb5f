/**
 * Configuration model package for ChunkDBLink.
 *
 * <p>
 * Defines classes that represent values loaded from {@code application.yml}: the store
 * connection, ingestion settings (chunk and sample sizes, CSV format, narrowing policy), DBUnit
 * write settings and the dataset base directory.
 * </p>
 */
package io.github.yok.chunkdblink.config;
