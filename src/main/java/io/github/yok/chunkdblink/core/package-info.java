/**
 * Core ingestion workflows for ChunkDBLink.
 *
 * <p>
 * Contains the per-chunk type optimizer, the sample profiler, the chunked table loader, and the
 * query executor with its full and paged result types.
 * </p>
 */
package io.github.yok.chunkdblink.core;
