/**
 * Failure taxonomy of ChunkDBLink: read, format, write and query errors.
 */
package io.github.yok.chunkdblink.exception;
