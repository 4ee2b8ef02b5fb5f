/**
 * Chunked CSV reading.
 */
package io.github.yok.chunkdblink.parser;
