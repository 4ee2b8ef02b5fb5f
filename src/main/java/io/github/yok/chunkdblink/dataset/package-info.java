/**
 * Column-wise in-memory representation of CSV chunks and their storage types.
 */
package io.github.yok.chunkdblink.dataset;
