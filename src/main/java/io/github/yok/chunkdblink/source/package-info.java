/**
 * Dataset acquisition: locating dataset directories and their data files.
 */
package io.github.yok.chunkdblink.source;
