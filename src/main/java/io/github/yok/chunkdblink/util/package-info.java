/**
 * Shared helpers for the command-line entry point and log output.
 */
package io.github.yok.chunkdblink.util;
