/**
 * Admission control for a single process: a per-key
 * <a href="https://en.wikipedia.org/wiki/Token_bucket">token bucket</a> nested inside a global token bucket,
 * with a bounded-wait queue for requests that momentarily exceed quota.
 * <p>
 * {@link com.github.admission.CompositeLimiter#allow(java.lang.String)} is the entry point.
 * <p>
 * <b>Thread safety</b>: Classes are not thread-safe unless indicated otherwise (e.g.
 * {@link com.github.admission.CompositeLimiter}).
 */
package com.github.admission;
