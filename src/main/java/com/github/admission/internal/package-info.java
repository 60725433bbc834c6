/**
 * <h1>Locking policy</h1>
 * <p>
 * A limiter owns exactly one {@link com.github.admission.internal.LockAsResource lock}. Every token bucket, the
 * key registry and the admission queue are only read or written while it is held. Public methods acquire the
 * lock on behalf of the non-public methods that they invoke.
 * <p>
 * The {@link com.github.admission.internal.Doorbell doorbell} has a lock of its own. It may be rung while the
 * limiter lock is held, but the drainer releases the doorbell lock before it acquires the limiter lock.
 * <p>
 * Callers never block while holding either lock.
 */
package com.github.admission.internal;
