/**
 * Inline Adapter Layer - deterministic Scheduler implementations.
 *
 * <p>This package provides Scheduler implementations for tests and single-threaded use.</p>
 *
 * <h2>Implementations</h2>
 * <ul>
 *   <li>{@link com.ryuqq.promise.adapter.inline.InlineScheduler} - Runs each task on the calling thread</li>
 *   <li>{@link com.ryuqq.promise.adapter.inline.ManualScheduler} - Queues tasks until the test drains them</li>
 * </ul>
 *
 * <h2>Architecture Position</h2>
 * <pre>
 * adapter-inline (InlineScheduler, ManualScheduler)
 *   ↓ implements
 * core/spi (Scheduler interface)
 * </pre>
 *
 * @since 1.0.0
 * @author Promise Team
 */
package com.ryuqq.promise.adapter.inline;
