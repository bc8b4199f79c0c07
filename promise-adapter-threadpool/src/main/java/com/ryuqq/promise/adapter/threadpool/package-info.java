/**
 * Thread Pool Adapter Layer - production Scheduler implementation.
 *
 * <h2>Implementations</h2>
 * <ul>
 *   <li>{@link com.ryuqq.promise.adapter.threadpool.ThreadPoolScheduler} - Fixed-size worker pool</li>
 *   <li>{@link com.ryuqq.promise.adapter.threadpool.SchedulerConfig} - Immutable pool configuration</li>
 * </ul>
 *
 * <h2>Architecture Position</h2>
 * <pre>
 * adapter-threadpool (ThreadPoolScheduler)
 *   ↓ implements
 * core/spi (Scheduler interface)
 * </pre>
 *
 * @since 1.0.0
 * @author Promise Team
 */
package com.ryuqq.promise.adapter.threadpool;
