/**
 * Service Provider Interface (SPI) package.
 *
 * <p>Defines the execution contract the promise core depends on. Adapter modules
 * ({@code promise-adapter-inline}, {@code promise-adapter-threadpool}) provide
 * implementations.</p>
 *
 * <h2>Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.promise.core.spi.Scheduler} - Runs a task independently of the caller</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Promise Team
 */
package com.ryuqq.promise.core.spi;
