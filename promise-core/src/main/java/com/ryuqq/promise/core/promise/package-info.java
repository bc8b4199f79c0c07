/**
 * Promise core package.
 *
 * <p>This package implements the asynchronous result container: settlement, callback
 * registration and dispatch, flattening of nested promises, and blocking wait.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.promise.core.promise.Promise} - Public promise contract</li>
 *   <li>{@link com.ryuqq.promise.core.promise.PromiseRuntime} - Factory bound to a Scheduler</li>
 *   <li>{@link com.ryuqq.promise.core.promise.Promises} - Static entry point over a default runtime</li>
 *   <li>{@link com.ryuqq.promise.core.promise.PromiseExecutor} - Background work body</li>
 *   <li>{@link com.ryuqq.promise.core.promise.Resolver} / {@link com.ryuqq.promise.core.promise.Rejecter} - Settlement callbacks</li>
 * </ul>
 *
 * <h2>Chaining Rules</h2>
 * <pre>
 * then(fn)        : fulfilled → fn(value), rejected → propagate
 * catchError(fn)  : rejected  → fn(error): null recovers, Throwable re-rejects
 * recover(fn)     : rejected  → fn(error) becomes the value
 * any Promise returned by a callback is flattened
 * </pre>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Settle once:</strong> first resolve/reject wins, later calls are ignored</li>
 *   <li><strong>Exception to rejection:</strong> anything thrown by an executor or callback rejects the promise</li>
 *   <li><strong>No lost callbacks:</strong> registration after settlement is dispatched through the Scheduler</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Promise Team
 */
package com.ryuqq.promise.core.promise;
