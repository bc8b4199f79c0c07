/**
 * Promise settlement outcome package.
 *
 * <p>This package defines the sealed interface hierarchy for settled results,
 * the Java form of the {@code (value, error)} pair.</p>
 *
 * <h2>Outcome Cases</h2>
 * <ul>
 *   <li>{@link com.ryuqq.promise.core.outcome.Fulfilled} - Settled with a value</li>
 *   <li>{@link com.ryuqq.promise.core.outcome.Rejected} - Settled with an error</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Promise Team
 */
package com.ryuqq.promise.core.outcome;
