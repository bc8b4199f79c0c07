/**
 * Promise settlement state machine package.
 *
 * <p>This package implements the one-way, one-time settlement rule of a promise.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.promise.core.statemachine.PromiseState} - Settlement states (enum)</li>
 *   <li>{@link com.ryuqq.promise.core.statemachine.StateTransition} - Transition validation and execution</li>
 * </ul>
 *
 * <h2>State Transition Rules</h2>
 * <pre>
 * PENDING → FULFILLED (resolve)
 * PENDING → REJECTED (reject, converted exception)
 *
 * Forbidden:
 * - FULFILLED → * (settled)
 * - REJECTED → * (settled)
 * </pre>
 *
 * <h2>Usage Example</h2>
 * <pre>
 * PromiseState state = PromiseState.PENDING;
 * state = StateTransition.transition(state, PromiseState.FULFILLED);
 *
 * // This will throw IllegalStateException
 * StateTransition.validate(state, PromiseState.REJECTED);
 * </pre>
 *
 * @since 1.0.0
 * @author Promise Team
 */
package com.ryuqq.promise.core.statemachine;
