/**
 * Promise combinator package.
 *
 * <p>Combinators compose several promises into one aggregate promise using only the
 * public {@link com.ryuqq.promise.core.promise.Promise} contract.</p>
 *
 * <ul>
 *   <li>{@code all} - index-aligned values, first rejection short-circuits</li>
 *   <li>{@code allSettled} - index-aligned outcomes, never rejects</li>
 *   <li>{@code race} - first settlement in either direction</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Promise Team
 */
package com.ryuqq.promise.core.combinator;
