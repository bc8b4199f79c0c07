/**
 * Contract test infrastructure for the promise runtime.
 *
 * <p>{@link com.ryuqq.promise.testkit.contract.AbstractPromiseContractTest} runs every scenario
 * against a real {@link com.ryuqq.promise.adapter.threadpool.ThreadPoolScheduler}, so the
 * contract suites exercise genuine cross-thread settlement, registration and await.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.promise.testkit.contract;
