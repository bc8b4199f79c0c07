package com.ryuqq.promise.core.statemachine;

/**
 * Promise의 정착(settlement) 상태.
 *
 * <p><strong>상태 전이 규칙:</strong></p>
 * <ul>
 *   <li>PENDING → FULFILLED (값으로 정착)</li>
 *   <li>PENDING → REJECTED (오류로 정착)</li>
 *   <li><strong>정착은 단 한 번만 발생 (불변식)</strong></li>
 * </ul>
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * PENDING
 *    │
 *    ├─► FULFILLED (resolve)
 *    │
 *    └─► REJECTED (reject, 예외 변환)
 *
 * 금지된 전이:
 * - FULFILLED → PENDING ❌
 * - REJECTED → PENDING ❌
 * - FULFILLED ↔ REJECTED ❌
 * </pre>
 *
 * @author Promise Team
 * @since 1.0.0
 */
public enum PromiseState {

    /**
     * 대기 중 (아직 정착되지 않음).
     */
    PENDING,

    /**
     * 값으로 정착됨.
     */
    FULFILLED,

    /**
     * 오류로 정착됨.
     */
    REJECTED;

    /**
     * 정착 상태인지 확인.
     *
     * <p>정착 상태(FULFILLED, REJECTED)에서는 더 이상 다른 상태로 전이할 수 없습니다.</p>
     *
     * @return FULFILLED 또는 REJECTED인 경우 true
     */
    public boolean isSettled() {
        return this == FULFILLED || this == REJECTED;
    }
}
