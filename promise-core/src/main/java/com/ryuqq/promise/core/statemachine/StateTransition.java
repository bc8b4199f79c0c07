package com.ryuqq.promise.core.statemachine;

/**
 * 정착 전이 검증 및 실행.
 *
 * <p>Promise의 상태 전이가 허용된 규칙을 따르는지 검증하고,
 * "정착은 단 한 번" 불변식을 보장합니다.</p>
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>PENDING → FULFILLED</li>
 *   <li>PENDING → REJECTED</li>
 * </ul>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>정착 상태(FULFILLED, REJECTED)에서는 어떤 상태로도 전이 불가</li>
 *   <li>PENDING → PENDING 은 전이가 아님</li>
 * </ul>
 *
 * @author Promise Team
 * @since 1.0.0
 */
public final class StateTransition {

    // Utility class - prevent instantiation
    private StateTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * <p>허용되지 않은 전이를 시도하면 {@link IllegalStateException}을 발생시킵니다.</p>
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(PromiseState from, PromiseState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }

        if (from.isSettled()) {
            throw new IllegalStateException(
                String.format("Cannot transition from settled state: %s → %s", from, to)
            );
        }

        if (!to.isSettled()) {
            throw new IllegalStateException(
                String.format("Invalid state transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     * @throws IllegalArgumentException current 또는 next가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static PromiseState transition(PromiseState current, PromiseState next) {
        validate(current, next);
        return next;
    }
}
