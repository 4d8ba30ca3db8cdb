/**
 * FailureReason.java
 *
 * 会话以 FAILED 结束时的具体原因，便于前端区分超时、启动失败和普通的构建错误。
 */
package club.ppmc.ideshell.model;

public enum FailureReason {
    SPAWN_ERROR,
    TIMEOUT,
    NON_ZERO_EXIT,
    ERRORS_REPORTED,
    HYBRID_STAGE_FAILURE
}
