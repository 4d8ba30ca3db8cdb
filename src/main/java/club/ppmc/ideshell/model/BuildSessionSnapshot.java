/**
 * BuildSessionSnapshot.java
 *
 * 构建会话在某一时刻的只读视图，用于 REST 响应和状态推送。时间均为 epoch 毫秒，未发生时为 null。
 */
package club.ppmc.ideshell.model;

import java.util.List;

public record BuildSessionSnapshot(
        String id,
        String projectPath,
        BackendType backendType,
        BuildOperation operation,
        String buildType,
        SessionStatus status,
        FailureReason failureReason,
        long createdAt,
        Long startedAt,
        Long completedAt,
        int eventCount,
        int errorCount,
        int warningCount,
        List<String> artifacts) {

    public BuildSessionSnapshot {
        artifacts = artifacts == null ? List.of() : List.copyOf(artifacts);
    }
}
