/**
 * OutputEvent.java
 *
 * 该文件定义了核心的输出事件：一行进程输出经过分类后的不可变结果，或由调度器/终端合成的状态事件。
 * 它是一个带标签的变体 (kind + 载荷)，由 OutputClassifier、BuildDispatcherService 和
 * TerminalSessionService 创建，经 EventStream 和 WebSocket 推送给前端。
 */
package club.ppmc.ideshell.model;

import java.util.List;
import java.util.Objects;

/**
 * @param kind 事件类别。
 * @param message 展示给用户的文本。
 * @param timestamp 事件创建时间 (epoch 毫秒)。
 * @param structuredErrors 结构化的错误信息列表。
 * @param structuredWarnings 结构化的警告信息列表。
 * @param artifactPath 仅当 kind 为 ARTIFACT 时有值，为产物路径。
 * @param source 原始行的来源流；合成事件为 null。
 */
public record OutputEvent(
        OutputKind kind,
        String message,
        long timestamp,
        List<String> structuredErrors,
        List<String> structuredWarnings,
        String artifactPath,
        StreamSource source) {

    public OutputEvent {
        Objects.requireNonNull(kind, "kind");
        message = message == null ? "" : message;
        structuredErrors = structuredErrors == null ? List.of() : List.copyOf(structuredErrors);
        structuredWarnings = structuredWarnings == null ? List.of() : List.copyOf(structuredWarnings);
    }

    public static OutputEvent of(OutputKind kind, String message) {
        return new OutputEvent(kind, message, System.currentTimeMillis(), List.of(), List.of(), null, null);
    }

    public static OutputEvent info(String message) {
        return of(OutputKind.INFO, message);
    }

    public static OutputEvent task(String message) {
        return of(OutputKind.TASK, message);
    }

    public static OutputEvent success(String message) {
        return of(OutputKind.SUCCESS, message);
    }

    public static OutputEvent warning(String message) {
        return new OutputEvent(
                OutputKind.WARNING, message, System.currentTimeMillis(), List.of(), List.of(message), null, null);
    }

    public static OutputEvent error(String message) {
        return new OutputEvent(
                OutputKind.ERROR, message, System.currentTimeMillis(), List.of(message), List.of(), null, null);
    }

    public static OutputEvent clear() {
        return of(OutputKind.CLEAR, "");
    }

    public static OutputEvent artifact(String message, String path) {
        return new OutputEvent(
                OutputKind.ARTIFACT, message, System.currentTimeMillis(), List.of(), List.of(), path, null);
    }

    /**
     * 带汇总信息的终结事件，用于构建会话结束时携带全部错误与警告。
     */
    public static OutputEvent summary(
            OutputKind kind, String message, List<String> errors, List<String> warnings) {
        return new OutputEvent(kind, message, System.currentTimeMillis(), errors, warnings, null, null);
    }

    /** 以持久化记录的格式 "KIND: message" 输出。 */
    public String toTranscriptLine() {
        return kind.name() + ": " + message;
    }
}
