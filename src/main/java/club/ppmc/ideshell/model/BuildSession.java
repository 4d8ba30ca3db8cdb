/**
 * BuildSession.java
 *
 * 一次构建类操作的会话状态。由 BuildDispatcherService 创建并独占修改，外部只能看到它的快照 (BuildSessionSnapshot)。
 * 会话保存完整的事件列表，新的订阅者会先收到已有事件的重放，再收到实时事件。
 * 所有可变状态都由会话对象自身的锁保护。
 */
package club.ppmc.ideshell.model;

import club.ppmc.ideshell.util.EventStream;
import club.ppmc.ideshell.util.ManagedProcess;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import lombok.Getter;

public final class BuildSession {

    @Getter private final String id;
    @Getter private final Path projectPath;
    @Getter private final BackendType backendType;
    @Getter private final BuildRequest request;
    @Getter private final long createdAt;

    private final List<OutputEvent> events = new ArrayList<>();
    private final List<String> errors = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();
    private final List<EventStream<OutputEvent>> subscribers = new ArrayList<>();

    private SessionStatus status = SessionStatus.IDLE;
    private FailureReason failureReason;
    private Long startedAt;
    private Long completedAt;
    private ManagedProcess activeProcess;
    private boolean cancelRequested;
    private boolean successReported;

    public BuildSession(String id, Path projectPath, BackendType backendType, BuildRequest request) {
        this.id = id;
        this.projectPath = projectPath;
        this.backendType = backendType;
        this.request = request;
        this.createdAt = System.currentTimeMillis();
    }

    public synchronized SessionStatus getStatus() {
        return status;
    }

    public synchronized FailureReason getFailureReason() {
        return failureReason;
    }

    /** 会话仍未进入终结状态 (IDLE 排队中或 RUNNING)。 */
    public synchronized boolean isActive() {
        return !status.isTerminal();
    }

    public synchronized boolean isCancelRequested() {
        return cancelRequested;
    }

    /** 是否已经有工具链自己输出的 SUCCESS 事件。 */
    public synchronized boolean isSuccessReported() {
        return successReported;
    }

    /**
     * 追加一个事件并推送给所有订阅者。会话结束后追加的事件会被忽略。
     *
     * @return 事件是否被接受。
     */
    public synchronized boolean append(OutputEvent event) {
        if (status.isTerminal()) {
            return false;
        }
        events.add(event);
        errors.addAll(event.structuredErrors());
        warnings.addAll(event.structuredWarnings());
        if (event.kind() == OutputKind.SUCCESS) {
            successReported = true;
        }
        subscribers.forEach(subscriber -> subscriber.offer(event));
        return true;
    }

    /** 追加汇总事件：它携带的错误和警告已经统计过，不再重复计入。 */
    public synchronized boolean appendSummary(OutputEvent summary) {
        if (status.isTerminal()) {
            return false;
        }
        events.add(summary);
        subscribers.forEach(subscriber -> subscriber.offer(summary));
        return true;
    }

    public synchronized List<String> collectedErrors() {
        return List.copyOf(errors);
    }

    public synchronized List<String> collectedWarnings() {
        return List.copyOf(warnings);
    }

    /**
     * 从指定下标开始的事件，用于轮询客户端。
     */
    public synchronized List<OutputEvent> events(int fromIndex) {
        int from = Math.max(0, Math.min(fromIndex, events.size()));
        return List.copyOf(events.subList(from, events.size()));
    }

    /**
     * 订阅事件流：先重放已有事件，会话未结束时继续接收实时事件，结束后流自动完成。
     */
    public synchronized EventStream<OutputEvent> subscribe() {
        var holder = new AtomicReference<EventStream<OutputEvent>>();
        EventStream<OutputEvent> stream = new EventStream<>(() -> unsubscribe(holder.get()));
        holder.set(stream);
        events.forEach(stream::offer);
        if (status.isTerminal()) {
            stream.complete();
        } else {
            subscribers.add(stream);
        }
        return stream;
    }

    private synchronized void unsubscribe(EventStream<OutputEvent> stream) {
        subscribers.remove(stream);
    }

    /**
     * 挂上新启动的进程并把会话切换为 RUNNING。
     *
     * @return 取消请求已经到达时返回 false，调用方需要自行终止该进程。
     */
    public synchronized boolean attach(ManagedProcess process) {
        if (cancelRequested || status.isTerminal()) {
            return false;
        }
        this.activeProcess = process;
        if (status == SessionStatus.IDLE) {
            status = SessionStatus.RUNNING;
            startedAt = System.currentTimeMillis();
        }
        return true;
    }

    public synchronized void detach(ManagedProcess process) {
        if (activeProcess == process) {
            activeProcess = null;
        }
    }

    /**
     * 记录取消请求。
     *
     * @return 当前存活的进程，没有时为 null。
     */
    public synchronized ManagedProcess requestCancel() {
        if (status.isTerminal()) {
            return null;
        }
        cancelRequested = true;
        return activeProcess;
    }

    /**
     * 进入终结状态并关闭所有订阅者的事件流。重复调用无效。
     */
    public synchronized boolean finish(SessionStatus terminalStatus, FailureReason reason) {
        if (!terminalStatus.isTerminal()) {
            throw new IllegalArgumentException("不是终结状态: " + terminalStatus);
        }
        if (status.isTerminal()) {
            return false;
        }
        status = terminalStatus;
        failureReason = terminalStatus == SessionStatus.FAILED ? reason : null;
        completedAt = System.currentTimeMillis();
        activeProcess = null;
        subscribers.forEach(EventStream::complete);
        subscribers.clear();
        return true;
    }

    public synchronized BuildSessionSnapshot snapshot() {
        List<String> artifacts = events.stream()
                .filter(event -> event.kind() == OutputKind.ARTIFACT && event.artifactPath() != null)
                .map(OutputEvent::artifactPath)
                .toList();
        return new BuildSessionSnapshot(
                id,
                projectPath.toString(),
                backendType,
                request.operation(),
                request.buildType(),
                status,
                failureReason,
                createdAt,
                startedAt,
                completedAt,
                events.size(),
                errors.size(),
                warnings.size(),
                artifacts);
    }
}
