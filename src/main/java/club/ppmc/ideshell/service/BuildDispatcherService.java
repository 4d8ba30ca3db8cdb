/**
 * BuildDispatcherService.java
 *
 * 该服务负责构建会话的整个生命周期：为项目选择后端、规划调用、启动进程、分类输出、处理取消与超时。
 * 它维护一个显式的会话注册表 (会话ID -> BuildSession)，会话只能通过本服务的公共方法修改。
 *
 * 状态机：IDLE -> RUNNING -> {SUCCEEDED | FAILED | CANCELLED}。
 * 同一个项目同时最多只有一个未结束的会话，新的请求会被直接拒绝 (SessionBusyException)。
 * HYBRID 后端是一个两阶段流水线：先运行原生驱动，成功后才运行托管构建工具；第一阶段失败时第二阶段不会启动。
 */
package club.ppmc.ideshell.service;

import club.ppmc.ideshell.exception.EnvironmentConfigurationException;
import club.ppmc.ideshell.exception.SessionBusyException;
import club.ppmc.ideshell.exception.SessionNotFoundException;
import club.ppmc.ideshell.exception.SpawnException;
import club.ppmc.ideshell.model.BackendFamily;
import club.ppmc.ideshell.model.BackendType;
import club.ppmc.ideshell.model.BuildOperation;
import club.ppmc.ideshell.model.BuildRequest;
import club.ppmc.ideshell.model.BuildSession;
import club.ppmc.ideshell.model.BuildSessionSnapshot;
import club.ppmc.ideshell.model.FailureReason;
import club.ppmc.ideshell.model.Invocation;
import club.ppmc.ideshell.model.OutputEvent;
import club.ppmc.ideshell.model.OutputKind;
import club.ppmc.ideshell.model.ProcessOutcome;
import club.ppmc.ideshell.model.RawLine;
import club.ppmc.ideshell.model.SessionStatus;
import club.ppmc.ideshell.service.backend.BackendAdapter;
import club.ppmc.ideshell.service.backend.BackendAdapterRegistry;
import club.ppmc.ideshell.service.classify.OutputClassifier;
import club.ppmc.ideshell.util.EventStream;
import club.ppmc.ideshell.util.ManagedProcess;
import club.ppmc.ideshell.util.MdcContext;
import club.ppmc.ideshell.util.ProcessExecutor;
import club.ppmc.ideshell.util.ProjectTypeDetector;
import jakarta.annotation.PreDestroy;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class BuildDispatcherService {

    private final BackendAdapterRegistry adapterRegistry;
    private final ProcessExecutor processExecutor;
    private final OutputClassifier classifier;
    private final ProjectTypeDetector projectTypeDetector;
    private final SettingsService settingsService;
    private final WebSocketNotificationService notificationService;

    private final Map<String, BuildSession> sessions = new ConcurrentHashMap<>();
    private final ExecutorService workerPool = Executors.newCachedThreadPool();
    private final Object registrationLock = new Object();

    public BuildDispatcherService(
            BackendAdapterRegistry adapterRegistry,
            ProcessExecutor processExecutor,
            OutputClassifier classifier,
            ProjectTypeDetector projectTypeDetector,
            SettingsService settingsService,
            WebSocketNotificationService notificationService) {
        this.adapterRegistry = adapterRegistry;
        this.processExecutor = processExecutor;
        this.classifier = classifier;
        this.projectTypeDetector = projectTypeDetector;
        this.settingsService = settingsService;
        this.notificationService = notificationService;
    }

    /**
     * 启动一个构建会话并立即返回，构建在工作线程池中执行。
     * 所有调用在启动前就规划完成，规划失败时请求被拒绝，不会创建会话。
     *
     * @param projectPath 项目目录，相对路径基于工作区根目录解析。
     * @param backendType 后端类型，为 null 时根据项目文件自动检测。
     * @param request 构建请求。
     * @return 新会话的快照。
     * @throws club.ppmc.ideshell.exception.InvalidOperationException 后端不支持请求的操作。
     * @throws EnvironmentConfigurationException 项目目录不存在或缺少清单文件。
     * @throws SessionBusyException 该项目已有未结束的会话。
     */
    public BuildSessionSnapshot start(String projectPath, BackendType backendType, BuildRequest request) {
        Path projectDir = settingsService.resolveProjectDirectory(projectPath);
        BackendType type = backendType != null ? backendType : projectTypeDetector.detectOrThrow(projectDir);
        List<PlannedStep> steps = plan(projectDir, type, request);

        BuildSession session;
        synchronized (registrationLock) {
            sessions.values().stream()
                    .filter(existing -> existing.getProjectPath().equals(projectDir) && existing.isActive())
                    .findFirst()
                    .ifPresent(existing -> {
                        throw new SessionBusyException(
                                existing.getId(), "项目 " + projectDir.getFileName() + " 已有正在进行的构建会话: " + existing.getId());
                    });
            session = new BuildSession(UUID.randomUUID().toString(), projectDir, type, request);
            sessions.put(session.getId(), session);
        }
        log.info("已创建构建会话 {}: {} {} ({})", session.getId(), type, request.operation(), projectDir);
        notificationService.sendBuildStatus(session.snapshot());

        BuildSession submitted = session;
        workerPool.submit(() -> execute(submitted, steps));
        return session.snapshot();
    }

    /**
     * 取消一个会话。正在运行的进程会被终止，尚未开始的 HYBRID 阶段会被丢弃；会话最终状态为 CANCELLED。
     * 对已结束的会话调用是空操作。
     */
    public BuildSessionSnapshot cancel(String sessionId) {
        BuildSession session = require(sessionId);
        ManagedProcess process = session.requestCancel();
        if (process != null) {
            log.info("正在取消构建会话 {}，终止进程 PID {}", sessionId, process.pid());
            process.kill();
        }
        return session.snapshot();
    }

    /** 订阅会话的事件流：先重放已有事件，再接收实时事件，会话结束后流自动完成。 */
    public EventStream<OutputEvent> subscribe(String sessionId) {
        return require(sessionId).subscribe();
    }

    public List<OutputEvent> events(String sessionId, int fromIndex) {
        return require(sessionId).events(fromIndex);
    }

    public BuildSessionSnapshot getSession(String sessionId) {
        return require(sessionId).snapshot();
    }

    public List<BuildSessionSnapshot> listSessions() {
        return sessions.values().stream()
                .sorted(Comparator.comparingLong(BuildSession::getCreatedAt))
                .map(BuildSession::snapshot)
                .toList();
    }

    /**
     * 移除一个已结束的会话。
     *
     * @throws SessionBusyException 会话仍在进行中。
     */
    public void clearSession(String sessionId) {
        BuildSession session = require(sessionId);
        if (session.isActive()) {
            throw new SessionBusyException(sessionId, "会话仍在进行中，无法清除: " + sessionId);
        }
        sessions.remove(sessionId, session);
    }

    /**
     * 移除所有已结束的会话。
     *
     * @return 被移除的会话数量。
     */
    public int clearFinished() {
        List<String> finished = sessions.values().stream()
                .filter(session -> !session.isActive())
                .map(BuildSession::getId)
                .toList();
        finished.forEach(sessions::remove);
        return finished.size();
    }

    private BuildSession require(String sessionId) {
        BuildSession session = sessionId == null ? null : sessions.get(sessionId);
        if (session == null) {
            throw new SessionNotFoundException(sessionId);
        }
        return session;
    }

    /**
     * 按执行顺序规划每个阶段的调用。HYBRID 的交叉编译请求在打包阶段以普通构建执行。
     */
    private List<PlannedStep> plan(Path projectDir, BackendType type, BuildRequest request) {
        List<BackendFamily> stages = type.stages();
        List<PlannedStep> steps = new ArrayList<>();
        for (int i = 0; i < stages.size(); i++) {
            BackendAdapter adapter = adapterRegistry.get(stages.get(i));
            BuildRequest stageRequest = request;
            boolean packagingStage = type == BackendType.HYBRID && i > 0;
            if (packagingStage && request.operation() == BuildOperation.CROSS_TARGET_BUILD) {
                stageRequest = request.withOperation(BuildOperation.BUILD);
            }
            steps.add(new PlannedStep(adapter, stageRequest, adapter.plan(projectDir, stageRequest)));
        }
        return steps;
    }

    private void execute(BuildSession session, List<PlannedStep> steps) {
        MdcContext.setBuildSession(session.getId());
        try {
            for (int i = 0; i < steps.size(); i++) {
                PlannedStep step = steps.get(i);
                if (steps.size() > 1) {
                    emit(session, OutputEvent.task(String.format(
                            "阶段 %d/%d: %s", i + 1, steps.size(), step.adapter().family())));
                }
                StepResult result = runStep(session, step);
                if (result.cancelled()) {
                    finishCancelled(session);
                    return;
                }
                if (result.failure() != null) {
                    if (i < steps.size() - 1) {
                        PlannedStep skipped = steps.get(i + 1);
                        emit(session, OutputEvent.error(String.format(
                                "阶段 %d (%s) 失败，已跳过阶段 %d (%s)。",
                                i + 1, step.adapter().family(), i + 2, skipped.adapter().family())));
                        finishFailed(session, FailureReason.HYBRID_STAGE_FAILURE);
                    } else {
                        finishFailed(session, result.failure());
                    }
                    return;
                }
                reportArtifacts(session, step);
            }
            finishSucceeded(session);
        } catch (RuntimeException e) {
            log.error("构建会话 {} 执行时发生意外错误", session.getId(), e);
            emit(session, OutputEvent.error("内部错误: " + e.getMessage()));
            finishFailed(session, FailureReason.ERRORS_REPORTED);
        } finally {
            MdcContext.clear();
        }
    }

    private StepResult runStep(BuildSession session, PlannedStep step) {
        if (session.isCancelRequested()) {
            return StepResult.CANCELLED;
        }
        Invocation invocation = step.invocation();
        ManagedProcess process;
        try {
            process = processExecutor.spawn(invocation, settingsService.getBuildIdleTimeout());
        } catch (SpawnException e) {
            emit(session, OutputEvent.error("无法启动 " + invocation.argv().get(0) + ": " + e.getMessage()));
            return StepResult.failed(FailureReason.SPAWN_ERROR);
        }
        if (!session.attach(process)) {
            // 取消请求在进程启动期间到达
            process.kill();
            process.outcome().join();
            return StepResult.CANCELLED;
        }
        notificationService.sendBuildStatus(session.snapshot());
        emit(session, OutputEvent.info("> " + invocation.commandLine()));

        int errorsInStep = 0;
        for (RawLine line : process.lines()) {
            OutputEvent event = classifier.classify(line, invocation.family());
            if (event.kind() == OutputKind.ERROR) {
                errorsInStep++;
            }
            emit(session, event);
        }
        ProcessOutcome outcome = process.outcome().join();
        session.detach(process);
        log.info("构建会话 {} 的步骤 {} 结束: {}", session.getId(), invocation.family(), outcome);

        if (outcome.timedOut()) {
            emit(session, OutputEvent.error(String.format(
                    "进程超过 %d 秒没有输出，已被终止。", settingsService.getBuildIdleTimeout().toSeconds())));
            return StepResult.failed(FailureReason.TIMEOUT);
        }
        if (session.isCancelRequested() || outcome.killed()) {
            return StepResult.CANCELLED;
        }
        if (outcome.exitCode() != 0) {
            return StepResult.failed(FailureReason.NON_ZERO_EXIT);
        }
        if (errorsInStep > 0) {
            return StepResult.failed(FailureReason.ERRORS_REPORTED);
        }
        return StepResult.OK;
    }

    private void reportArtifacts(BuildSession session, PlannedStep step) {
        for (Path artifact : step.adapter().findArtifacts(session.getProjectPath(), step.request())) {
            String size = FileUtils.byteCountToDisplaySize(artifact.toFile().length());
            emit(session, OutputEvent.artifact(
                    String.format("已生成: %s (%s)", artifact.getFileName(), size), artifact.toString()));
        }
    }

    private void emit(BuildSession session, OutputEvent event) {
        if (session.append(event)) {
            notificationService.sendBuildEvent(session.getId(), event);
        }
    }

    private void finishSucceeded(BuildSession session) {
        if (!session.isSuccessReported()) {
            complete(session, OutputEvent.summary(
                    OutputKind.SUCCESS, "构建成功。", session.collectedErrors(), session.collectedWarnings()));
        }
        finish(session, SessionStatus.SUCCEEDED, null);
    }

    private void finishFailed(BuildSession session, FailureReason reason) {
        List<String> errors = session.collectedErrors();
        String message = String.format("构建失败 (%s)，共 %d 个错误，%d 个警告。",
                reason, errors.size(), session.collectedWarnings().size());
        complete(session, OutputEvent.summary(OutputKind.ERROR, message, errors, session.collectedWarnings()));
        finish(session, SessionStatus.FAILED, reason);
    }

    private void finishCancelled(BuildSession session) {
        complete(session, OutputEvent.summary(
                OutputKind.WARNING, "构建已取消。", session.collectedErrors(), session.collectedWarnings()));
        finish(session, SessionStatus.CANCELLED, null);
    }

    private void complete(BuildSession session, OutputEvent summary) {
        if (session.appendSummary(summary)) {
            notificationService.sendBuildEvent(session.getId(), summary);
        }
    }

    private void finish(BuildSession session, SessionStatus status, FailureReason reason) {
        if (session.finish(status, reason)) {
            log.info("构建会话 {} 已结束: {}{}", session.getId(), status, reason != null ? " (" + reason + ")" : "");
            notificationService.sendBuildStatus(session.snapshot());
        }
    }

    @PreDestroy
    public void shutdown() {
        log.info("正在关闭 BuildDispatcherService...");
        sessions.values().forEach(session -> {
            ManagedProcess process = session.requestCancel();
            if (process != null) {
                process.kill();
            }
        });
        workerPool.shutdown();
        try {
            if (!workerPool.awaitTermination(2, TimeUnit.SECONDS)) {
                workerPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            workerPool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private record PlannedStep(BackendAdapter adapter, BuildRequest request, Invocation invocation) {}

    private record StepResult(boolean cancelled, FailureReason failure) {
        static final StepResult OK = new StepResult(false, null);
        static final StepResult CANCELLED = new StepResult(true, null);

        static StepResult failed(FailureReason reason) {
            return new StepResult(false, reason);
        }
    }
}
