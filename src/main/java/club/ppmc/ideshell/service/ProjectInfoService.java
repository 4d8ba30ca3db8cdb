/**
 * ProjectInfoService.java
 *
 * 同步执行只读的项目查询：列出 Gradle 项目的全部任务，读取 Cargo 项目的 crate 信息。
 * 查询不创建构建会话，也不占用项目的构建槽位；输出不经过分类器，直接交给对应适配器解析。
 */
package club.ppmc.ideshell.service;

import club.ppmc.ideshell.exception.ProjectQueryException;
import club.ppmc.ideshell.exception.SpawnException;
import club.ppmc.ideshell.model.CrateInfo;
import club.ppmc.ideshell.model.GradleTask;
import club.ppmc.ideshell.model.Invocation;
import club.ppmc.ideshell.model.ProcessOutcome;
import club.ppmc.ideshell.model.RawLine;
import club.ppmc.ideshell.model.StreamSource;
import club.ppmc.ideshell.service.backend.ManagedBuildToolAdapter;
import club.ppmc.ideshell.service.backend.PackageManagerAdapter;
import club.ppmc.ideshell.util.ManagedProcess;
import club.ppmc.ideshell.util.ProcessExecutor;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class ProjectInfoService {

    static final Duration QUERY_TIMEOUT = Duration.ofMinutes(2);
    private static final int DIAGNOSTIC_LINES = 10;

    private final ManagedBuildToolAdapter managedBuildToolAdapter;
    private final PackageManagerAdapter packageManagerAdapter;
    private final ProcessExecutor processExecutor;
    private final SettingsService settingsService;

    public ProjectInfoService(
            ManagedBuildToolAdapter managedBuildToolAdapter,
            PackageManagerAdapter packageManagerAdapter,
            ProcessExecutor processExecutor,
            SettingsService settingsService) {
        this.managedBuildToolAdapter = managedBuildToolAdapter;
        this.packageManagerAdapter = packageManagerAdapter;
        this.processExecutor = processExecutor;
        this.settingsService = settingsService;
    }

    /**
     * @throws club.ppmc.ideshell.exception.EnvironmentConfigurationException 项目目录不存在或没有 Gradle 构建脚本。
     * @throws ProjectQueryException Gradle 没有成功列出任务。
     */
    public List<GradleTask> listGradleTasks(String projectPath) {
        Path projectDir = settingsService.resolveProjectDirectory(projectPath);
        List<RawLine> lines = run(managedBuildToolAdapter.listTasks(projectDir));
        List<GradleTask> tasks = ManagedBuildToolAdapter.parseTaskListing(stdout(lines));
        log.info("项目 {} 共有 {} 个 Gradle 任务", projectDir, tasks.size());
        return tasks;
    }

    /**
     * @throws club.ppmc.ideshell.exception.EnvironmentConfigurationException 项目目录不存在或没有 Cargo.toml。
     * @throws ProjectQueryException cargo metadata 失败或输出无法解析。
     */
    public CrateInfo crateInfo(String projectPath) {
        Path projectDir = settingsService.resolveProjectDirectory(projectPath);
        List<RawLine> lines = run(packageManagerAdapter.metadata(projectDir));
        try {
            return PackageManagerAdapter.parseMetadata(String.join("\n", stdout(lines)), projectDir);
        } catch (IllegalArgumentException e) {
            throw new ProjectQueryException(e.getMessage(), e);
        }
    }

    private List<RawLine> run(Invocation invocation) {
        log.debug("执行只读查询: {}", invocation.commandLine());
        ManagedProcess process;
        try {
            process = processExecutor.spawn(invocation, settingsService.getBuildIdleTimeout());
        } catch (SpawnException e) {
            throw new ProjectQueryException("无法启动 " + invocation.argv().get(0) + ": " + e.getMessage(), e);
        }
        try {
            List<RawLine> lines = process.lines().collect(QUERY_TIMEOUT);
            ProcessOutcome outcome = process.outcome().get(QUERY_TIMEOUT.toSeconds(), TimeUnit.SECONDS);
            if (!outcome.isCleanExit()) {
                String reason = outcome.timedOut() ? "长时间没有输出，已终止" : "退出码 " + outcome.exitCode();
                throw new ProjectQueryException(invocation.commandLine() + " 执行失败 (" + reason + ")",
                        lastStderrLines(lines));
            }
            return lines;
        } catch (TimeoutException e) {
            process.kill();
            throw new ProjectQueryException(invocation.commandLine() + " 在 " + QUERY_TIMEOUT + " 内没有完成", e);
        } catch (ExecutionException e) {
            throw new ProjectQueryException(invocation.commandLine() + " 执行失败", e.getCause());
        } catch (InterruptedException e) {
            process.kill();
            Thread.currentThread().interrupt();
            throw new ProjectQueryException("查询被中断", e);
        }
    }

    private static List<String> stdout(List<RawLine> lines) {
        return lines.stream().filter(line -> line.source() == StreamSource.STDOUT).map(RawLine::text).toList();
    }

    private static List<String> lastStderrLines(List<RawLine> lines) {
        List<String> stderr = lines.stream()
                .filter(line -> line.source() == StreamSource.STDERR)
                .map(RawLine::text)
                .toList();
        return stderr.subList(Math.max(0, stderr.size() - DIAGNOSTIC_LINES), stderr.size());
    }
}
