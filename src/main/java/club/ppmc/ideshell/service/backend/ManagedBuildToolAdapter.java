/**
 * ManagedBuildToolAdapter.java
 *
 * 托管构建工具 (Gradle) 适配器。
 * 项目中存在 gradlew 包装脚本时使用 "./gradlew"，否则使用设置中配置的 gradle 命令；
 * 所有调用都带 --console=plain，避免输出富文本进度条。依赖管理和交叉编译不由该家族负责。
 */
package club.ppmc.ideshell.service.backend;

import static club.ppmc.ideshell.service.classify.ClassificationRule.artifact;
import static club.ppmc.ideshell.service.classify.ClassificationRule.of;

import club.ppmc.ideshell.exception.EnvironmentConfigurationException;
import club.ppmc.ideshell.model.BackendFamily;
import club.ppmc.ideshell.model.BuildOperation;
import club.ppmc.ideshell.model.BuildRequest;
import club.ppmc.ideshell.model.GradleTask;
import club.ppmc.ideshell.model.Invocation;
import club.ppmc.ideshell.model.OutputKind;
import club.ppmc.ideshell.service.SettingsService;
import club.ppmc.ideshell.service.classify.RuleTable;
import club.ppmc.ideshell.util.ProjectTypeDetector;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import org.apache.commons.io.filefilter.FileFileFilter;
import org.apache.commons.io.filefilter.IOFileFilter;
import org.apache.commons.io.filefilter.SuffixFileFilter;
import org.springframework.stereotype.Component;

@Component
public class ManagedBuildToolAdapter extends AbstractBackendAdapter {

    static final String CONSOLE_PLAIN = "--console=plain";
    static final String WRAPPER_COMMAND = "./gradlew";

    private static final Pattern TASK_SECTION_START = Pattern.compile("^(All tasks|Tasks) runnable from ");
    private static final Pattern UNDERLINE = Pattern.compile("^-+$");

    static final RuleTable RULES = RuleTable.of(
            BackendFamily.MANAGED_BUILD_TOOL,
            List.of(
                    of("task", "^> Task :\\S+", OutputKind.TASK),
                    of("build-successful", "^BUILD SUCCESSFUL", OutputKind.SUCCESS),
                    of("build-failed", "^BUILD FAILED", OutputKind.ERROR),
                    of("failure", "^FAILURE:", OutputKind.ERROR),
                    of("kotlin-error", "^e: \\S+", OutputKind.ERROR),
                    of("kotlin-warning", "^w: \\S+", OutputKind.WARNING),
                    of("compiler-error", "^\\S+\\.(java|kt|kts|groovy):\\d+(:\\d+)?:?\\s*error\\b", OutputKind.ERROR),
                    of("compiler-warning", "^\\S+\\.(java|kt|kts|groovy):\\d+(:\\d+)?:?\\s*warning\\b", OutputKind.WARNING),
                    of("warning", "(?i)\\bwarning:", OutputKind.WARNING),
                    of("deprecation", "^Deprecated Gradle features", OutputKind.WARNING),
                    artifact("generated-output",
                            "(?i)^\\s*(?:generated|output|built|created|wrote)\\b.*?(\\S+\\.(?:apk|aab|aar|jar))\\s*$",
                            1)));

    public ManagedBuildToolAdapter(SettingsService settingsService) {
        super(settingsService);
    }

    @Override
    public BackendFamily family() {
        return BackendFamily.MANAGED_BUILD_TOOL;
    }

    @Override
    public RuleTable ruleTable() {
        return RULES;
    }

    @Override
    public void checkEnvironment(Path projectDir) {
        if (!ProjectTypeDetector.hasGradleBuild(projectDir)) {
            throw new EnvironmentConfigurationException(
                    "项目中未找到 Gradle 构建脚本 (build.gradle[.kts] 或 settings.gradle[.kts]): " + projectDir,
                    "build.gradle",
                    family());
        }
    }

    @Override
    public Invocation build(Path projectDir, BuildRequest request) {
        return gradle(projectDir, request, taskFor(request.buildType()));
    }

    @Override
    public Invocation clean(Path projectDir, BuildRequest request) {
        return gradle(projectDir, request, "clean");
    }

    @Override
    public Invocation test(Path projectDir, BuildRequest request) {
        return gradle(projectDir, request, "test");
    }

    /** 列出项目全部任务的只读调用。 */
    public Invocation listTasks(Path projectDir) {
        checkEnvironment(projectDir);
        List<String> argv = new ArrayList<>();
        argv.add(executable(projectDir));
        argv.add("tasks");
        argv.add("--all");
        argv.add(CONSOLE_PLAIN);
        return invocation(projectDir, BuildRequest.of(BuildOperation.BUILD), argv);
    }

    /**
     * 解析 "tasks --all --console=plain" 的输出。
     * 任务区从 "Tasks runnable from ..." 之后开始，每个分组是一行标题加一行短横线，
     * 遇到 Rules 分组或 BUILD 结果行时结束。
     */
    public static List<GradleTask> parseTaskListing(List<String> lines) {
        List<GradleTask> tasks = new ArrayList<>();
        boolean inSection = false;
        String group = null;
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i).strip();
            if (!inSection) {
                inSection = TASK_SECTION_START.matcher(line).find();
                continue;
            }
            if (line.startsWith("BUILD ")) {
                break;
            }
            if (line.isEmpty() || UNDERLINE.matcher(line).matches()) {
                continue;
            }
            if (i + 1 < lines.size() && UNDERLINE.matcher(lines.get(i + 1).strip()).matches()) {
                if (line.equals("Rules")) {
                    break;
                }
                group = line.endsWith(" tasks") ? line.substring(0, line.length() - " tasks".length()) : line;
                continue;
            }
            if (group == null) {
                continue;
            }
            String[] parts = line.split(" - ", 2);
            String name = parts[0].strip();
            // 分组后面的提示语 ("To see ...") 不是任务
            if (name.isEmpty() || name.chars().anyMatch(Character::isWhitespace)) {
                continue;
            }
            tasks.add(new GradleTask(name, parts.length > 1 ? parts[1].strip() : "", group));
        }
        return tasks;
    }

    /** debug/release 映射为 assemble 任务，其他值视为自定义任务名。 */
    static String taskFor(String buildType) {
        return switch (buildType.toLowerCase()) {
            case "debug" -> "assembleDebug";
            case "release" -> "assembleRelease";
            default -> buildType;
        };
    }

    private Invocation gradle(Path projectDir, BuildRequest request, String task) {
        List<String> argv = new ArrayList<>();
        argv.add(executable(projectDir));
        argv.add(task);
        argv.add(CONSOLE_PLAIN);
        argv.addAll(request.extraArgs());
        return invocation(projectDir, request, argv);
    }

    private String executable(Path projectDir) {
        return ProjectTypeDetector.hasGradleWrapper(projectDir)
                ? WRAPPER_COMMAND
                : settingsService.getSettings().getGradleCommand();
    }

    @Override
    protected List<Path> artifactDirectories(Path projectDir, BuildRequest request) {
        String buildType = request.buildType().toLowerCase();
        Path outputs = projectDir.resolve("app").resolve("build").resolve("outputs");
        return List.of(
                outputs.resolve("apk").resolve(buildType),
                outputs.resolve("bundle").resolve(buildType),
                projectDir.resolve("build").resolve("outputs").resolve("aar"),
                projectDir.resolve("build").resolve("libs"));
    }

    @Override
    protected IOFileFilter artifactFilter() {
        return FileFileFilter.INSTANCE.and(new SuffixFileFilter(".apk", ".aab", ".aar", ".jar"));
    }
}
