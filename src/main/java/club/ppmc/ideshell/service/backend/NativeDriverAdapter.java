/**
 * NativeDriverAdapter.java
 *
 * 实验性原生构建驱动适配器。驱动程序通过带方括号前缀的行 ([ERROR]、[TASK]、[ARTIFACT] 等) 报告进度，
 * 规则表优先识别这些协议前缀，其余行只在以 rustc 风格的 "error:"、"warning:" 诊断前缀开头时才升级，
 * 行中其他位置出现的 error 字样 (例如 quick-error 这样的 crate 名) 不影响分类。
 * 驱动同样以 Cargo.toml 作为项目清单；不支持依赖管理。
 */
package club.ppmc.ideshell.service.backend;

import static club.ppmc.ideshell.service.classify.ClassificationRule.artifact;
import static club.ppmc.ideshell.service.classify.ClassificationRule.of;

import club.ppmc.ideshell.exception.EnvironmentConfigurationException;
import club.ppmc.ideshell.model.BackendFamily;
import club.ppmc.ideshell.model.BuildRequest;
import club.ppmc.ideshell.model.Invocation;
import club.ppmc.ideshell.model.OutputKind;
import club.ppmc.ideshell.service.SettingsService;
import club.ppmc.ideshell.service.classify.RuleTable;
import club.ppmc.ideshell.util.ProjectTypeDetector;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.io.filefilter.IOFileFilter;
import org.springframework.stereotype.Component;

@Component
public class NativeDriverAdapter extends AbstractBackendAdapter {

    static final RuleTable RULES = RuleTable.of(
            BackendFamily.NATIVE_DRIVER,
            List.of(
                    of("protocol-error", "^\\[ERROR\\]", OutputKind.ERROR),
                    of("protocol-warning", "^\\[WARN(ING)?\\]", OutputKind.WARNING),
                    of("protocol-success", "^\\[SUCCESS\\]", OutputKind.SUCCESS),
                    of("protocol-task", "^\\[TASK\\]", OutputKind.TASK),
                    artifact("protocol-artifact", "^\\[ARTIFACT\\]\\s+(\\S.*?)\\s*$", 1),
                    of("diagnostic-error", "^\\s*error(\\[E\\d+\\])?:", OutputKind.ERROR),
                    of("diagnostic-warning", "^\\s*warning:", OutputKind.WARNING),
                    of("compile-progress", "^\\s*(Compiling|Checking)\\s", OutputKind.TASK)));

    public NativeDriverAdapter(SettingsService settingsService) {
        super(settingsService);
    }

    @Override
    public BackendFamily family() {
        return BackendFamily.NATIVE_DRIVER;
    }

    @Override
    public RuleTable ruleTable() {
        return RULES;
    }

    @Override
    public void checkEnvironment(Path projectDir) {
        if (!ProjectTypeDetector.hasCargoManifest(projectDir)) {
            throw new EnvironmentConfigurationException(
                    "原生构建驱动需要 Cargo.toml，但在 " + projectDir + " 中未找到。",
                    ProjectTypeDetector.CARGO_MANIFEST,
                    family());
        }
    }

    @Override
    public Invocation build(Path projectDir, BuildRequest request) {
        List<String> argv = driver("build");
        argv.add("--build-type");
        argv.add(request.buildType());
        return withProject(projectDir, request, argv);
    }

    @Override
    public Invocation clean(Path projectDir, BuildRequest request) {
        return withProject(projectDir, request, driver("clean"));
    }

    @Override
    public Invocation test(Path projectDir, BuildRequest request) {
        List<String> argv = driver("test");
        if (request.isRelease()) {
            argv.add("--release");
        }
        return withProject(projectDir, request, argv);
    }

    @Override
    public Invocation crossTargetBuild(Path projectDir, BuildRequest request) {
        String triple = requireText(request.targetTriple(), "交叉编译时必须指定目标三元组。");
        List<String> argv = driver("build-target");
        argv.add("--target");
        argv.add(triple);
        argv.add("--build-type");
        argv.add(request.buildType());
        return withProject(projectDir, request, argv);
    }

    private List<String> driver(String subcommand) {
        List<String> argv = new ArrayList<>();
        argv.add(settingsService.getSettings().getNativeDriverCommand());
        argv.add(subcommand);
        return argv;
    }

    private Invocation withProject(Path projectDir, BuildRequest request, List<String> argv) {
        argv.add("--project");
        argv.add(projectDir.toString());
        argv.addAll(request.extraArgs());
        return invocation(projectDir, request, argv);
    }

    @Override
    protected List<Path> artifactDirectories(Path projectDir, BuildRequest request) {
        return List.of(PackageManagerAdapter.targetProfileDir(projectDir, request));
    }

    @Override
    protected IOFileFilter artifactFilter() {
        return PackageManagerAdapter.cargoArtifactFilter();
    }
}
