/**
 * PackageManagerAdapter.java
 *
 * 包管理器 (Cargo) 适配器，支持全部六种操作。
 * Cargo 把编译进度写到 stderr，所以该家族的规则表对 stderr 未命中的行也按 INFO 处理。
 * 设置中配置了 CARGO_HOME / RUSTUP_HOME 时会注入到每次调用的环境中。
 * 另外提供一个只读查询：用 "cargo metadata" 读取当前 crate 的清单信息。
 */
package club.ppmc.ideshell.service.backend;

import static club.ppmc.ideshell.service.classify.ClassificationRule.artifact;
import static club.ppmc.ideshell.service.classify.ClassificationRule.of;

import club.ppmc.ideshell.exception.EnvironmentConfigurationException;
import club.ppmc.ideshell.model.BackendFamily;
import club.ppmc.ideshell.model.BuildOperation;
import club.ppmc.ideshell.model.BuildRequest;
import club.ppmc.ideshell.model.CrateDependency;
import club.ppmc.ideshell.model.CrateInfo;
import club.ppmc.ideshell.model.Invocation;
import club.ppmc.ideshell.model.OutputKind;
import club.ppmc.ideshell.model.Settings;
import club.ppmc.ideshell.service.SettingsService;
import club.ppmc.ideshell.service.classify.RuleTable;
import club.ppmc.ideshell.util.ProjectTypeDetector;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.commons.io.filefilter.FileFileFilter;
import org.apache.commons.io.filefilter.HiddenFileFilter;
import org.apache.commons.io.filefilter.IOFileFilter;
import org.apache.commons.io.filefilter.SuffixFileFilter;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

@Component
public class PackageManagerAdapter extends AbstractBackendAdapter {

    static final RuleTable RULES = RuleTable.of(
            BackendFamily.PACKAGE_MANAGER,
            List.of(
                    of("error-code", "^error\\[E\\d+\\]:", OutputKind.ERROR),
                    of("error", "^error(:|\\s)", OutputKind.ERROR),
                    of("warning", "^warning(\\[\\w+\\])?:", OutputKind.WARNING),
                    of("test-result-failed", "^test result: FAILED", OutputKind.ERROR),
                    of("test-result-ok", "^test result: ok", OutputKind.SUCCESS),
                    of("test-case-failed", "^test \\S+ \\.\\.\\. FAILED", OutputKind.ERROR),
                    of("finished", "^\\s*Finished\\b", OutputKind.SUCCESS),
                    artifact("packaged", "^\\s*(?:Packaged|Installed)\\b.*?(\\S+\\.(?:crate|so|a|dylib|dll|exe|wasm))\\b", 1),
                    of("progress",
                            "^\\s*(Compiling|Checking|Running|Downloaded|Downloading|Updating|Adding|Removing|Locking"
                                    + "|Documenting|Packaging|Installing|Fresh)\\s",
                            OutputKind.TASK)));

    public PackageManagerAdapter(SettingsService settingsService) {
        super(settingsService);
    }

    @Override
    public BackendFamily family() {
        return BackendFamily.PACKAGE_MANAGER;
    }

    @Override
    public RuleTable ruleTable() {
        return RULES;
    }

    @Override
    public void checkEnvironment(Path projectDir) {
        if (!ProjectTypeDetector.hasCargoManifest(projectDir)) {
            throw new EnvironmentConfigurationException(
                    "项目中未找到 Cargo.toml: " + projectDir, ProjectTypeDetector.CARGO_MANIFEST, family());
        }
    }

    @Override
    public Invocation build(Path projectDir, BuildRequest request) {
        List<String> argv = cargo("build");
        if (request.isRelease()) {
            argv.add("--release");
        }
        argv.addAll(request.extraArgs());
        return invocation(projectDir, request, argv);
    }

    @Override
    public Invocation clean(Path projectDir, BuildRequest request) {
        List<String> argv = cargo("clean");
        argv.addAll(request.extraArgs());
        return invocation(projectDir, request, argv);
    }

    @Override
    public Invocation test(Path projectDir, BuildRequest request) {
        List<String> argv = cargo("test");
        if (request.isRelease()) {
            argv.add("--release");
        }
        argv.addAll(request.extraArgs());
        return invocation(projectDir, request, argv);
    }

    @Override
    public Invocation addDependency(Path projectDir, BuildRequest request) {
        String name = requireText(request.dependencyName(), "添加依赖时必须指定依赖名称。");
        List<String> argv = cargo("add");
        argv.add(StringUtils.hasText(request.dependencyVersion())
                ? name + "@" + request.dependencyVersion().trim()
                : name);
        if (!request.features().isEmpty()) {
            argv.add("--features");
            argv.add(String.join(",", request.features()));
        }
        return invocation(projectDir, request, argv);
    }

    @Override
    public Invocation removeDependency(Path projectDir, BuildRequest request) {
        String name = requireText(request.dependencyName(), "移除依赖时必须指定依赖名称。");
        List<String> argv = cargo("remove");
        argv.add(name);
        return invocation(projectDir, request, argv);
    }

    @Override
    public Invocation crossTargetBuild(Path projectDir, BuildRequest request) {
        String triple = requireText(request.targetTriple(), "交叉编译时必须指定目标三元组。");
        List<String> argv = cargo("build");
        argv.add("--target");
        argv.add(triple);
        if (request.isRelease()) {
            argv.add("--release");
        }
        argv.addAll(request.extraArgs());
        return invocation(projectDir, request, argv);
    }

    /** 读取当前 crate 清单信息的只读调用，不解析依赖图。 */
    public Invocation metadata(Path projectDir) {
        checkEnvironment(projectDir);
        List<String> argv = cargo("metadata");
        argv.add("--no-deps");
        argv.add("--format-version");
        argv.add("1");
        return invocation(projectDir, BuildRequest.of(BuildOperation.BUILD), argv);
    }

    /**
     * 从 "cargo metadata" 的 JSON 输出中取出 projectDir 对应的包。
     * 工作区中有多个成员时按 manifest_path 匹配，匹配不到时取第一个包。
     *
     * @throws IllegalArgumentException 输出不是合法的 metadata JSON，或其中没有任何包。
     */
    public static CrateInfo parseMetadata(String json, Path projectDir) {
        JsonArray packages;
        try {
            JsonElement root = JsonParser.parseString(json);
            packages = root.isJsonObject() && root.getAsJsonObject().has("packages")
                    ? root.getAsJsonObject().getAsJsonArray("packages")
                    : null;
        } catch (JsonParseException | IllegalStateException | ClassCastException e) {
            throw new IllegalArgumentException("无法解析 cargo metadata 输出: " + e.getMessage(), e);
        }
        if (packages == null || packages.isEmpty()) {
            throw new IllegalArgumentException("cargo metadata 输出中没有任何包。");
        }

        String manifest = projectDir.resolve(ProjectTypeDetector.CARGO_MANIFEST).toAbsolutePath().normalize().toString();
        JsonObject pkg = packages.get(0).getAsJsonObject();
        for (JsonElement candidate : packages) {
            if (manifest.equals(string(candidate.getAsJsonObject(), "manifest_path"))) {
                pkg = candidate.getAsJsonObject();
                break;
            }
        }

        Set<String> crateTypes = new LinkedHashSet<>();
        for (JsonElement target : array(pkg, "targets")) {
            crateTypes.addAll(strings(array(target.getAsJsonObject(), "crate_types")));
        }
        List<CrateDependency> dependencies = new ArrayList<>();
        for (JsonElement element : array(pkg, "dependencies")) {
            JsonObject dependency = element.getAsJsonObject();
            String kind = string(dependency, "kind");
            dependencies.add(new CrateDependency(
                    string(dependency, "name"),
                    string(dependency, "req"),
                    kind == null ? "normal" : kind,
                    dependency.has("optional") && dependency.get("optional").getAsBoolean(),
                    strings(array(dependency, "features"))));
        }
        List<String> features = pkg.has("features") && pkg.get("features").isJsonObject()
                ? pkg.getAsJsonObject("features").keySet().stream().sorted().toList()
                : List.of();

        return new CrateInfo(
                string(pkg, "name"),
                string(pkg, "version"),
                strings(array(pkg, "authors")),
                string(pkg, "description"),
                string(pkg, "edition"),
                List.copyOf(crateTypes),
                dependencies,
                features);
    }

    private static String string(JsonObject object, String member) {
        JsonElement value = object.get(member);
        return value == null || value.isJsonNull() ? null : value.getAsString();
    }

    private static JsonArray array(JsonObject object, String member) {
        JsonElement value = object.get(member);
        return value != null && value.isJsonArray() ? value.getAsJsonArray() : new JsonArray();
    }

    private static List<String> strings(JsonArray array) {
        List<String> values = new ArrayList<>();
        array.forEach(element -> values.add(element.getAsString()));
        return values;
    }

    private List<String> cargo(String subcommand) {
        List<String> argv = new ArrayList<>();
        argv.add(settingsService.getSettings().getCargoCommand());
        argv.add(subcommand);
        return argv;
    }

    @Override
    protected Map<String, String> baseEnvironment() {
        Settings settings = settingsService.getSettings();
        Map<String, String> env = new HashMap<>();
        if (StringUtils.hasText(settings.getCargoHome())) {
            env.put("CARGO_HOME", settings.getCargoHome());
        }
        if (StringUtils.hasText(settings.getRustupHome())) {
            env.put("RUSTUP_HOME", settings.getRustupHome());
        }
        return env;
    }

    @Override
    protected List<Path> artifactDirectories(Path projectDir, BuildRequest request) {
        return List.of(targetProfileDir(projectDir, request));
    }

    @Override
    protected IOFileFilter artifactFilter() {
        return cargoArtifactFilter();
    }

    /** target/[triple/]debug|release */
    static Path targetProfileDir(Path projectDir, BuildRequest request) {
        Path target = projectDir.resolve("target");
        if (StringUtils.hasText(request.targetTriple())) {
            target = target.resolve(request.targetTriple().trim());
        }
        return target.resolve(request.isRelease() ? "release" : "debug");
    }

    /** 排除依赖信息文件和中间库文件，只保留最终产物。 */
    static IOFileFilter cargoArtifactFilter() {
        return FileFileFilter.INSTANCE
                .and(HiddenFileFilter.VISIBLE)
                .and(new SuffixFileFilter(".d", ".rlib", ".rmeta", ".pdb").negate());
    }
}
