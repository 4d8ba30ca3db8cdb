/**
 * AbstractBackendAdapter.java
 *
 * 后端适配器的公共基类：提供"不支持的操作"的默认实现、环境变量合并以及基于 Commons IO 的产物目录扫描。
 */
package club.ppmc.ideshell.service.backend;

import club.ppmc.ideshell.exception.InvalidOperationException;
import club.ppmc.ideshell.model.BuildOperation;
import club.ppmc.ideshell.model.BuildRequest;
import club.ppmc.ideshell.model.Invocation;
import club.ppmc.ideshell.service.SettingsService;
import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.io.FileUtils;
import org.apache.commons.io.filefilter.IOFileFilter;
import org.springframework.util.StringUtils;

public abstract class AbstractBackendAdapter implements BackendAdapter {

    protected final SettingsService settingsService;

    protected AbstractBackendAdapter(SettingsService settingsService) {
        this.settingsService = settingsService;
    }

    @Override
    public Invocation addDependency(Path projectDir, BuildRequest request) {
        throw unsupported(BuildOperation.ADD_DEPENDENCY);
    }

    @Override
    public Invocation removeDependency(Path projectDir, BuildRequest request) {
        throw unsupported(BuildOperation.REMOVE_DEPENDENCY);
    }

    @Override
    public Invocation crossTargetBuild(Path projectDir, BuildRequest request) {
        throw unsupported(BuildOperation.CROSS_TARGET_BUILD);
    }

    @Override
    public List<Path> findArtifacts(Path projectDir, BuildRequest request) {
        BuildOperation operation = request.operation();
        if (operation != BuildOperation.BUILD && operation != BuildOperation.CROSS_TARGET_BUILD) {
            return List.of();
        }
        List<Path> artifacts = new ArrayList<>();
        for (Path dir : artifactDirectories(projectDir, request)) {
            if (!Files.isDirectory(dir)) {
                continue;
            }
            // dirFilter 为 null 表示不递归子目录
            Collection<File> files = FileUtils.listFiles(dir.toFile(), artifactFilter(), null);
            files.stream().map(File::toPath).sorted(Comparator.naturalOrder()).forEach(artifacts::add);
        }
        return artifacts;
    }

    /** 构建成功后需要扫描的目录。 */
    protected abstract List<Path> artifactDirectories(Path projectDir, BuildRequest request);

    /** 产物目录中哪些文件算作产物。 */
    protected abstract IOFileFilter artifactFilter();

    /** 该家族固定附加的环境变量，例如工具链的安装目录。 */
    protected Map<String, String> baseEnvironment() {
        return Map.of();
    }

    protected Invocation invocation(Path projectDir, BuildRequest request, List<String> argv) {
        Map<String, String> environment = new HashMap<>(baseEnvironment());
        environment.putAll(request.environment());
        return new Invocation(family(), argv, projectDir, environment);
    }

    protected InvalidOperationException unsupported(BuildOperation operation) {
        return new InvalidOperationException(family(), operation);
    }

    protected static String requireText(String value, String message) {
        if (!StringUtils.hasText(value)) {
            throw new IllegalArgumentException(message);
        }
        return value.trim();
    }
}
