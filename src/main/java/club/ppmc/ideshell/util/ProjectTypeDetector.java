/**
 * ProjectTypeDetector.java
 *
 * 这是一个帮助类，根据项目目录中的清单文件判断项目使用的构建后端。
 * 它是无状态的，可以被 BuildDispatcherService 和各个后端适配器共同使用。
 *
 * 判断规则：同时存在 Cargo.toml 与 Gradle 构建脚本 → HYBRID；仅有 Cargo.toml → PACKAGE_MANAGER；
 * 仅有 Gradle 构建脚本 → MANAGED_BUILD_TOOL。
 */
package club.ppmc.ideshell.util;

import club.ppmc.ideshell.exception.EnvironmentConfigurationException;
import club.ppmc.ideshell.model.BackendType;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class ProjectTypeDetector {

    private static final Logger LOGGER = LoggerFactory.getLogger(ProjectTypeDetector.class);

    public static final String CARGO_MANIFEST = "Cargo.toml";
    public static final List<String> GRADLE_SCRIPTS =
            List.of("build.gradle", "build.gradle.kts", "settings.gradle", "settings.gradle.kts");
    public static final String GRADLE_WRAPPER = "gradlew";

    public static boolean hasCargoManifest(Path projectDir) {
        return Files.isRegularFile(projectDir.resolve(CARGO_MANIFEST));
    }

    public static boolean hasGradleBuild(Path projectDir) {
        return GRADLE_SCRIPTS.stream().anyMatch(name -> Files.isRegularFile(projectDir.resolve(name)));
    }

    public static boolean hasGradleWrapper(Path projectDir) {
        return Files.isRegularFile(projectDir.resolve(GRADLE_WRAPPER));
    }

    /**
     * 检测项目类型。
     *
     * @return 无法识别时为空。
     */
    public Optional<BackendType> detect(Path projectDir) {
        boolean cargo = hasCargoManifest(projectDir);
        boolean gradle = hasGradleBuild(projectDir);
        BackendType type = null;
        if (cargo && gradle) {
            type = BackendType.HYBRID;
        } else if (cargo) {
            type = BackendType.PACKAGE_MANAGER;
        } else if (gradle) {
            type = BackendType.MANAGED_BUILD_TOOL;
        }
        LOGGER.debug("项目 {} 的类型检测结果: {}", projectDir, type);
        return Optional.ofNullable(type);
    }

    /**
     * 检测项目类型，无法识别时抛出异常。
     *
     * @throws EnvironmentConfigurationException 项目中既没有 Cargo.toml 也没有 Gradle 构建脚本。
     */
    public BackendType detectOrThrow(Path projectDir) {
        return detect(projectDir).orElseThrow(() -> new EnvironmentConfigurationException(
                "无法识别项目类型：" + projectDir + " 中既没有 Cargo.toml 也没有 Gradle 构建脚本。",
                CARGO_MANIFEST + " / build.gradle",
                null));
    }
}
