/**
 * SettingsService.java
 *
 * 该服务是整个应用的配置中心，负责管理IDE外壳的所有可配置项。
 * 它处理配置的加载、更新和持久化，将配置信息以JSON格式存储在工作区的一个隐藏目录 (.ide) 中。
 * 在首次启动时，它会使用 application.properties 中的值作为默认设置来创建配置文件。
 * 所有其他需要配置的服务都应依赖此服务，而不是直接使用 @Value 注解。
 */
package club.ppmc.ideshell.service;

import club.ppmc.ideshell.exception.EnvironmentConfigurationException;
import club.ppmc.ideshell.model.Settings;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

@Service
public class SettingsService {

    private static final Logger LOGGER = LoggerFactory.getLogger(SettingsService.class);
    static final String SETTINGS_DIR = ".ide";
    private static final String SETTINGS_FILE_NAME = "settings.json";

    private final Path settingsFilePath;
    private final ObjectMapper objectMapper;
    private volatile Settings currentSettings;

    // --- 用于首次初始化的默认值 ---
    private final String initialWorkspaceRoot;
    private final String initialGradleCommand;
    private final String initialCargoCommand;
    private final String initialNativeDriverCommand;
    private final long initialIdleTimeoutSeconds;
    private final String initialTerminalLogDir;
    private final String initialShell;

    public SettingsService(
            @Value("${app.workspace-root}") String initialWorkspaceRoot,
            @Value("${app.toolchain.gradle-command:gradle}") String initialGradleCommand,
            @Value("${app.toolchain.cargo-command:cargo}") String initialCargoCommand,
            @Value("${app.toolchain.native-driver-command:rust-build-driver}") String initialNativeDriverCommand,
            @Value("${app.process.idle-timeout-seconds:600}") long initialIdleTimeoutSeconds,
            @Value("${app.terminal.log-dir:.ide/terminal-logs}") String initialTerminalLogDir,
            @Value("${app.terminal.shell:sh}") String initialShell) {

        this.initialWorkspaceRoot = initialWorkspaceRoot;
        this.initialGradleCommand = initialGradleCommand;
        this.initialCargoCommand = initialCargoCommand;
        this.initialNativeDriverCommand = initialNativeDriverCommand;
        this.initialIdleTimeoutSeconds = initialIdleTimeoutSeconds;
        this.initialTerminalLogDir = initialTerminalLogDir;
        this.initialShell = initialShell;

        // 设置文件的路径依赖于初始工作区路径；用户修改工作区后，保存时会写到新的工作区下。
        this.settingsFilePath =
                Paths.get(initialWorkspaceRoot, SETTINGS_DIR, SETTINGS_FILE_NAME)
                        .toAbsolutePath()
                        .normalize();
        this.objectMapper = new ObjectMapper()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @PostConstruct
    public void init() {
        try {
            Path settingsDir = this.settingsFilePath.getParent();
            if (Files.notExists(settingsDir)) {
                Files.createDirectories(settingsDir);
            }
            if (Files.exists(this.settingsFilePath)) {
                loadSettings();
            } else {
                createAndSaveDefaultSettings();
            }
        } catch (IOException e) {
            LOGGER.error("初始化设置失败。将使用临时的默认设置。", e);
            this.currentSettings = createDefaultSettings();
        }
    }

    public synchronized Settings getSettings() {
        return this.currentSettings;
    }

    public synchronized void updateSettings(Settings newSettings) throws IOException {
        if (!StringUtils.hasText(newSettings.getWorkspaceRoot())) {
            throw new IllegalArgumentException("工作区根目录不能为空。");
        }
        if (newSettings.getIdleTimeoutSeconds() < 0 || newSettings.getTerminalIdleTimeoutSeconds() < 0) {
            throw new IllegalArgumentException("超时时间不能为负数。");
        }
        this.currentSettings = newSettings;
        saveSettings();
    }

    public Path getWorkspaceRoot() {
        return Paths.get(getSettings().getWorkspaceRoot()).toAbsolutePath().normalize();
    }

    /**
     * 解析项目目录，相对路径基于工作区根目录。
     *
     * @throws IllegalArgumentException 路径为空。
     * @throws EnvironmentConfigurationException 目录不存在。
     */
    public Path resolveProjectDirectory(String projectPath) {
        if (!StringUtils.hasText(projectPath)) {
            throw new IllegalArgumentException("项目路径不能为空。");
        }
        Path path = Paths.get(projectPath.trim());
        Path projectDir = (path.isAbsolute() ? path : getWorkspaceRoot().resolve(path)).toAbsolutePath().normalize();
        if (!Files.isDirectory(projectDir)) {
            throw new EnvironmentConfigurationException("项目目录不存在: " + projectDir, "project directory", null);
        }
        return projectDir;
    }

    /** 构建进程的空闲超时；0 表示不限制。 */
    public Duration getBuildIdleTimeout() {
        return Duration.ofSeconds(getSettings().getIdleTimeoutSeconds());
    }

    public Duration getTerminalIdleTimeout() {
        return Duration.ofSeconds(getSettings().getTerminalIdleTimeoutSeconds());
    }

    /** 终端记录目录，相对路径基于工作区根目录解析。 */
    public Path getTerminalLogDir() {
        Path configured = Paths.get(getSettings().getTerminalLogDir());
        return configured.isAbsolute() ? configured.normalize() : getWorkspaceRoot().resolve(configured).normalize();
    }

    /** 存放书签、历史等 IDE 内部数据的目录。 */
    public Path getIdeDataDir() {
        return getWorkspaceRoot().resolve(SETTINGS_DIR);
    }

    private void loadSettings() throws IOException {
        try {
            byte[] jsonData = Files.readAllBytes(settingsFilePath);
            this.currentSettings = objectMapper.readValue(jsonData, Settings.class);
            LOGGER.info("已成功从 {} 加载设置。", settingsFilePath);
        } catch (IOException e) {
            LOGGER.error("读取设置文件时出错。下次保存时将创建新的默认文件。", e);
            this.currentSettings = createDefaultSettings();
            throw e;
        }
    }

    private void saveSettings() throws IOException {
        // 获取最新的工作区路径来保存文件
        Path currentSettingsPath = Paths.get(currentSettings.getWorkspaceRoot(), SETTINGS_DIR, SETTINGS_FILE_NAME)
                .toAbsolutePath()
                .normalize();
        if (Files.notExists(currentSettingsPath.getParent())) {
            Files.createDirectories(currentSettingsPath.getParent());
        }

        try {
            byte[] jsonData = objectMapper.writeValueAsBytes(currentSettings);
            Files.write(currentSettingsPath, jsonData);
            LOGGER.info("已成功将设置保存到 {}", currentSettingsPath);
        } catch (IOException e) {
            LOGGER.error("将设置保存到文件 {} 时失败", currentSettingsPath, e);
            throw e;
        }
    }

    private void createAndSaveDefaultSettings() throws IOException {
        this.currentSettings = createDefaultSettings();
        saveSettings();
        LOGGER.info("未找到设置文件。已在 {} 创建了包含默认值的新文件。", settingsFilePath);
    }

    private Settings createDefaultSettings() {
        var settings = new Settings();
        settings.setWorkspaceRoot(this.initialWorkspaceRoot);
        if (StringUtils.hasText(this.initialGradleCommand)) {
            settings.setGradleCommand(this.initialGradleCommand);
        }
        if (StringUtils.hasText(this.initialCargoCommand)) {
            settings.setCargoCommand(this.initialCargoCommand);
        }
        if (StringUtils.hasText(this.initialNativeDriverCommand)) {
            settings.setNativeDriverCommand(this.initialNativeDriverCommand);
        }
        settings.setIdleTimeoutSeconds(Math.max(0, this.initialIdleTimeoutSeconds));
        if (StringUtils.hasText(this.initialTerminalLogDir)) {
            settings.setTerminalLogDir(this.initialTerminalLogDir);
        }
        if (StringUtils.hasText(this.initialShell)) {
            settings.setShell(this.initialShell);
        }
        return settings;
    }
}
