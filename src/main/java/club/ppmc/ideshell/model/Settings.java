/**
 * Settings.java
 *
 * 该文件定义了一个POJO，用于表示和持久化IDE外壳的各项配置。
 * 这些设置由用户通过UI修改，由 SettingsService 负责加载和保存到服务器的 .ide/settings.json 文件中。
 * 它是一个可变对象，以便于Jackson库进行序列化和反序列化。
 */
package club.ppmc.ideshell.model;

import lombok.Data;

@Data
public class Settings {

    // --- 环境配置 ---
    /**
     * 工作区根目录的绝对路径。所有项目、书签文件和终端日志都存放在此目录下。
     * 默认值为 "./workspace"。
     */
    private String workspaceRoot = "./workspace";

    /**
     * 托管构建工具的命令。项目中存在 gradlew 包装脚本时优先使用包装脚本。
     */
    private String gradleCommand = "gradle";

    /** 包管理器命令。 */
    private String cargoCommand = "cargo";

    /**
     * CARGO_HOME 与 RUSTUP_HOME。为空时继承宿主环境。
     */
    private String cargoHome;
    private String rustupHome;

    /** 实验性原生构建驱动的可执行文件。 */
    private String nativeDriverCommand = "rust-build-driver";

    // --- 进程与终端 ---
    /**
     * 构建进程无输出的最长秒数，超过后进程被终止并标记为超时。0 表示不限制。
     */
    private long idleTimeoutSeconds = 600;

    /** 终端命令的空闲超时秒数，长时间运行的命令 (top、tail -f 等) 不受此限制。 */
    private long terminalIdleTimeoutSeconds = 300;

    /** 终端记录的保存目录，相对路径基于工作区根目录解析。 */
    private String terminalLogDir = ".ide/terminal-logs";

    /** 执行终端命令时使用的 shell，命令以 "shell -c <command>" 的形式运行。 */
    private String shell = "sh";
}
