/**
 * Invocation.java
 *
 * 后端适配器构造出的一次完整的工具链调用：参数向量、工作目录和环境变量覆盖。
 * 适配器本身不启动进程，而是把 Invocation 交给 ProcessExecutor。
 */
package club.ppmc.ideshell.model;

import club.ppmc.ideshell.util.EnvironmentOverrides;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * @param family 产生该调用的工具链家族，决定输出分类使用的规则表。
 * @param argv 参数向量，第一个元素为可执行文件。
 * @param workingDirectory 工作目录。
 * @param environment 覆盖宿主环境的变量。
 */
public record Invocation(
        BackendFamily family, List<String> argv, Path workingDirectory, Map<String, String> environment) {

    public Invocation {
        Objects.requireNonNull(family, "family");
        Objects.requireNonNull(workingDirectory, "workingDirectory");
        argv = List.copyOf(argv);
        environment = EnvironmentOverrides.copyOf(environment);
    }

    public String commandLine() {
        return String.join(" ", argv);
    }
}
