/**
 * BuildRequest.java
 *
 * 描述一次构建类操作及其参数。由 BuildController 从请求体构造，交给 BuildDispatcherService，
 * 再由各 BackendAdapter 转换为具体的命令行。
 */
package club.ppmc.ideshell.model;

import club.ppmc.ideshell.util.EnvironmentOverrides;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * @param operation 要执行的操作。
 * @param buildType 构建类型，如 "debug"、"release"，或托管构建工具的自定义任务名。
 * @param extraArgs 追加到命令行末尾的自由参数。
 * @param dependencyName 依赖名称 (仅用于添加/移除依赖)。
 * @param dependencyVersion 依赖版本，可为空。
 * @param features 依赖启用的特性列表。
 * @param targetTriple 交叉编译目标三元组 (仅用于 CROSS_TARGET_BUILD)。
 * @param environment 本次操作额外覆盖的环境变量。
 */
public record BuildRequest(
        BuildOperation operation,
        String buildType,
        List<String> extraArgs,
        String dependencyName,
        String dependencyVersion,
        List<String> features,
        String targetTriple,
        Map<String, String> environment) {

    public static final String DEFAULT_BUILD_TYPE = "debug";

    public BuildRequest {
        Objects.requireNonNull(operation, "operation");
        buildType = buildType == null || buildType.isBlank() ? DEFAULT_BUILD_TYPE : buildType.trim();
        extraArgs = EnvironmentOverrides.copyOfArguments(extraArgs, "extraArgs");
        features = EnvironmentOverrides.copyOfArguments(features, "features");
        environment = EnvironmentOverrides.copyOf(environment);
    }

    public static BuildRequest of(BuildOperation operation) {
        return new BuildRequest(operation, null, null, null, null, null, null, null);
    }

    public static BuildRequest build(String buildType) {
        return new BuildRequest(BuildOperation.BUILD, buildType, null, null, null, null, null, null);
    }

    public static BuildRequest crossTarget(String targetTriple, String buildType) {
        return new BuildRequest(
                BuildOperation.CROSS_TARGET_BUILD, buildType, null, null, null, null, targetTriple, null);
    }

    public static BuildRequest addDependency(String name, String version, List<String> features) {
        return new BuildRequest(BuildOperation.ADD_DEPENDENCY, null, null, name, version, features, null, null);
    }

    public static BuildRequest removeDependency(String name) {
        return new BuildRequest(BuildOperation.REMOVE_DEPENDENCY, null, null, name, null, null, null, null);
    }

    public boolean isRelease() {
        return "release".equalsIgnoreCase(buildType);
    }

    /** 以相同参数替换操作类型，HYBRID 的打包阶段使用。 */
    public BuildRequest withOperation(BuildOperation newOperation) {
        return new BuildRequest(
                newOperation, buildType, extraArgs, dependencyName, dependencyVersion, features, targetTriple, environment);
    }
}
