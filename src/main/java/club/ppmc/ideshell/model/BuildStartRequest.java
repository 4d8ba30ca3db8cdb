/**
 * BuildStartRequest.java
 *
 * 该文件定义了一个数据传输对象 (DTO)，用于封装从客户端发起的构建请求。
 * 由 BuildController 的 start 端点使用，转换为 BuildRequest 后交给 BuildDispatcherService。
 */
package club.ppmc.ideshell.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import java.util.Map;

/**
 * @param projectPath 项目目录，相对路径基于工作区根目录。
 * @param backendType 后端类型，省略时根据项目文件自动检测。
 * @param operation 要执行的操作。
 */
public record BuildStartRequest(
        @NotBlank String projectPath,
        BackendType backendType,
        @NotNull BuildOperation operation,
        String buildType,
        List<String> extraArgs,
        String dependencyName,
        String dependencyVersion,
        List<String> features,
        String targetTriple,
        Map<String, String> environment) {

    public BuildRequest toBuildRequest() {
        return new BuildRequest(
                operation, buildType, extraArgs, dependencyName, dependencyVersion, features, targetTriple, environment);
    }
}
