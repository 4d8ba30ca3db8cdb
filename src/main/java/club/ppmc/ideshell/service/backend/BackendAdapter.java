/**
 * BackendAdapter.java
 *
 * 后端适配器接口。每个工具链家族 (托管构建工具、包管理器、原生构建驱动) 实现一个适配器，
 * 把通用的构建操作转换为该工具链的具体命令行 (Invocation)。
 * 适配器只负责"规划"，从不启动进程；进程由 BuildDispatcherService 通过 ProcessExecutor 启动。
 * 新增一个后端只需要新增一个实现类，它会被 BackendAdapterRegistry 自动发现并注册规则表。
 */
package club.ppmc.ideshell.service.backend;

import club.ppmc.ideshell.exception.EnvironmentConfigurationException;
import club.ppmc.ideshell.exception.InvalidOperationException;
import club.ppmc.ideshell.model.BackendFamily;
import club.ppmc.ideshell.model.BuildRequest;
import club.ppmc.ideshell.model.Invocation;
import club.ppmc.ideshell.service.classify.RuleTable;
import java.nio.file.Path;
import java.util.List;

public interface BackendAdapter {

    BackendFamily family();

    /** 该家族输出使用的分类规则表。 */
    RuleTable ruleTable();

    /**
     * 检查项目是否满足该家族的前置条件 (通常是清单文件存在)。
     *
     * @throws EnvironmentConfigurationException 项目缺少必须的清单文件。
     */
    void checkEnvironment(Path projectDir);

    Invocation build(Path projectDir, BuildRequest request);

    Invocation clean(Path projectDir, BuildRequest request);

    Invocation test(Path projectDir, BuildRequest request);

    Invocation addDependency(Path projectDir, BuildRequest request);

    Invocation removeDependency(Path projectDir, BuildRequest request);

    Invocation crossTargetBuild(Path projectDir, BuildRequest request);

    /**
     * 构建成功后扫描产物目录，返回找到的产物文件。非构建类操作返回空列表。
     */
    List<Path> findArtifacts(Path projectDir, BuildRequest request);

    /**
     * 校验环境并按操作类型分派到对应的方法。
     *
     * @throws InvalidOperationException 该家族不支持请求的操作。
     * @throws EnvironmentConfigurationException 项目缺少必须的清单文件。
     */
    default Invocation plan(Path projectDir, BuildRequest request) {
        checkEnvironment(projectDir);
        return switch (request.operation()) {
            case BUILD -> build(projectDir, request);
            case CLEAN -> clean(projectDir, request);
            case TEST -> test(projectDir, request);
            case ADD_DEPENDENCY -> addDependency(projectDir, request);
            case REMOVE_DEPENDENCY -> removeDependency(projectDir, request);
            case CROSS_TARGET_BUILD -> crossTargetBuild(projectDir, request);
        };
    }
}
