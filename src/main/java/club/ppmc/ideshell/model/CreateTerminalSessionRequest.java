/**
 * CreateTerminalSessionRequest.java
 *
 * 创建终端会话的请求体。两个字段都可以省略。
 *
 * @param workingDirectory 初始工作目录，相对路径基于工作区根目录。
 * @param environment 覆盖宿主环境的变量。
 */
package club.ppmc.ideshell.model;

import java.util.Map;

public record CreateTerminalSessionRequest(String workingDirectory, Map<String, String> environment) {}
