/**
 * GradleTask.java
 *
 * "gradle tasks --all" 列出的一个任务，供前端展示可运行的自定义任务。
 */
package club.ppmc.ideshell.model;

/**
 * @param name 任务路径，例如 "app:assembleDebug"。
 * @param description 任务描述，没有描述时为空字符串。
 * @param group 任务所在的分组，例如 "Build"、"Verification"。
 */
public record GradleTask(String name, String description, String group) {}
