/**
 * OutputKind.java
 *
 * 输出事件的语义类别。这是一个封闭的枚举，所有消费者都应使用 switch 穷举处理。
 * CLEAR 仅由终端内置命令 clear 产生，用于通知前端清空其显示的记录。
 */
package club.ppmc.ideshell.model;

public enum OutputKind {
    INFO,
    ERROR,
    WARNING,
    SUCCESS,
    TASK,
    ARTIFACT,
    CLEAR
}
