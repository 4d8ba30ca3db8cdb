/**
 * StreamSource.java
 *
 * 标识一行原始输出来自子进程的哪个输出流。
 */
package club.ppmc.ideshell.model;

public enum StreamSource {
    STDOUT,
    STDERR
}
