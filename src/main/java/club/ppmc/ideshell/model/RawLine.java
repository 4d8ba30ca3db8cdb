/**
 * RawLine.java
 *
 * 子进程输出的一行原始文本，附带其来源流。
 * 由 ProcessExecutor 的读取线程产生，交给 OutputClassifier 分类。
 */
package club.ppmc.ideshell.model;

import java.util.Objects;

/**
 * @param source 该行来自 stdout 还是 stderr。
 * @param text 去掉行结束符后的文本。
 */
public record RawLine(StreamSource source, String text) {

    public RawLine {
        Objects.requireNonNull(source, "source");
        text = text == null ? "" : text;
    }

    public static RawLine stdout(String text) {
        return new RawLine(StreamSource.STDOUT, text);
    }

    public static RawLine stderr(String text) {
        return new RawLine(StreamSource.STDERR, text);
    }
}
