/**
 * TranscriptWriter.java
 *
 * 把终端会话的输出记录写入文本文件，每个事件一行，格式为 "KIND: message"，UTF-8 编码。
 * 未指定文件名时使用 terminal_yyyyMMdd_HHmmss.txt。
 */
package club.ppmc.ideshell.util;

import club.ppmc.ideshell.model.OutputEvent;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import org.apache.commons.io.FileUtils;
import org.apache.commons.io.FilenameUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

public final class TranscriptWriter {

    private static final Logger LOGGER = LoggerFactory.getLogger(TranscriptWriter.class);
    private static final DateTimeFormatter FILE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private TranscriptWriter() {}

    public static String defaultFileName(LocalDateTime time) {
        return "terminal_" + FILE_TIMESTAMP.format(time) + ".txt";
    }

    /**
     * 写入记录文件。
     *
     * @param directory 目标目录，不存在时自动创建。
     * @param fileName 文件名，为空时使用默认名称；只取文件名部分，不允许跳出目标目录。
     * @param events 要写入的事件。
     * @return 写入的文件路径。
     */
    public static Path write(Path directory, String fileName, List<OutputEvent> events) throws IOException {
        String name = StringUtils.hasText(fileName)
                ? FilenameUtils.getName(fileName.trim())
                : defaultFileName(LocalDateTime.now());
        if (!StringUtils.hasText(name)) {
            throw new IllegalArgumentException("无效的文件名: " + fileName);
        }
        File target = directory.resolve(name).toFile();
        List<String> lines = events.stream().map(OutputEvent::toTranscriptLine).toList();
        FileUtils.writeLines(target, StandardCharsets.UTF_8.name(), lines);
        LOGGER.info("已将 {} 行终端记录写入 {}", lines.size(), target.getAbsolutePath());
        return target.toPath();
    }
}
