/**
 * BookmarkRequest.java
 *
 * 收藏一条终端命令的请求体。
 */
package club.ppmc.ideshell.model;

import jakarta.validation.constraints.NotBlank;
import java.util.List;

public record BookmarkRequest(@NotBlank String command, String description, List<String> tags) {}
