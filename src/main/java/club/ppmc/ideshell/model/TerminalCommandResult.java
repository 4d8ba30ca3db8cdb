/**
 * TerminalCommandResult.java
 *
 * execute() 的返回值：刚开始的执行记录、该命令的事件流，以及在命令结束时完成的 Future。
 */
package club.ppmc.ideshell.model;

import club.ppmc.ideshell.util.EventStream;
import java.util.concurrent.CompletableFuture;

public record TerminalCommandResult(
        TerminalCommandExecution execution,
        EventStream<OutputEvent> events,
        CompletableFuture<TerminalCommandExecution> completion) {}
