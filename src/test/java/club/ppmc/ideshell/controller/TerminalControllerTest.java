package club.ppmc.ideshell.controller;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

import club.ppmc.ideshell.exception.SessionBusyException;
import club.ppmc.ideshell.exception.SessionNotFoundException;
import club.ppmc.ideshell.model.OutputEvent;
import club.ppmc.ideshell.model.SessionStatus;
import club.ppmc.ideshell.model.TerminalCommandExecution;
import club.ppmc.ideshell.model.TerminalCommandResult;
import club.ppmc.ideshell.model.TerminalSessionInfo;
import club.ppmc.ideshell.service.TerminalSessionService;
import club.ppmc.ideshell.util.EventStream;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(TerminalController.class)
class TerminalControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private TerminalSessionService terminalSessionService;

    @Test
    @DisplayName("creating a session without a body uses the workspace root")
    void createSession() throws Exception {
        when(terminalSessionService.createSession(isNull(), isNull()))
                .thenReturn(new TerminalSessionInfo("t-1", "/work", true, false, 1L, 0));

        mockMvc.perform(post("/api/terminal/sessions"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value("t-1"))
                .andExpect(jsonPath("$.workingDirectory").value("/work"));
    }

    @Test
    void createSessionInMissingDirectory() throws Exception {
        when(terminalSessionService.createSession(eq("missing"), any()))
                .thenThrow(new IllegalArgumentException("目录未找到: missing"));

        mockMvc.perform(post("/api/terminal/sessions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"workingDirectory\":\"missing\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("executing a command returns the running execution")
    void execute() throws Exception {
        var execution = TerminalCommandExecution.started("c-1", "t-1", "ls", false);
        when(terminalSessionService.execute("t-1", "ls")).thenReturn(
                new TerminalCommandResult(execution, new EventStream<OutputEvent>(), new CompletableFuture<>()));

        mockMvc.perform(post("/api/terminal/sessions/t-1/commands")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"command\":\"ls\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value("c-1"))
                .andExpect(jsonPath("$.status").value(SessionStatus.RUNNING.name()));
    }

    @Test
    @DisplayName("a busy session answers 409")
    void executeWhileBusy() throws Exception {
        when(terminalSessionService.execute("t-1", "ls")).thenThrow(new SessionBusyException("t-1", "busy"));

        mockMvc.perform(post("/api/terminal/sessions/t-1/commands")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"command\":\"ls\"}"))
                .andExpect(status().isConflict());
    }

    @Test
    void blankCommandFailsValidation() throws Exception {
        mockMvc.perform(post("/api/terminal/sessions/t-1/commands")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"command\":\"\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("navigating past the newest history entry returns a null command")
    void historyNavigation() throws Exception {
        when(terminalSessionService.previousCommand("t-1")).thenReturn(Optional.of("git status"));
        when(terminalSessionService.nextCommand("t-1")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/terminal/sessions/t-1/history/previous"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.command").value("git status"));
        mockMvc.perform(get("/api/terminal/sessions/t-1/history/next"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.command").isEmpty());
        mockMvc.perform(get("/api/terminal/sessions/t-1/history/sideways"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void closeUnknownSession() throws Exception {
        doThrow(new SessionNotFoundException("t-9")).when(terminalSessionService).closeSession("t-9");

        mockMvc.perform(delete("/api/terminal/sessions/t-9"))
                .andExpect(status().isNotFound());
    }

    @Test
    void saveTranscript() throws Exception {
        when(terminalSessionService.saveTranscript("t-1", "log.txt")).thenReturn(Path.of("/work/.ide/log.txt"));

        mockMvc.perform(post("/api/terminal/sessions/t-1/transcript").param("fileName", "log.txt"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.path").value("/work/.ide/log.txt"));
    }

    @Test
    void removeMissingBookmark() throws Exception {
        when(terminalSessionService.removeBookmark("b-1")).thenReturn(false);

        mockMvc.perform(delete("/api/terminal/sessions/bookmarks/b-1"))
                .andExpect(status().isNotFound());
    }
}
