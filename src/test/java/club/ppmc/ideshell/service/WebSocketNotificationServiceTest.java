package club.ppmc.ideshell.service;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;

import club.ppmc.ideshell.model.BackendType;
import club.ppmc.ideshell.model.BuildOperation;
import club.ppmc.ideshell.model.BuildSessionSnapshot;
import club.ppmc.ideshell.model.OutputEvent;
import club.ppmc.ideshell.model.SessionStatus;
import club.ppmc.ideshell.model.TerminalCommandExecution;
import com.google.gson.GsonBuilder;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.messaging.MessageDeliveryException;
import org.springframework.messaging.simp.SimpMessagingTemplate;

@ExtendWith(MockitoExtension.class)
class WebSocketNotificationServiceTest {

    @Mock
    private SimpMessagingTemplate messagingTemplate;

    private WebSocketNotificationService service;

    @BeforeEach
    void setUp() {
        service = new WebSocketNotificationService(messagingTemplate, new GsonBuilder().serializeNulls().create());
    }

    @Test
    void buildEventGoesToSessionTopic() {
        service.sendBuildEvent("s-1", OutputEvent.error("error: boom"));

        verify(messagingTemplate).convertAndSend(eq("/topic/build/s-1"),
                argThat((Object payload) -> payload.toString().contains("\"kind\":\"ERROR\"")
                        && payload.toString().contains("error: boom")));
    }

    @Test
    void buildStatusGoesToStatusTopic() {
        var snapshot = new BuildSessionSnapshot("s-1", "/work/demo", BackendType.HYBRID, BuildOperation.BUILD,
                "debug", SessionStatus.RUNNING, null, 1L, 2L, null, 3, 0, 0, List.of());

        service.sendBuildStatus(snapshot);

        verify(messagingTemplate).convertAndSend(eq("/topic/build/s-1/status"),
                argThat((Object payload) -> payload.toString().contains("\"status\":\"RUNNING\"")));
    }

    @Test
    void terminalTopics() {
        service.sendTerminalEvent("t-1", OutputEvent.info("hello"));
        service.sendTerminalStatus("t-1", TerminalCommandExecution.started("c-1", "t-1", "ls", false)
                .finish(SessionStatus.SUCCEEDED, 0));

        verify(messagingTemplate).convertAndSend(eq("/topic/terminal/t-1"), any(Object.class));
        verify(messagingTemplate).convertAndSend(eq("/topic/terminal/t-1/status"),
                argThat((Object payload) -> payload.toString().contains("\"exitCode\":0")));
    }

    @Test
    void deliveryFailureIsNotPropagated() {
        doThrow(new MessageDeliveryException("broker down"))
                .when(messagingTemplate).convertAndSend(anyString(), any(Object.class));

        assertDoesNotThrow(() -> service.sendTerminalEvent("t-1", OutputEvent.info("x")));
    }
}
