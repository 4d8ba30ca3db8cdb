package club.ppmc.ideshell.model;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class CommandHistoryTest {

    @Test
    @DisplayName("previous walks back to the oldest entry and stays there")
    void previousStopsAtOldest() {
        var history = new CommandHistory();
        history.add("ls");
        history.add("pwd");

        assertEquals(Optional.of("pwd"), history.previous());
        assertEquals(Optional.of("ls"), history.previous());
        assertEquals(Optional.of("ls"), history.previous());
    }

    @Test
    @DisplayName("next past the newest entry returns to blank input")
    void nextPastNewestIsEmpty() {
        var history = new CommandHistory();
        history.add("ls");
        history.add("pwd");
        history.previous();
        history.previous();

        assertEquals(Optional.of("pwd"), history.next());
        assertEquals(Optional.empty(), history.next());
        assertEquals(Optional.of("pwd"), history.previous());
    }

    @Test
    @DisplayName("navigation never modifies the list and add resets the cursor")
    void navigationIsReadOnly() {
        var history = new CommandHistory();
        history.add("a");
        history.add("b");
        history.previous();
        history.previous();

        history.add("c");

        assertEquals(List.of("a", "b", "c"), history.entries());
        assertEquals(Optional.of("c"), history.previous());
    }

    @Test
    void emptyHistoryNavigatesToNothing() {
        var history = new CommandHistory();

        assertTrue(history.previous().isEmpty());
        assertTrue(history.next().isEmpty());
    }

    @Test
    @DisplayName("the oldest entries are dropped beyond the maximum size")
    void boundedSize() {
        var history = new CommandHistory(2);
        history.add("a");
        history.add("b");
        history.add("c");

        assertEquals(List.of("b", "c"), history.entries());
        assertThrows(IllegalArgumentException.class, () -> new CommandHistory(0));
    }
}
