package club.ppmc.ideshell.util;

import static org.junit.jupiter.api.Assertions.*;

import club.ppmc.ideshell.model.BuildOperation;
import club.ppmc.ideshell.model.BuildRequest;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class EnvironmentOverridesTest {

    @Test
    void nullMeansNoOverrides() {
        assertEquals(Map.of(), EnvironmentOverrides.copyOf(null));
        assertEquals(List.of(), EnvironmentOverrides.copyOfArguments(null, "extraArgs"));
    }

    @Test
    void copyIsDetachedFromTheSource() {
        Map<String, String> source = new HashMap<>(Map.of("RUSTFLAGS", "-Dwarnings"));

        Map<String, String> copy = EnvironmentOverrides.copyOf(source);
        source.put("OTHER", "x");

        assertEquals(Map.of("RUSTFLAGS", "-Dwarnings"), copy);
    }

    @Test
    void nullValueIsRejected() {
        Map<String, String> source = new HashMap<>();
        source.put("RUSTFLAGS", null);

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> EnvironmentOverrides.copyOf(source));
        assertTrue(e.getMessage().contains("RUSTFLAGS"));
    }

    @Test
    void blankNameIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> EnvironmentOverrides.copyOf(Map.of(" ", "x")));
    }

    @Test
    void nullArgumentIsRejected() {
        List<String> args = new ArrayList<>();
        args.add("--release");
        args.add(null);

        assertThrows(IllegalArgumentException.class, () -> EnvironmentOverrides.copyOfArguments(args, "extraArgs"));
    }

    @Test
    void buildRequestRejectsNullEnvironmentValue() {
        Map<String, String> environment = new HashMap<>();
        environment.put("CARGO_TARGET_DIR", null);

        assertThrows(IllegalArgumentException.class, () -> new BuildRequest(
                BuildOperation.BUILD, "debug", null, null, null, null, null, environment));
    }
}
