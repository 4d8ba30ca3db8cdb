package club.ppmc.ideshell.service.backend;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

import club.ppmc.ideshell.model.BackendFamily;
import club.ppmc.ideshell.service.SettingsService;
import club.ppmc.ideshell.service.classify.OutputClassifier;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class BackendAdapterRegistryTest {

    private final SettingsService settingsService = mock(SettingsService.class);

    @Test
    @DisplayName("adapters are indexed by family and their rule tables registered")
    void registersAdapters() {
        var classifier = new OutputClassifier();
        var managed = new ManagedBuildToolAdapter(settingsService);
        var cargo = new PackageManagerAdapter(settingsService);

        var registry = new BackendAdapterRegistry(List.of(managed, cargo), classifier);

        assertSame(managed, registry.get(BackendFamily.MANAGED_BUILD_TOOL));
        assertSame(cargo, registry.get(BackendFamily.PACKAGE_MANAGER));
        assertTrue(classifier.hasTable(BackendFamily.MANAGED_BUILD_TOOL));
        assertTrue(classifier.hasTable(BackendFamily.PACKAGE_MANAGER));
        assertFalse(classifier.hasTable(BackendFamily.NATIVE_DRIVER));
        assertThrows(IllegalStateException.class, () -> registry.get(BackendFamily.NATIVE_DRIVER));
    }

    @Test
    @DisplayName("two adapters for the same family are rejected")
    void rejectsDuplicates() {
        var classifier = new OutputClassifier();

        assertThrows(IllegalStateException.class, () -> new BackendAdapterRegistry(
                List.of(new PackageManagerAdapter(settingsService), new PackageManagerAdapter(settingsService)),
                classifier));
    }
}
