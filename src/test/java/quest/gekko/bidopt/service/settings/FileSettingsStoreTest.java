package quest.gekko.bidopt.service.settings;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import quest.gekko.bidopt.exception.StorageException;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class FileSettingsStoreTest {

    @TempDir
    Path dir;

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void missingFileMeansNoSelection() {
        FileSettingsStore store = new FileSettingsStore(dir.resolve("settings.json"), mapper);

        assertEquals(Optional.empty(), store.getSelectedAccounts("default"));
    }

    @Test
    void emptySelectionSurvivesReload() {
        Path file = dir.resolve("nested/settings.json");
        new FileSettingsStore(file, mapper).setSelectedAccounts("default", List.of());

        assertTrue(Files.exists(file));
        assertEquals(Optional.of(List.of()), new FileSettingsStore(file, mapper).getSelectedAccounts("default"));
    }

    @Test
    void tenantsAreKeptApart() {
        FileSettingsStore store = new FileSettingsStore(dir.resolve("settings.json"), mapper);
        store.setSelectedAccounts("a", List.of("1", "2"));
        store.setSelectedAccounts("b", List.of("3"));

        store.deleteTenant("a");

        assertEquals(Optional.empty(), store.getSelectedAccounts("a"));
        assertEquals(Optional.of(List.of("3")), store.getSelectedAccounts("b"));
    }

    @Test
    void corruptFileIsStorageError() throws Exception {
        Path file = dir.resolve("settings.json");
        Files.writeString(file, "{not json");

        FileSettingsStore store = new FileSettingsStore(file, mapper);
        assertThrows(StorageException.class, () -> store.getSelectedAccounts("default"));
    }
}
