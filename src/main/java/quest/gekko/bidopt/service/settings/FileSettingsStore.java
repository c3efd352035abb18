package quest.gekko.bidopt.service.settings;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import quest.gekko.bidopt.exception.StorageException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Keeps every tenant's selection in one JSON file, {@code {"<tenant>": ["<accountId>", ...]}}.
 * Access is serialized on the instance.
 */
@Slf4j
public class FileSettingsStore implements SettingsStore {
    private static final TypeReference<LinkedHashMap<String, List<String>>> FILE_TYPE = new TypeReference<>() {};

    private final Path file;
    private final ObjectMapper mapper;

    public FileSettingsStore(Path file, ObjectMapper mapper) {
        this.file = file;
        this.mapper = mapper;
    }

    @Override
    public synchronized Optional<List<String>> getSelectedAccounts(String tenantId) {
        List<String> ids = read().get(tenantId);
        return ids == null ? Optional.empty() : Optional.of(List.copyOf(ids));
    }

    @Override
    public synchronized void setSelectedAccounts(String tenantId, List<String> accountIds) {
        Map<String, List<String>> all = read();
        all.put(tenantId, new ArrayList<>(accountIds));
        write(all);
    }

    @Override
    public synchronized void deleteTenant(String tenantId) {
        Map<String, List<String>> all = read();
        if (all.remove(tenantId) != null) {
            write(all);
        }
    }

    private Map<String, List<String>> read() {
        if (!Files.exists(file)) return new LinkedHashMap<>();
        try {
            Map<String, List<String>> all = mapper.readValue(file.toFile(), FILE_TYPE);
            return all != null ? all : new LinkedHashMap<>();
        } catch (IOException e) {
            log.error("Reading settings file {} failed", file, e);
            throw new StorageException("Failed to read settings file", e);
        }
    }

    private void write(Map<String, List<String>> all) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            mapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), all);
        } catch (IOException e) {
            log.error("Writing settings file {} failed", file, e);
            throw new StorageException("Failed to write settings file", e);
        }
    }
}
