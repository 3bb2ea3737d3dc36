package me.go_gradually.voicelive.infrastructure.history.storage;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.go_gradually.voicelive.application.history.model.HistoryMessage;
import me.go_gradually.voicelive.application.history.port.ConversationHistoryPort;
import me.go_gradually.voicelive.application.shared.policy.DataDirProvider;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.List;

/**
 * One JSON file per user under {@code <data-dir>/history}.
 */
@Component
public class FileSystemConversationHistoryStore implements ConversationHistoryPort {
    private static final TypeReference<List<StoredMessage>> LIST_TYPE = new TypeReference<>() {
    };

    private final DataDirProvider dataDirProvider;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public FileSystemConversationHistoryStore(DataDirProvider dataDirProvider) {
        this.dataDirProvider = dataDirProvider;
    }

    @Override
    public List<HistoryMessage> getProfile(String userId) throws IOException {
        Path file = fileFor(userId);
        if (!Files.exists(file)) {
            return List.of();
        }
        List<StoredMessage> stored = objectMapper.readValue(file.toFile(), LIST_TYPE);
        return stored.stream().map(StoredMessage::toMessage).toList();
    }

    @Override
    public void saveProfile(String userId, List<HistoryMessage> history) throws IOException {
        Path file = fileFor(userId);
        Files.createDirectories(file.getParent());
        List<StoredMessage> stored = history.stream().map(StoredMessage::from).toList();
        // 동시에 읽는 쪽이 반쯤 쓰인 파일을 보지 않도록 임시 파일로 쓴 뒤 교체한다.
        Path temp = file.resolveSibling(file.getFileName() + ".tmp");
        objectMapper.writeValue(temp.toFile(), stored);
        Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    private Path fileFor(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId is required");
        }
        String safeName = userId.replaceAll("[^A-Za-z0-9._-]", "_");
        return Path.of(dataDirProvider.getDataDir(), "history", safeName + ".json");
    }

    record StoredMessage(String role, String text, long at) {
        static StoredMessage from(HistoryMessage message) {
            return new StoredMessage(message.role(), message.text(),
                    message.at() == null ? 0L : message.at().toEpochMilli());
        }

        HistoryMessage toMessage() {
            return new HistoryMessage(role, text, Instant.ofEpochMilli(at));
        }
    }
}
