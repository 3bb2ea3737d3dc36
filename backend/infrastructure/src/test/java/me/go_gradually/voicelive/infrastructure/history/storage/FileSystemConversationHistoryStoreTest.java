package me.go_gradually.voicelive.infrastructure.history.storage;

import me.go_gradually.voicelive.application.history.model.HistoryMessage;
import me.go_gradually.voicelive.application.shared.policy.DataDirProvider;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FileSystemConversationHistoryStoreTest {

    @TempDir
    Path tempDir;

    @Test
    void getProfile_returnsEmptyForUnknownUser() throws Exception {
        FileSystemConversationHistoryStore store = new FileSystemConversationHistoryStore(dataDir(tempDir));

        assertTrue(store.getProfile("nobody").isEmpty());
    }

    @Test
    void saveProfile_writesFileUnderHistoryDirectoryAndReadsBack() throws Exception {
        FileSystemConversationHistoryStore store = new FileSystemConversationHistoryStore(dataDir(tempDir));
        Instant at = Instant.parse("2026-03-01T10:15:30Z");

        store.saveProfile("user-7", List.of(
                new HistoryMessage(HistoryMessage.USER, "How do I open an account?", at),
                new HistoryMessage(HistoryMessage.MODEL, "Bring an ID to any branch.", at.plusSeconds(2))
        ));

        assertTrue(Files.exists(tempDir.resolve("history").resolve("user-7.json")));
        List<HistoryMessage> loaded = store.getProfile("user-7");
        assertEquals(2, loaded.size());
        assertEquals(HistoryMessage.USER, loaded.get(0).role());
        assertEquals("Bring an ID to any branch.", loaded.get(1).text());
        assertEquals(at.plusSeconds(2), loaded.get(1).at());
    }

    @Test
    void saveProfile_keepsUserIdInsideHistoryDirectory() throws Exception {
        FileSystemConversationHistoryStore store = new FileSystemConversationHistoryStore(dataDir(tempDir));

        store.saveProfile("../escape", List.of(new HistoryMessage(HistoryMessage.USER, "hi", Instant.EPOCH)));

        assertTrue(Files.exists(tempDir.resolve("history").resolve(".._escape.json")));
        assertEquals(1, store.getProfile("../escape").size());
    }

    @Test
    void getProfile_rejectsBlankUserId() {
        FileSystemConversationHistoryStore store = new FileSystemConversationHistoryStore(dataDir(tempDir));

        assertThrows(IllegalArgumentException.class, () -> store.getProfile(" "));
    }

    private DataDirProvider dataDir(Path path) {
        return () -> path.toString();
    }
}
