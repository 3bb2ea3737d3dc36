package me.go_gradually.voicelive.infrastructure.fallback.library;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.go_gradually.voicelive.application.fallback.port.FallbackLibraryPort;
import me.go_gradually.voicelive.domain.fallback.FallbackEntry;
import me.go_gradually.voicelive.domain.fallback.FallbackSource;
import me.go_gradually.voicelive.domain.quality.IssueType;
import me.go_gradually.voicelive.infrastructure.shared.config.AppProperties;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Pre-recorded clips described by {@code manifest.json}:
 * {@code {"languages": {"en": {"low_confidence": [{"file": "...", "text": "..."}]}}}}.
 * Files resolve against {@code <library-dir>/<language>/}.
 */
@Component
public class FileSystemFallbackLibrary implements FallbackLibraryPort {
    private static final Logger log = Logger.getLogger(FileSystemFallbackLibrary.class.getName());

    private final Path libraryDir;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private volatile JsonNode manifest;

    public FileSystemFallbackLibrary(AppProperties properties) {
        this(Path.of(properties.getFallback().getLibraryDir()));
    }

    FileSystemFallbackLibrary(Path libraryDir) {
        this.libraryDir = libraryDir;
    }

    @Override
    public Optional<FallbackEntry> find(String language, IssueType type, int attemptCount) {
        JsonNode languages = manifest().path("languages");
        String languageKey = languages.has(language) ? language : baseLanguage(language);
        JsonNode variations = variationsFor(languages.path(languageKey), type);
        if (!variations.isArray() || variations.isEmpty()) {
            return Optional.empty();
        }
        JsonNode variation = variations.get(Math.floorMod(attemptCount, variations.size()));
        Path audioPath = libraryDir.resolve(languageKey).resolve(variation.path("file").asText(""));
        long startedAt = System.nanoTime();
        byte[] audio;
        try {
            audio = Files.readAllBytes(audioPath);
        } catch (IOException e) {
            log.warning("fallback.library.read_failed path=" + audioPath + " error=" + e.getMessage());
            return Optional.empty();
        }
        long latencyMs = (System.nanoTime() - startedAt) / 1_000_000L;
        return Optional.of(new FallbackEntry(FallbackSource.LIBRARY, audio, variation.path("text").asText(""), latencyMs));
    }

    private JsonNode variationsFor(JsonNode languageNode, IssueType type) {
        JsonNode byLowerName = languageNode.path(type.name().toLowerCase(Locale.ROOT));
        return byLowerName.isMissingNode() ? languageNode.path(type.name()) : byLowerName;
    }

    // 매니페스트가 없으면 빈 라이브러리로 취급하고, 이후 호출에서 다시 읽지 않는다.
    private JsonNode manifest() {
        JsonNode loaded = manifest;
        if (loaded != null) {
            return loaded;
        }
        synchronized (this) {
            if (manifest == null) {
                manifest = loadManifest();
            }
            return manifest;
        }
    }

    private JsonNode loadManifest() {
        Path manifestPath = libraryDir.resolve("manifest.json");
        if (!Files.exists(manifestPath)) {
            log.info(() -> "fallback.library.no_manifest dir=" + libraryDir);
            return objectMapper.createObjectNode();
        }
        try {
            JsonNode root = objectMapper.readTree(manifestPath.toFile());
            log.info(() -> "fallback.library.loaded languages=" + root.path("languages").size());
            return root;
        } catch (IOException e) {
            log.warning("fallback.library.manifest_unreadable path=" + manifestPath + " error=" + e.getMessage());
            return objectMapper.createObjectNode();
        }
    }

    private static String baseLanguage(String language) {
        if (language == null) {
            return "";
        }
        return language.split("[-_]")[0].toLowerCase(Locale.ROOT);
    }
}
