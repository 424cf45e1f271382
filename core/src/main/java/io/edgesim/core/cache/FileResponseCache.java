package io.edgesim.core.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.edgesim.core.model.CacheEntry;
import io.edgesim.core.model.EventBody;
import io.edgesim.core.model.HttpHeaders;
import io.edgesim.core.model.ResponseArtifact;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Durable {@link ResponseCache}: one JSON file per entry in a directory, so
 * cached responses survive restarts and repeated runs replay identically.
 *
 * <p>
 * Entry file {@code <fingerprint>.json}:
 * <pre>{@code
 * {
 * "fingerprint": "9f86d0...",
 * "storedAt": "2024-05-01T10:15:30Z",
 * "status": 200,
 * "statusDescription": "OK",
 * "headers": { "content-type": ["text/html"], "set-cookie": ["a=1", "b=2"] },
 * "body": "<base64>"
 * }
 * }</pre>
 *
 * <p>
 * Writes go to a temp file in the same directory and are moved over the target
 * atomically, so a concurrent reader sees the old entry, the new entry, or no
 * entry. Unreadable or corrupt entries are reported as misses.
 */
public final class FileResponseCache implements ResponseCache {

    private static final Logger LOG = LoggerFactory.getLogger(FileResponseCache.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Pattern FINGERPRINT = Pattern.compile("[0-9a-f]{16,128}");
    private static final String ENTRY_SUFFIX = ".json";
    private static final String TEMP_SUFFIX = ".tmp";

    private final Path directory;
    private final Clock clock;

    /**
     * Opens (creating if needed) a cache in {@code directory}.
     *
     * @throws UncheckedIOException if the directory cannot be created
     */
    public FileResponseCache(Path directory) {
        this(directory, Clock.systemUTC());
    }

    public FileResponseCache(Path directory, Clock clock) {
        this.directory = directory.toAbsolutePath();
        this.clock = clock;
        try {
            Files.createDirectories(this.directory);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create cache directory " + this.directory, e);
        }
    }

    /** The directory entries are stored in. */
    public Path directory() {
        return directory;
    }

    @Override
    public Optional<CacheEntry> lookup(String fingerprint) {
        if (!FINGERPRINT.matcher(fingerprint).matches()) {
            LOG.warn("Rejecting malformed cache fingerprint '{}'", fingerprint);
            return Optional.empty();
        }
        Path entryPath = entryPath(fingerprint);
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(entryPath);
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            LOG.warn("Cache entry {} unreadable, treating as miss: {}", entryPath.getFileName(), e.getMessage());
            return Optional.empty();
        }
        try {
            return Optional.of(decode(fingerprint, MAPPER.readTree(bytes)));
        } catch (IOException | RuntimeException e) {
            LOG.warn("Cache entry {} corrupt, treating as miss: {}", entryPath.getFileName(), e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void store(String fingerprint, ResponseArtifact response) {
        if (!FINGERPRINT.matcher(fingerprint).matches()) {
            throw new IllegalArgumentException("Malformed cache fingerprint: " + fingerprint);
        }
        CacheEntry entry = new CacheEntry(fingerprint, response, clock.instant());
        Path target = entryPath(fingerprint);
        try {
            byte[] json = MAPPER.writerWithDefaultPrettyPrinter().writeValueAsBytes(encode(entry));
            Files.createDirectories(directory);
            Path tmp = Files.createTempFile(directory, fingerprint + ".", TEMP_SUFFIX);
            try {
                Files.write(tmp, json);
                try {
                    Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
                } catch (AtomicMoveNotSupportedException e) {
                    Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
                }
            } finally {
                Files.deleteIfExists(tmp);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write cache entry " + target, e);
        }
        LOG.debug("Cache entry stored: {} ({} bytes body)", fingerprint, response.body().size());
    }

    @Override
    public int purgeAll() {
        int removed = 0;
        List<Path> files = listFiles();
        for (Path file : files) {
            String name = file.getFileName().toString();
            try {
                if (Files.deleteIfExists(file) && name.endsWith(ENTRY_SUFFIX)) {
                    removed++;
                }
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to delete cache file " + file, e);
            }
        }
        LOG.info("Cache purged: {} entries removed from {}", removed, directory);
        return removed;
    }

    @Override
    public int size() {
        int count = 0;
        for (Path file : listFiles()) {
            if (file.getFileName().toString().endsWith(ENTRY_SUFFIX)) {
                count++;
            }
        }
        return count;
    }

    private List<Path> listFiles() {
        List<Path> files = new ArrayList<>();
        if (!Files.isDirectory(directory)) {
            return files;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, "*{" + ENTRY_SUFFIX + "," + TEMP_SUFFIX + "}")) {
            stream.forEach(files::add);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list cache directory " + directory, e);
        }
        return files;
    }

    private Path entryPath(String fingerprint) {
        return directory.resolve(fingerprint + ENTRY_SUFFIX);
    }

    // --- JSON mapping ---

    static ObjectNode encode(CacheEntry entry) {
        ResponseArtifact response = entry.response();
        ObjectNode node = MAPPER.createObjectNode();
        node.put("fingerprint", entry.fingerprint());
        node.put("storedAt", entry.storedAt().toString());
        node.put("status", response.status());
        node.put("statusDescription", response.statusDescription());
        ObjectNode headers = node.putObject("headers");
        response.headers().forEach((name, values) -> {
            ArrayNode array = headers.putArray(name);
            values.forEach(array::add);
        });
        node.put("body", Base64.getEncoder().encodeToString(response.body().content()));
        return node;
    }

    static CacheEntry decode(String expectedFingerprint, JsonNode node) {
        String fingerprint = requireText(node, "fingerprint");
        if (!fingerprint.equals(expectedFingerprint)) {
            throw new IllegalStateException("fingerprint mismatch: " + fingerprint);
        }
        Instant storedAt = Instant.parse(requireText(node, "storedAt"));
        JsonNode status = node.get("status");
        if (status == null || !status.canConvertToInt()) {
            throw new IllegalStateException("missing or invalid 'status'");
        }
        Map<String, List<String>> headers = new LinkedHashMap<>();
        JsonNode headersNode = node.path("headers");
        Iterator<Map.Entry<String, JsonNode>> fields = headersNode.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            List<String> values = new ArrayList<>();
            field.getValue().forEach(v -> values.add(v.asText()));
            headers.put(field.getKey(), values);
        }
        byte[] body = Base64.getDecoder().decode(node.path("body").asText(""));
        ResponseArtifact response = new ResponseArtifact(
                status.asInt(),
                node.path("statusDescription").asText(""),
                HttpHeaders.ofMulti(headers),
                EventBody.of(body));
        return new CacheEntry(fingerprint, response, storedAt);
    }

    private static String requireText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual()) {
            throw new IllegalStateException("missing '" + field + "'");
        }
        return value.asText();
    }
}
