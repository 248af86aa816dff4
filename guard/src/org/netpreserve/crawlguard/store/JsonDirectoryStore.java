package org.netpreserve.crawlguard.store;

import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;

/**
 * Stores each document as {@code <directory>/<shard>/<key>.json}, where the shard is the first two characters of
 * the URL-encoded key. Writes go to a temporary file which is then moved over the target so a crash never leaves
 * a half-written document behind.
 */
public class JsonDirectoryStore implements KeyValueStore {
    private static final String SUFFIX = ".json";
    private final Path directory;

    public JsonDirectoryStore(Path directory) throws IOException {
        this.directory = directory;
        Files.createDirectories(directory);
    }

    private Path path(String key) {
        String name = URLEncoder.encode(key, UTF_8);
        String shard = name.length() >= 2 ? name.substring(0, 2) : name + "_";
        return directory.resolve(shard).resolve(name + SUFFIX);
    }

    @Override
    public @Nullable String get(String key) throws IOException {
        try {
            return Files.readString(path(key), UTF_8);
        } catch (NoSuchFileException e) {
            return null;
        }
    }

    @Override
    public void put(String key, String document) throws IOException {
        Path target = path(key);
        Files.createDirectories(target.getParent());
        Path temp = Files.createTempFile(target.getParent(), ".tmp-", SUFFIX);
        try {
            Files.writeString(temp, document, UTF_8);
            Files.move(temp, target, ATOMIC_MOVE, REPLACE_EXISTING);
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    @Override
    public boolean delete(String key) throws IOException {
        return Files.deleteIfExists(path(key));
    }

    @Override
    public List<String> list() throws IOException {
        List<String> keys = new ArrayList<>();
        if (!Files.isDirectory(directory)) return keys;
        try (var stream = Files.walk(directory, 2)) {
            stream.filter(Files::isRegularFile)
                    .map(path -> path.getFileName().toString())
                    .filter(name -> name.endsWith(SUFFIX) && !name.startsWith(".tmp-"))
                    .map(name -> URLDecoder.decode(name.substring(0, name.length() - SUFFIX.length()), UTF_8))
                    .forEach(keys::add);
        }
        Collections.sort(keys);
        return keys;
    }

    public Path directory() {
        return directory;
    }
}
