package io.corekit.network.session;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.corekit.util.Assert;
import io.corekit.util.Utils;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stores tokens as a JSON document, for example
 * {@code {"access_token": "...", "refresh_token": "..."}}.
 * <p>
 * Writes go to a temporary file in the same directory which is then moved over the target, so
 * a crash never leaves a half-written file behind.
 */
public class FileTokenStore implements TokenStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(FileTokenStore.class);

    private final Path file;

    public FileTokenStore(Path file) {
        this.file = Assert.checkNotNullParam("file", file).toAbsolutePath();
    }

    public Path getFile() {
        return file;
    }

    @Override
    public synchronized Optional<Tokens> load() {
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            String json = Files.readString(file);
            if (json.isBlank()) {
                return Optional.empty();
            }
            return Optional.of(Utils.SNAKE_CASE_MAPPER.readValue(json, Tokens.class));
        } catch (JsonProcessingException e) {
            throw new TokenStoreException("Failed to parse tokens from " + file, e);
        } catch (IOException | IllegalArgumentException e) {
            throw new TokenStoreException("Failed to read tokens from " + file, e);
        }
    }

    @Override
    public synchronized void save(Tokens tokens) {
        Assert.checkNotNullParam("tokens", tokens);
        @Nullable Path tmp = null;
        try {
            Path dir = file.getParent();
            if (dir != null) {
                Files.createDirectories(dir);
            }
            tmp = Files.createTempFile(dir, file.getFileName().toString(), ".tmp");
            Files.write(tmp, Utils.SNAKE_CASE_MAPPER.writeValueAsBytes(tokens));
            move(tmp, file);
            LOGGER.debug("Stored tokens in {}", file);
        } catch (IOException e) {
            deleteQuietly(tmp, e);
            throw new TokenStoreException("Failed to write tokens to " + file, e);
        }
    }

    @Override
    public synchronized void clear() {
        try {
            if (Files.deleteIfExists(file)) {
                LOGGER.debug("Removed tokens from {}", file);
            }
        } catch (IOException e) {
            throw new TokenStoreException("Failed to delete " + file, e);
        }
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            LOGGER.debug("Atomic move not supported for {}, falling back to a plain move", target);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(@Nullable Path tmp, IOException failure) {
        if (tmp == null) {
            return;
        }
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            failure.addSuppressed(e);
        }
    }
}
