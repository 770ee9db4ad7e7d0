/*
 * Copyright 2022-2025 Crown Copyright
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package logpoller.cursor;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import logpoller.core.properties.PollerPropertyValues;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

import static logpoller.properties.LogsPollerProperty.STATE_FILE;

/**
 * Stores each cursor in its own file, holding only the token, so that an operator can inspect or seed the position
 * in a log stream by hand. The file for a log stream is the configured base path followed by an underscore and the
 * URL-encoded log stream name.
 */
public class FileCursorStore implements CursorStore {
    private static final Logger LOGGER = LoggerFactory.getLogger(FileCursorStore.class);

    private final Path basePath;

    public FileCursorStore(Path basePath) {
        this.basePath = basePath;
    }

    /**
     * Creates a cursor store at the base path set in the poller configuration.
     *
     * @param  properties the poller configuration
     * @return            the cursor store
     */
    public static FileCursorStore fromProperties(PollerPropertyValues properties) {
        return new FileCursorStore(Path.of(properties.get(STATE_FILE)));
    }

    @Override
    public Optional<String> load(String logStreamName) throws IOException {
        Path file = fileFor(logStreamName);
        LOGGER.trace("Loading cursor for log stream {} from {}", logStreamName, file);
        String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            return Optional.empty();
        }
        String cursor = StringUtils.chomp(content);
        if (StringUtils.isBlank(cursor)) {
            LOGGER.warn("Ignoring empty cursor file {}, reading log stream {} as if it has no cursor", file, logStreamName);
            return Optional.empty();
        }
        return Optional.of(cursor);
    }

    @Override
    public void save(String logStreamName, String cursor) throws IOException {
        Path file = fileFor(logStreamName);
        LOGGER.trace("Saving cursor for log stream {} to {}: {}", logStreamName, file, cursor);
        Path parent = file.toAbsolutePath().getParent();
        Files.createDirectories(parent);
        Path tempFile = Files.createTempFile(parent, file.getFileName().toString(), ".tmp");
        try {
            Files.writeString(tempFile, cursor, StandardCharsets.UTF_8);
            moveAtomically(tempFile, file);
        } finally {
            Files.deleteIfExists(tempFile);
        }
    }

    /**
     * Finds the file holding the cursor for a log stream.
     *
     * @param  logStreamName the log stream name
     * @return               the path to the file
     */
    private Path fileFor(String logStreamName) {
        String encoded = URLEncoder.encode(logStreamName, StandardCharsets.UTF_8);
        return basePath.resolveSibling(basePath.getFileName() + "_" + encoded);
    }

    private static void moveAtomically(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            LOGGER.debug("Atomic move not supported, replacing {} directly", target);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
