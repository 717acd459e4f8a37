package com.neal.snowchange.util;

import com.neal.snowchange.exception.ConfigurationException;
import com.neal.snowchange.exception.MigrationException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * @author Neal
 */
public class ScriptFileUtils {

    private ScriptFileUtils() {
    }

    /**
     * All regular files below {@code root}, in sorted path order.
     */
    public static List<Path> listFilesRecursively(Path root) {
        if (!Files.isDirectory(root)) {
            throw new ConfigurationException("Invalid root folder: " + root);
        }
        try (Stream<Path> paths = Files.walk(root)) {
            return paths.filter(Files::isRegularFile).sorted().collect(Collectors.toList());
        } catch (IOException | UncheckedIOException e) {
            throw new MigrationException("Can't walk root folder " + root, e);
        }
    }

    /**
     * UTF-8 content with line endings folded to {@code \n}, so checksums don't depend on checkout
     */
    public static String readContent(Path file) {
        try {
            return normalizeLineEndings(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new MigrationException("Can't read change script " + file, e);
        }
    }

    static String normalizeLineEndings(String content) {
        return content.replace("\r\n", "\n").replace('\r', '\n');
    }
}
