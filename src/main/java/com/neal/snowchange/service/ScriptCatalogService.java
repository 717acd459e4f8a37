package com.neal.snowchange.service;

import com.neal.snowchange.domain.ChangeScript;
import com.neal.snowchange.domain.ScriptType;
import com.neal.snowchange.exception.DuplicateVersionException;
import com.neal.snowchange.util.ScriptFileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds change scripts below a root folder.
 *
 * @author Neal
 */
public class ScriptCatalogService {
    static final Pattern SCRIPT_NAME = Pattern.compile("^(V)(.+)__(.+)\\.sql$");

    private final Logger logger = LoggerFactory.getLogger(ScriptCatalogService.class);

    /**
     * Walk {@code root} recursively and collect every {@code V<version>__<description>.sql} file,
     * keyed by file name. Other files are ignored.
     *
     * @throws DuplicateVersionException when two files carry the same version string
     */
    public Map<String, ChangeScript> discover(Path root) {
        Map<String, ChangeScript> scripts = new LinkedHashMap<>();
        Map<String, Path> versions = new HashMap<>();
        for (Path file : ScriptFileUtils.listFilesRecursively(root)) {
            String fileName = file.getFileName().toString();
            Matcher matcher = SCRIPT_NAME.matcher(fileName.strip());
            if (!matcher.matches()) {
                logger.debug("Ignoring non-change file {}", file);
                continue;
            }
            ChangeScript script = new ChangeScript(fileName, file, ScriptType.fromPrefix(matcher.group(1)),
                matcher.group(2), describe(matcher.group(3)));
            Path previous = versions.putIfAbsent(script.getVersion(), file);
            if (previous != null) {
                throw new DuplicateVersionException(script.getVersion(), previous, file);
            }
            scripts.put(fileName, script);
        }
        return scripts;
    }

    /**
     * underscores become spaces, first letter upper case, the rest lower case
     */
    static String describe(String token) {
        String text = token.replace('_', ' ');
        if (text.isEmpty()) {
            return text;
        }
        return text.substring(0, 1).toUpperCase(Locale.ROOT) + text.substring(1).toLowerCase(Locale.ROOT);
    }
}
