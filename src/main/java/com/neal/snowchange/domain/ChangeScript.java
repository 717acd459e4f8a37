package com.neal.snowchange.domain;

import java.nio.file.Path;

/**
 * One discovered {@code V<version>__<description>.sql} file.
 *
 * @author Neal
 */
public class ChangeScript {
    private final String name;
    private final Path fullPath;
    private final ScriptType type;
    private final String version;
    private final String description;
    private final VersionKey versionKey;

    public ChangeScript(String name, Path fullPath, ScriptType type, String version, String description) {
        this.name = name;
        this.fullPath = fullPath;
        this.type = type;
        this.version = version;
        this.description = description;
        this.versionKey = VersionKey.parse(version);
    }

    public String getName() {
        return name;
    }

    public Path getFullPath() {
        return fullPath;
    }

    public ScriptType getType() {
        return type;
    }

    public String getVersion() {
        return version;
    }

    public String getDescription() {
        return description;
    }

    public VersionKey getVersionKey() {
        return versionKey;
    }

    @Override
    public String toString() {
        return name;
    }
}
