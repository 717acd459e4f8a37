package com.neal.snowchange.exception;

/**
 * A change script was rejected by the target database.
 *
 * @author Neal
 */
public class ScriptExecuteException extends MigrationException {
    private final String scriptName;
    private final String version;

    public ScriptExecuteException(String scriptName, String version, Throwable cause) {
        super(String.format("Change script %s (version %s) failed: %s", scriptName, version, cause.getMessage()), cause);
        this.scriptName = scriptName;
        this.version = version;
    }

    public String getScriptName() {
        return scriptName;
    }

    public String getVersion() {
        return version;
    }
}
