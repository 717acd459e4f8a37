package com.neal.snowchange.domain;

/**
 * @author Neal
 */
public enum ScriptType {
    VERSIONED("V");

    private final String prefix;

    ScriptType(String prefix) {
        this.prefix = prefix;
    }

    public String getPrefix() {
        return prefix;
    }

    public static ScriptType fromPrefix(String prefix) {
        for (ScriptType type : values()) {
            if (type.prefix.equals(prefix)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown script type " + prefix);
    }
}
