package com.neal.snowchange.domain;

/**
 * @author Neal
 */
public enum MigrationState {
    INIT,
    HISTORY_READY,
    CATALOGED,
    PLANNED,
    APPLYING,
    DONE,
    FAILED
}
