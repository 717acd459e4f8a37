package com.neal.snowchange.domain;

/**
 * One row of the change history table. INSTALLED_ON is filled in by the database on insert and
 * is not carried here.
 *
 * @author Neal
 */
public class ChangeHistory {
    public static final String STATUS_SUCCESS = "Success";

    public String version;

    public String description;

    public String script;

    public String scriptType;

    public String checksum;

    /**
     * seconds
     */
    public Long executionTime;

    public String status;

    public String installedBy;
}
