package com.neal.snowchange.service;

import com.neal.snowchange.config.ChangeHistoryTable;
import com.neal.snowchange.domain.ChangeHistory;
import com.neal.snowchange.domain.ChangeScript;
import com.neal.snowchange.exception.ConnectionException;
import com.neal.snowchange.exception.ScriptExecuteException;
import com.neal.snowchange.jdbc.SqlExecutor;
import com.neal.snowchange.util.ChecksumUtils;
import com.neal.snowchange.util.ScriptFileUtils;
import com.neal.snowchange.util.StopWatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;

/**
 * @author Neal
 */
public class ScriptApplier {
    private static final String TERMINATOR = ";";

    private final Logger logger = LoggerFactory.getLogger(ScriptApplier.class);
    private final SqlExecutor sqlExecutor;
    private final ChangeHistoryStore historyStore;
    private final String installedBy;

    public ScriptApplier(SqlExecutor sqlExecutor, ChangeHistoryStore historyStore, String installedBy) {
        this.sqlExecutor = sqlExecutor;
        this.historyStore = historyStore;
        this.installedBy = installedBy;
    }

    /**
     * Execute the script body and record it. Nothing is recorded when execution fails.
     *
     * @throws ScriptExecuteException if the database rejects the script or the session can't be opened
     */
    public ChangeHistory apply(ChangeScript script, ChangeHistoryTable table) {
        String content = normalize(ScriptFileUtils.readContent(script.getFullPath()));
        String checksum = ChecksumUtils.checksum(content);

        long executionTime = 0;
        if (!content.isEmpty()) {
            StopWatch stopWatch = new StopWatch();
            try {
                sqlExecutor.execute("", content);
            } catch (SQLException | ConnectionException e) {
                throw new ScriptExecuteException(script.getName(), script.getVersion(), e);
            }
            executionTime = stopWatch.elapsedSeconds();
        }
        logger.debug("Change script {} executed in {}s, checksum {}", script.getName(), executionTime, checksum);

        ChangeHistory history = new ChangeHistory();
        history.version = script.getVersion();
        history.description = script.getDescription();
        history.script = script.getName();
        history.scriptType = script.getType().getPrefix();
        history.checksum = checksum;
        history.executionTime = executionTime;
        history.status = ChangeHistory.STATUS_SUCCESS;
        history.installedBy = installedBy;
        historyStore.record(table, history);
        return history;
    }

    /**
     * trim, then drop exactly one trailing statement terminator
     */
    static String normalize(String content) {
        String trimmed = trim(content);
        return trimmed.endsWith(TERMINATOR) ? trimmed.substring(0, trimmed.length() - TERMINATOR.length()) : trimmed;
    }

    /**
     * strips whitespace and space separators, no-break spaces included
     */
    static String trim(String content) {
        int start = 0;
        int end = content.length();
        while (start < end && isBlank(content.charAt(start))) {
            start++;
        }
        while (end > start && isBlank(content.charAt(end - 1))) {
            end--;
        }
        return content.substring(start, end);
    }

    private static boolean isBlank(char c) {
        return Character.isWhitespace(c) || Character.isSpaceChar(c) || c == '\u0085';
    }
}
