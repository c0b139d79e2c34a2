/* @LICENSE@
 */

package org.hanoi.hoa;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;

/**
 * Keeps the log records it is handed, so that tests can check what was
 * logged.
 */
public final class RecordingHandler extends Handler {

    private final List<LogRecord> records =
            Collections.synchronizedList(new ArrayList<LogRecord>());

    @Override
    public void publish(LogRecord record) {
        if (isLoggable(record)) {
            records.add(record);
        }
    }

    @Override
    public void flush() {}

    @Override
    public void close() {
        records.clear();
    }

    public List<LogRecord> records() {
        synchronized (records) {
            return new ArrayList<LogRecord>(records);
        }
    }

    /**
     * @return the messages logged at exactly <code>level</code>.
     */
    public List<String> messages(Level level) {
        List<String> ret = new ArrayList<String>();
        for (LogRecord r : records()) {
            if (r.getLevel().equals(level)) ret.add(r.getMessage());
        }
        return ret;
    }

    public boolean contains(Level level, String fragment) {
        for (String m : messages(level)) {
            if (m.contains(fragment)) return true;
        }
        return false;
    }
}
