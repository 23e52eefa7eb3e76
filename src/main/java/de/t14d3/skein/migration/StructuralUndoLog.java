package de.t14d3.skein.migration;

import de.t14d3.skein.storage.Group;
import de.t14d3.skein.storage.Table;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.Set;

/**
 * Records structural changes applied during a migration so they can be reverted when the
 * migration is aborted. Needed because the storage engine commits structure changes as soon
 * as they are executed, independently of the surrounding write transaction.
 */
public class StructuralUndoLog {
    private static final Logger log = LoggerFactory.getLogger(StructuralUndoLog.class);

    private enum Kind { TABLE_CREATED, COLUMN_ADDED, INDEX_ADDED, INDEX_REMOVED }

    private record Entry(Kind kind, String table, String column) {
    }

    private final Deque<Entry> entries = new ArrayDeque<>();

    public void tableCreated(String table) {
        entries.push(new Entry(Kind.TABLE_CREATED, table, null));
    }

    public void columnAdded(String table, String column) {
        entries.push(new Entry(Kind.COLUMN_ADDED, table, column));
    }

    public void indexAdded(String table, String column) {
        entries.push(new Entry(Kind.INDEX_ADDED, table, column));
    }

    public void indexRemoved(String table, String column) {
        entries.push(new Entry(Kind.INDEX_REMOVED, table, column));
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int size() {
        return entries.size();
    }

    /**
     * Reverts every recorded change, newest first, in a write transaction of its own. Failures
     * are attached to {@code cause} as suppressed exceptions.
     */
    public void revert(Group group, Throwable cause) {
        if (entries.isEmpty() || group.isClosed()) {
            return;
        }
        // columns and indexes of tables that are dropped anyway are skipped
        Set<String> createdTables = new HashSet<>();
        for (Entry entry : entries) {
            if (entry.kind() == Kind.TABLE_CREATED) {
                createdTables.add(entry.table());
            }
        }
        group.beginWrite();
        try {
            Iterator<Entry> it = entries.iterator();
            while (it.hasNext()) {
                Entry entry = it.next();
                if (entry.kind() != Kind.TABLE_CREATED && createdTables.contains(entry.table())) {
                    continue;
                }
                try {
                    undo(group, entry);
                } catch (RuntimeException e) {
                    log.error("Failed to revert {} on '{}'", entry.kind(), entry.table(), e);
                    cause.addSuppressed(e);
                }
            }
            group.commit();
        } catch (RuntimeException e) {
            if (group.isInWriteTransaction()) {
                group.rollback();
            }
            cause.addSuppressed(e);
        }
        log.debug("Reverted {} structural changes on '{}'", entries.size(), group.getPath());
        entries.clear();
    }

    private void undo(Group group, Entry entry) {
        switch (entry.kind()) {
            case TABLE_CREATED -> {
                if (group.hasTable(entry.table())) {
                    group.removeTable(entry.table());
                }
            }
            case COLUMN_ADDED -> {
                Table table = group.getTable(entry.table());
                int column = table == null ? -1 : table.findColumn(entry.column());
                if (column >= 0) {
                    table.removeColumn(column);
                }
            }
            case INDEX_ADDED -> {
                Table table = group.getTable(entry.table());
                int column = table == null ? -1 : table.findColumn(entry.column());
                if (column >= 0) {
                    table.removeSearchIndex(column);
                }
            }
            case INDEX_REMOVED -> {
                Table table = group.getTable(entry.table());
                int column = table == null ? -1 : table.findColumn(entry.column());
                if (column >= 0) {
                    table.addSearchIndex(column);
                }
            }
        }
    }
}
