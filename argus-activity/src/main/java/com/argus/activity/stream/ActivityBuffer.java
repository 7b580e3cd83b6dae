package com.argus.activity.stream;

import com.argus.activity.model.ActivityLogEntry;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Ordered, id-unique list of activity entries for one session.
 * <p>
 * Not thread-safe; the owning {@link ActivityStreamController} guards it.
 */
public class ActivityBuffer {

    private final List<ActivityLogEntry> entries = new ArrayList<>();
    private final Set<String> ids = new HashSet<>();

    /**
     * Replace the content with a backlog. Duplicate ids within the backlog keep
     * their first occurrence.
     */
    public void seed(List<ActivityLogEntry> backlog) {
        clear();
        if (backlog == null) {
            return;
        }
        for (ActivityLogEntry entry : backlog) {
            if (entry != null && entry.getId() != null && ids.add(entry.getId())) {
                entries.add(entry);
            }
        }
    }

    /**
     * Append a pushed entry at the end.
     *
     * @return false when an entry with the same id is already present
     * @throws IllegalArgumentException when the entry has no id
     */
    public boolean append(ActivityLogEntry entry) {
        if (entry == null || entry.getId() == null) {
            throw new IllegalArgumentException("activity entry must carry an id");
        }
        if (!ids.add(entry.getId())) {
            return false;
        }
        entries.add(entry);
        return true;
    }

    /**
     * Append every entry not yet present, in the given order.
     *
     * @return number of entries added
     */
    public int merge(List<ActivityLogEntry> more) {
        if (more == null) {
            return 0;
        }
        int added = 0;
        for (ActivityLogEntry entry : more) {
            if (entry != null && entry.getId() != null && append(entry)) {
                added++;
            }
        }
        return added;
    }

    public void clear() {
        entries.clear();
        ids.clear();
    }

    public boolean contains(String id) {
        return ids.contains(id);
    }

    public int size() {
        return entries.size();
    }

    /** Immutable copy in buffer order. */
    public List<ActivityLogEntry> snapshot() {
        return List.copyOf(entries);
    }
}
