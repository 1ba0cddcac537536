package dev.vibeshowcase.entity;

/**
 * Entities with application-assigned ids track whether they were loaded from the
 * database through this flag, see {@link dev.vibeshowcase.config.PersistableEntityCallback}.
 */
public interface NewRecordAware {
    void setNewRecord(boolean newRecord);
}
