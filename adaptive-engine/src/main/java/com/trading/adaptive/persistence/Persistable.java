package com.trading.adaptive.persistence;

import com.trading.adaptive.error.StorageException;

/**
 * A component whose state survives restarts.
 */
public interface Persistable {

    /**
     * Write the current state durably.
     *
     * @throws StorageException when the state file cannot be written; in-memory state is unaffected
     */
    void save();

    /**
     * Restore state written by a previous {@link #save()}.
     *
     * @return true if prior state was found and applied, false if the component starts fresh
     */
    boolean load();

    /** Name used for the state file and in health reporting. */
    String stateName();
}
