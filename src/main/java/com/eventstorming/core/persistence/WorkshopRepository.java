package com.eventstorming.core.persistence;

import com.eventstorming.core.model.Workshop;
import com.eventstorming.core.model.WorkshopSummary;

import java.util.List;

/**
 * Whole-snapshot store for workshops. Every call reads or writes a complete
 * workshop; there is no locking, so concurrent writers of one id race and the
 * last save wins.
 */
public interface WorkshopRepository {

    /**
     * Loads a fresh, migrated snapshot.
     *
     * @throws com.eventstorming.core.model.NotFoundException if no workshop has this id
     */
    Workshop load(String workshopId);

    /**
     * Stamps {@code updatedAt} with the current time and writes the snapshot.
     */
    void save(Workshop workshop);

    boolean exists(String workshopId);

    /**
     * Summaries of every stored workshop, most recently updated first.
     */
    List<WorkshopSummary> list();
}
