/*
 * Copyright (c) 2025 Casebook Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.casebook.engine.api;

import com.casebook.engine.api.model.PlayerState;

import java.util.List;
import java.util.Optional;

/**
 * Durable storage of player snapshots in named slots. Saves are all-or-nothing.
 */
public interface ISnapshotStore {

    List<String> SLOTS = List.of("slot_1", "slot_2", "slot_3", "autosave", "default");

    /**
     * @throws com.casebook.engine.api.exceptions.PersistenceException on I/O failure or unknown slot
     */
    void save(PlayerState state, String slot);

    Optional<PlayerState> load(String caseId, String playerId, String slot);

    boolean delete(String caseId, String playerId, String slot);

    /**
     * @return slots holding a snapshot for this player, in {@link #SLOTS} order
     */
    List<String> listSlots(String caseId, String playerId);
}
