/*
 * Copyright (c) 2025 Casebook Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.casebook.engine.infra.persistence;

import com.casebook.engine.api.ISnapshotCodec;
import com.casebook.engine.api.ISnapshotStore;
import com.casebook.engine.api.exceptions.PersistenceException;
import com.casebook.engine.api.model.PlayerState;
import com.casebook.engine.infra.config.EngineConfig;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * Stores one JSON file per (case, player, slot) as {@code <caseId>/<playerId>/<slot>.json}.
 *
 * <p>Ids may not contain path separators, so two sessions never share a file.
 *
 * <p>Writes go to a temporary file in the same directory which is then moved over the target,
 * so a reader sees either the previous snapshot or the new one, never a partial file.
 */
public class FileSnapshotStore implements ISnapshotStore {

    private static final Logger logger = Logger.getLogger(FileSnapshotStore.class.getName());

    private static final Pattern SAFE_ID = Pattern.compile("^[A-Za-z0-9_-]+$");
    private static final String EXTENSION = ".json";

    private final Path directory;
    private final ISnapshotCodec codec;

    public FileSnapshotStore(EngineConfig config) {
        this(config.getSnapshotDirectory(), new JsonSnapshotCodec());
    }

    public FileSnapshotStore(Path directory, ISnapshotCodec codec) {
        this.directory = Objects.requireNonNull(directory, "directory must not be null");
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
    }

    @Override
    public void save(PlayerState state, String slot) {
        Path target = resolve(state.getCaseId(), state.getPlayerId(), slot);
        byte[] blob = codec.saveSnapshot(state);

        Path temp = null;
        try {
            Path parent = Files.createDirectories(target.getParent());
            temp = Files.createTempFile(parent, slot, ".tmp");
            Files.write(temp, blob);
            move(temp, target);
            logger.fine(() -> "Saved " + state.getCaseId() + "/" + state.getPlayerId() + " to slot " + slot);
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new PersistenceException("Could not save slot '" + slot + "' for "
                    + state.getCaseId() + "/" + state.getPlayerId() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<PlayerState> load(String caseId, String playerId, String slot) {
        Path file = resolve(caseId, playerId, slot);
        byte[] blob;
        try {
            blob = Files.readAllBytes(file);
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new PersistenceException("Could not read slot '" + slot + "' for " + caseId + "/" + playerId, e);
        }

        PlayerState state = codec.loadSnapshot(blob);
        if (!state.getCaseId().equals(caseId) || !state.getPlayerId().equals(playerId)) {
            throw new PersistenceException("Slot '" + slot + "' holds a snapshot for "
                    + state.getCaseId() + "/" + state.getPlayerId() + ", expected " + caseId + "/" + playerId);
        }
        return Optional.of(state);
    }

    @Override
    public boolean delete(String caseId, String playerId, String slot) {
        Path file = resolve(caseId, playerId, slot);
        try {
            return Files.deleteIfExists(file);
        } catch (IOException e) {
            throw new PersistenceException("Could not delete slot '" + slot + "' for " + caseId + "/" + playerId, e);
        }
    }

    @Override
    public List<String> listSlots(String caseId, String playerId) {
        List<String> present = new ArrayList<>();
        for (String slot : SLOTS) {
            if (Files.isRegularFile(resolve(caseId, playerId, slot))) {
                present.add(slot);
            }
        }
        return present;
    }

    Path resolve(String caseId, String playerId, String slot) {
        if (!SLOTS.contains(slot)) {
            throw new PersistenceException("Unknown save slot '" + slot + "'; expected one of " + SLOTS);
        }
        checkId(caseId, "case id");
        checkId(playerId, "player id");
        return directory.resolve(caseId).resolve(playerId).resolve(slot + EXTENSION);
    }

    private static void checkId(String id, String what) {
        if (id == null || !SAFE_ID.matcher(id).matches()) {
            throw new PersistenceException("Invalid " + what + " '" + id + "'");
        }
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            logger.warning("Atomic move not supported in " + target.getParent() + "; falling back to replace");
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            logger.log(Level.WARNING, "Could not remove temporary snapshot " + temp, e);
        }
    }
}
