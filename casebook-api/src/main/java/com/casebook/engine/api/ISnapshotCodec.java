/*
 * Copyright (c) 2025 Casebook Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.casebook.engine.api;

import com.casebook.engine.api.model.PlayerState;

/**
 * Lossless conversion between a {@link PlayerState} and an opaque byte blob.
 */
public interface ISnapshotCodec {

    byte[] saveSnapshot(PlayerState state);

    /**
     * @throws com.casebook.engine.api.exceptions.PersistenceException if the blob is not a snapshot
     */
    PlayerState loadSnapshot(byte[] blob);
}
