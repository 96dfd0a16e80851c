package io.blockstore.core.engine;

import io.blockstore.core.protocol.Digest;

/** Outcome of a successful add; {@code duplicate} means nothing changed. */
public record AddBlockResult(Digest blockId, long height, boolean duplicate) {}
