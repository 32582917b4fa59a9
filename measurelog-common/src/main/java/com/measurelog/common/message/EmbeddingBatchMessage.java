package com.measurelog.common.message;

import java.util.List;

/**
 * One embedding invocation: which rows of which table to embed, from which text column
 * into which vector column, and how long the invocation may spend on model calls.
 * {@code timeoutMillis} is optional; when absent or not positive the worker applies its
 * configured default.
 */
public record EmbeddingBatchMessage(
        List<Long> ids,
        String table,
        String contentColumn,
        String embeddingColumn,
        Long timeoutMillis
) {
}
