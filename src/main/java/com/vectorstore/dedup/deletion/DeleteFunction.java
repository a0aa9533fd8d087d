package com.vectorstore.dedup.deletion;

import com.vectorstore.dedup.store.DeleteOutcome;

import java.util.List;

/**
 * Batch delete operation the executor calls once per duplicate group.
 * Usually bound to {@code store.deleteMany(namespace, ids)}.
 */
@FunctionalInterface
public interface DeleteFunction {

    DeleteOutcome delete(List<String> ids);
}
