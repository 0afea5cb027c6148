package com.eventstorming.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Structured outcome of a mutating operation.
 *
 * @param success       whether the mutation was applied and persisted
 * @param entityId      id of the created, updated or deleted entity
 * @param message       human-readable summary
 * @param updatedFields fields actually changed (updates only)
 * @param assigned      element ids assigned (batch assignment only)
 * @param notFound      element ids that could not be found (batch assignment only, non-fatal)
 * @param error         failure reason when {@code success} is false
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OperationResult(
    boolean success,
    String entityId,
    String message,
    List<String> updatedFields,
    List<String> assigned,
    List<String> notFound,
    String error
) {

    public static OperationResult created(String entityId, String message) {
        return new OperationResult(true, entityId, message, null, null, null, null);
    }

    public static OperationResult updated(String entityId, List<String> updatedFields) {
        return new OperationResult(true, entityId, "Element updated successfully",
                List.copyOf(updatedFields), null, null, null);
    }

    public static OperationResult assigned(String contextId, String message,
                                           List<String> assigned, List<String> notFound) {
        return new OperationResult(true, contextId, message,
                null, List.copyOf(assigned), List.copyOf(notFound), null);
    }

    public static OperationResult failure(String error) {
        return new OperationResult(false, null, null, null, null, null, error);
    }

    public boolean hasWarnings() {
        return notFound != null && !notFound.isEmpty();
    }
}
