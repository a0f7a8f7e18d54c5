package com.menuzy.catalog.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One problem found while loading a batch. {@code entity}, {@code index} (position
 * in that entity's list) and {@code field} are set whenever the problem can be
 * pinned to a record; commit-time and timeout errors usually cannot.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LoadError(ErrorKind kind, EntityType entity, Integer index, String field, String reason) {

    public static LoadError validation(EntityType entity, int index, String field, String reason) {
        return new LoadError(ErrorKind.VALIDATION, entity, index, field, reason);
    }

    public static LoadError store(EntityType entity, int index, String field, String reason) {
        return new LoadError(ErrorKind.STORE, entity, index, field, reason);
    }

    public static LoadError store(String reason) {
        return new LoadError(ErrorKind.STORE, null, null, null, reason);
    }

    public static LoadError timeout(String reason) {
        return new LoadError(ErrorKind.TIMEOUT, null, null, null, reason);
    }
}
