package com.menuzy.catalog.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Outcome of a load call: either the generated ids ({@code ok = true}) or the
 * errors that stopped it. A result that is not ok always means nothing was written.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LoadResult(boolean ok, LoadStatus status, AssignedIds ids, List<LoadError> errors) {

    public LoadResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static LoadResult committed(AssignedIds ids) {
        return new LoadResult(true, LoadStatus.COMMITTED, ids, List.of());
    }

    public static LoadResult rejected(List<LoadError> errors) {
        return new LoadResult(false, LoadStatus.REJECTED, null, errors);
    }

    public static LoadResult rolledBack(LoadError error) {
        return new LoadResult(false, LoadStatus.ROLLED_BACK, null, List.of(error));
    }

    public boolean hasErrorOf(ErrorKind kind) {
        return errors.stream().anyMatch(error -> error.kind() == kind);
    }
}
