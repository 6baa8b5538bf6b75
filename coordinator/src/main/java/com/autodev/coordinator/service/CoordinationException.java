package com.autodev.coordinator.service;

/**
 * Thrown when a coordination operation cannot be applied: the target row
 * is missing, the caller does not hold it, or it is no longer in a state
 * that allows the change.
 *
 * Unchecked. Callers catch it only when they have a specific recovery
 * (a worker that gets NOT_OWNER on complete() knows it was reclaimed);
 * everything else propagates to the API layer, which maps Kind to a status.
 */
public class CoordinationException extends RuntimeException {

    public enum Kind {
        NOT_FOUND,
        NOT_OWNER,
        INVALID_TRANSITION,
        DUPLICATE_VOTE,
        ALREADY_RESOLVED,
        LOCK_CONFLICT,
        NO_PROVIDER_AVAILABLE
    }

    private final Kind kind;

    public CoordinationException(Kind kind, String message) {
        super("[" + kind + "] " + message);
        this.kind = kind;
    }

    public CoordinationException(Kind kind, String message, Throwable cause) {
        super("[" + kind + "] " + message, cause);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }

    // ------------------------------------------------------------------
    // Factories
    // ------------------------------------------------------------------

    public static CoordinationException notFound(String what, Object id) {
        return new CoordinationException(Kind.NOT_FOUND, what + " " + id + " not found");
    }

    public static CoordinationException notOwner(String what, Object id, String caller, String holder) {
        return new CoordinationException(Kind.NOT_OWNER,
                what + " " + id + " is held by '" + holder + "', not '" + caller + "'");
    }

    public static CoordinationException invalidTransition(String what, Object id, Object state, String attempted) {
        return new CoordinationException(Kind.INVALID_TRANSITION,
                "cannot " + attempted + " " + what + " " + id + " in state " + state);
    }

    public static CoordinationException duplicateVote(Object proposalId, String voter) {
        return new CoordinationException(Kind.DUPLICATE_VOTE,
                "'" + voter + "' already voted on proposal " + proposalId);
    }

    public static CoordinationException alreadyResolved(String what, Object id, Object state) {
        return new CoordinationException(Kind.ALREADY_RESOLVED,
                what + " " + id + " is already " + state);
    }
}
