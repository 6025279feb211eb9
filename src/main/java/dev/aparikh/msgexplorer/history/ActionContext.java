package dev.aparikh.msgexplorer.history;

import java.security.Principal;
import java.time.Instant;

/**
 * Who performed an action and when. Built at the request boundary and passed
 * explicitly to the recorder.
 */
public record ActionContext(
        String actor,
        Instant at
) {
    public static final String ANONYMOUS = "anonymous";

    public ActionContext {
        if (actor == null || actor.isBlank()) {
            actor = ANONYMOUS;
        }
        if (at == null) {
            throw new IllegalArgumentException("at must be provided");
        }
    }

    public static ActionContext of(Principal principal) {
        return new ActionContext(principal == null ? null : principal.getName(), Instant.now());
    }
}
