package com.elssolution.tanksim.control;

import lombok.Getter;

import java.util.List;

/** Start aborted because one or more sources failed to load. No worker was spawned. */
@Getter
public class ReplayStartException extends RuntimeException {

    private final List<String> errors;

    public ReplayStartException(List<String> errors) {
        super("start aborted: " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }
}
