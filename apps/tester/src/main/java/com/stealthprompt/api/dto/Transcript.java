package com.stealthprompt.api.dto;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered turns of one running test. Immutable: {@link #append} returns a new transcript.
 */
public final class Transcript {

    private static final Transcript EMPTY = new Transcript(List.of());

    private final List<Turn> turns;

    private Transcript(List<Turn> turns) {
        this.turns = turns;
    }

    public static Transcript empty() {
        return EMPTY;
    }

    public static Transcript of(List<Turn> turns) {
        return turns == null || turns.isEmpty() ? EMPTY : new Transcript(List.copyOf(turns));
    }

    public Transcript append(Turn turn) {
        List<Turn> next = new ArrayList<>(turns.size() + 1);
        next.addAll(turns);
        next.add(turn);
        return new Transcript(Collections.unmodifiableList(next));
    }

    @JsonValue
    public List<Turn> turns() {
        return turns;
    }

    public int size() {
        return turns.size();
    }

    public boolean isEmpty() {
        return turns.isEmpty();
    }

    public List<String> sentMessages() {
        return turns.stream().map(Turn::message).toList();
    }

    public List<String> replies() {
        return turns.stream().map(Turn::reply).toList();
    }

    /** Up to {@code n} trailing turns, oldest first. */
    public List<Turn> lastTurns(int n) {
        if (n <= 0) return List.of();
        return turns.subList(Math.max(0, turns.size() - n), turns.size());
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Transcript t && turns.equals(t.turns);
    }

    @Override
    public int hashCode() {
        return turns.hashCode();
    }

    @Override
    public String toString() {
        return "Transcript" + turns;
    }
}
