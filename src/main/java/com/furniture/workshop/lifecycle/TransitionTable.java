package com.furniture.workshop.lifecycle;

import com.furniture.workshop.exception.IllegalTransitionException;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Explicit {@code (state, event) -> state} table. Firing an event whose target
 * equals the current state is a no-op, so cascades can be re-run safely.
 */
public final class TransitionTable<S extends Enum<S>, E extends Enum<E>> {

    private final String entity;
    private final Map<S, Map<E, S>> transitions;
    private final Map<E, Set<S>> targets;

    private TransitionTable(String entity, Map<S, Map<E, S>> transitions, Map<E, Set<S>> targets) {
        this.entity = entity;
        this.transitions = transitions;
        this.targets = targets;
    }

    public static <S extends Enum<S>, E extends Enum<E>> Builder<S, E> builder(String entity, Class<S> states,
            Class<E> events) {
        return new Builder<>(entity, states, events);
    }

    public boolean canFire(S current, E event) {
        return next(current, event, false) != null;
    }

    /**
     * @throws IllegalTransitionException when the event is not allowed from
     *                                    {@code current}
     */
    public S fire(S current, E event) {
        return next(current, event, true);
    }

    private S next(S current, E event, boolean strict) {
        Map<E, S> row = transitions.get(current);
        if (row != null && row.containsKey(event))
            return row.get(event);
        Set<S> reachable = targets.get(event);
        if (reachable != null && reachable.contains(current))
            return current;
        if (strict)
            throw new IllegalTransitionException(entity, current, event);
        return null;
    }

    public static final class Builder<S extends Enum<S>, E extends Enum<E>> {
        private final String entity;
        private final Class<S> states;
        private final Map<S, Map<E, S>> transitions;
        private final Map<E, Set<S>> targets;

        private Builder(String entity, Class<S> states, Class<E> events) {
            this.entity = entity;
            this.states = states;
            this.transitions = new EnumMap<>(states);
            this.targets = new EnumMap<>(events);
        }

        public Builder<S, E> allow(S from, E event, S to) {
            transitions.computeIfAbsent(from, k -> new HashMap<>()).put(event, to);
            targets.computeIfAbsent(event, k -> EnumSet.noneOf(states)).add(to);
            return this;
        }

        public TransitionTable<S, E> build() {
            return new TransitionTable<>(entity, transitions, targets);
        }
    }
}
