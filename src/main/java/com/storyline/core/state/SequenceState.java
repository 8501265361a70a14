package com.storyline.core.state;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.storyline.core.model.DirectiveKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Selection state of one list directive, mutated in place on every evaluation.
 * <p>
 * {@code order} and {@code cursor} are only present for shuffle directives: {@code order} is the
 * current permutation of branch indices and {@code cursor} the position of the next one to emit.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"counter", "order", "cursor"})
public class SequenceState {

    private int counter;
    private List<Integer> order;
    private Integer cursor;

    public SequenceState() {
    }

    @JsonCreator
    public SequenceState(@JsonProperty("counter") int counter,
                         @JsonProperty("order") List<Integer> order,
                         @JsonProperty("cursor") Integer cursor) {
        if (counter < 0) {
            throw new IllegalArgumentException("counter must not be negative: " + counter);
        }
        if (cursor != null && (cursor < 0 || order == null || cursor > order.size())) {
            throw new IllegalArgumentException("cursor " + cursor + " is outside order " + order);
        }
        this.counter = counter;
        this.order = order != null ? new ArrayList<>(order) : null;
        this.cursor = order != null ? (cursor != null ? cursor : 0) : null;
    }

    @JsonProperty("counter")
    public int counter() {
        return counter;
    }

    @JsonProperty("order")
    public List<Integer> order() {
        return order != null ? List.copyOf(order) : null;
    }

    @JsonProperty("cursor")
    public Integer cursor() {
        return cursor;
    }

    public boolean hasShuffleOrder() {
        return order != null;
    }

    public void increment() {
        counter++;
    }

    public void updateShuffle(List<Integer> order, int cursor) {
        this.order = new ArrayList<>(order);
        this.cursor = cursor;
    }

    /**
     * Phase of the directive owning this state.
     *
     * @param kind          list kind of the directive
     * @param eligibleCount number of branches eligible in the current round
     */
    public DirectivePhase phase(DirectiveKind kind, int eligibleCount) {
        if (counter == 0 && order == null) {
            return DirectivePhase.UNVISITED;
        }
        if (kind == DirectiveKind.ONCE_ONLY && counter >= eligibleCount) {
            return DirectivePhase.EXHAUSTED;
        }
        return DirectivePhase.ACTIVE;
    }

    public SequenceState copy() {
        return new SequenceState(counter, order, cursor);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SequenceState that)) return false;
        return counter == that.counter && Objects.equals(order, that.order) && Objects.equals(cursor, that.cursor);
    }

    @Override
    public int hashCode() {
        return Objects.hash(counter, order, cursor);
    }

    @Override
    public String toString() {
        return order == null
                ? "SequenceState{counter=" + counter + "}"
                : "SequenceState{counter=" + counter + ", order=" + order + ", cursor=" + cursor + "}";
    }
}
