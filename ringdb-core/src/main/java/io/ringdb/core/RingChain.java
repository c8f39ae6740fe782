package io.ringdb.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Immutable snapshot of the ring stack, ordered bottom (oldest) to top (newest). Rings are addressed by
 * position; {@link #prev} and {@link #next} link neighbouring positions. Appending produces a new snapshot,
 * so readers holding the old one never see a partially linked ring.
 */
final class RingChain {

    static final RingChain EMPTY = new RingChain(List.of());

    private final List<Ring> rings;

    private RingChain(List<Ring> rings) {
        this.rings = rings;
    }

    RingChain append(Ring ring) {
        if (indexOf(ring.name()).isPresent()) {
            throw new IllegalArgumentException("Duplicate ring name: " + ring.name());
        }
        List<Ring> extended = new ArrayList<>(rings.size() + 1);
        extended.addAll(rings);
        extended.add(ring);
        return new RingChain(List.copyOf(extended));
    }

    int size() {
        return rings.size();
    }

    boolean isEmpty() {
        return rings.isEmpty();
    }

    Ring get(int position) {
        return rings.get(position);
    }

    List<Ring> rings() {
        return rings;
    }

    OptionalInt topPosition() {
        return rings.isEmpty() ? OptionalInt.empty() : OptionalInt.of(rings.size() - 1);
    }

    /**
     * Position of the ring directly below, older and of lower priority.
     */
    OptionalInt prev(int position) {
        return position > 0 ? OptionalInt.of(position - 1) : OptionalInt.empty();
    }

    /**
     * Position of the ring directly above, younger and of higher priority.
     */
    OptionalInt next(int position) {
        return position < rings.size() - 1 ? OptionalInt.of(position + 1) : OptionalInt.empty();
    }

    Optional<Ring> top() {
        return rings.isEmpty() ? Optional.empty() : Optional.of(rings.get(rings.size() - 1));
    }

    Optional<Ring> bottom() {
        return rings.isEmpty() ? Optional.empty() : Optional.of(rings.get(0));
    }

    OptionalInt indexOf(String name) {
        for (int i = rings.size() - 1; i >= 0; i--) {
            if (rings.get(i).name().equals(name)) {
                return OptionalInt.of(i);
            }
        }
        return OptionalInt.empty();
    }

    /**
     * Rings from top to bottom, the order in which reads probe them.
     */
    List<Ring> topDown() {
        List<Ring> result = new ArrayList<>(rings.size());
        for (OptionalInt i = topPosition(); i.isPresent(); i = prev(i.getAsInt())) {
            result.add(rings.get(i.getAsInt()));
        }
        return result;
    }
}
