package info.isaksson.erland.buml.structural;

import java.time.Instant;
import java.util.Comparator;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Root of every structural element.
 *
 * <p>Each element receives a creation-order marker from a process-wide counter when it is
 * constructed. The marker is strictly increasing across all elements, so sorting by it restores
 * construction order even for elements created within the same clock tick. The timestamp is
 * informational only.</p>
 */
public abstract class Element {

    private static final AtomicLong SEQUENCE = new AtomicLong();

    /** Orders elements by construction order. */
    public static final Comparator<Element> CREATION_ORDER =
            Comparator.comparingLong(Element::getCreationOrder);

    private final long creationOrder;
    private Instant timestamp;

    protected Element(Instant timestamp) {
        this.creationOrder = SEQUENCE.incrementAndGet();
        this.timestamp = timestamp == null ? Instant.now() : timestamp;
    }

    public final long getCreationOrder() {
        return creationOrder;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp == null ? Instant.now() : timestamp;
    }
}
