package github.sarthakdev143.scene_factory.model.assembly;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Ordered per-scene artifacts ready for concatenation. A plan is consumed exactly once.
 */
public final class AssemblyPlan {

    private final List<AssemblyEntry> entries;
    private final AtomicBoolean consumed = new AtomicBoolean(false);

    public AssemblyPlan(List<AssemblyEntry> entries) {
        this.entries = entries == null ? List.of() : List.copyOf(entries);
    }

    public int size() {
        return entries.size();
    }

    public boolean isConsumed() {
        return consumed.get();
    }

    public List<AssemblyEntry> consume() {
        if (!consumed.compareAndSet(false, true)) {
            throw new IllegalStateException("Assembly plan has already been consumed.");
        }
        return entries;
    }
}
