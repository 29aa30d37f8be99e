package com.brush.matching.compose;

import com.brush.matching.core.model.Fiber;
import com.brush.matching.core.model.FiberStrategy;

/**
 * Outcome of reconciling the catalog fiber with the fiber named by the user.
 *
 * @param fiber    the fiber to report, or {@code null} when neither side names one
 * @param strategy where the fiber came from, or {@code null} with no fiber
 * @param conflict the user's fiber when it was overruled by the catalog, else {@code null}
 */
public record FiberResolution(Fiber fiber, FiberStrategy strategy, String conflict) {

    static FiberResolution none() {
        return new FiberResolution(null, null, null);
    }
}
