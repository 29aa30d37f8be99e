package com.brush.matching.compose;

import com.brush.matching.core.model.Fiber;
import com.brush.matching.core.model.FiberStrategy;

import java.util.Optional;

/**
 * Reconciles a catalog fiber with the fiber named in user text.
 *
 * <ul>
 *   <li>user names nothing: catalog fiber, {@code default}</li>
 *   <li>catalog fiber is only a brand default: user fiber, {@code user_input}</li>
 *   <li>user agrees with the catalog: catalog fiber, {@code user_input}</li>
 *   <li>user disagrees: catalog fiber, {@code yaml}, user fiber recorded as conflict</li>
 *   <li>catalog names nothing: user fiber, {@code user_input}</li>
 * </ul>
 */
public final class FiberResolver {

    private FiberResolver() {
    }

    public static FiberResolution resolve(Fiber catalogFiber, boolean overridable, Optional<Fiber> userFiber) {
        if (catalogFiber == null) {
            return userFiber
                    .map(f -> new FiberResolution(f, FiberStrategy.USER_INPUT, null))
                    .orElseGet(FiberResolution::none);
        }
        if (userFiber.isEmpty()) {
            return new FiberResolution(catalogFiber, FiberStrategy.DEFAULT, null);
        }
        Fiber user = userFiber.get();
        if (overridable || user == catalogFiber) {
            return new FiberResolution(user, FiberStrategy.USER_INPUT, null);
        }
        return new FiberResolution(catalogFiber, FiberStrategy.YAML, user.displayName());
    }
}
