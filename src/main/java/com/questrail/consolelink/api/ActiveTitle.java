package com.questrail.consolelink.api;

import java.util.Objects;
import java.util.UUID;

/**
 * A title currently running on the console.
 *
 * @param titleId   unsigned 32-bit title identifier
 * @param hasFocus  whether the title currently holds input focus
 * @param location  screen region the title occupies
 * @param productId store product identifier
 * @param sandboxId sandbox the title runs in
 * @param aumId     application user model id
 */
public record ActiveTitle(
        long titleId,
        boolean hasFocus,
        ActiveTitleLocation location,
        UUID productId,
        UUID sandboxId,
        String aumId
) {
    public ActiveTitle {
        Objects.requireNonNull(location, "location");
        Objects.requireNonNull(productId, "productId");
        Objects.requireNonNull(sandboxId, "sandboxId");
        Objects.requireNonNull(aumId, "aumId");
    }
}
