package com.postq;

import java.util.List;
import java.util.Objects;

/**
 * Which targets a message goes to.
 */
public record Targeting(TargetsMode mode, List<String> targetIds) {

    public Targeting {
        mode = mode == null ? TargetsMode.ALL : mode;
        if (targetIds != null && targetIds.stream().anyMatch(Objects::isNull)) {
            throw new MessageValidationException("Target ids must not contain null");
        }
        targetIds = targetIds == null ? List.of() : List.copyOf(targetIds);
    }

    public static Targeting all() {
        return new Targeting(TargetsMode.ALL, List.of());
    }

    public static Targeting explicit(List<String> targetIds) {
        return new Targeting(TargetsMode.EXPLICIT, targetIds);
    }
}
