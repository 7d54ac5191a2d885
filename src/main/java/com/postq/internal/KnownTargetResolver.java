package com.postq.internal;

import com.postq.ScheduledMessage;
import com.postq.Target;
import com.postq.TargetRepository;
import com.postq.TargetResolver;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Resolves targets from the {@code postq_targets} table. Explicit target lists
 * are used as given, without a liveness check: the table may lag behind
 * activity on the platform.
 */
@Component
public class KnownTargetResolver implements TargetResolver {

    private final TargetRepository targetRepository;

    public KnownTargetResolver(TargetRepository targetRepository) {
        this.targetRepository = targetRepository;
    }

    @Override
    public Set<String> resolve(ScheduledMessage message) {
        Set<String> targets = new LinkedHashSet<>();
        switch (message.getTargetsMode()) {
            case EXPLICIT -> {
                for (String targetId : message.getTargetIds()) {
                    if (targetId != null && !targetId.isBlank()) {
                        targets.add(targetId.trim());
                    }
                }
            }
            case ALL -> {
                try {
                    for (Target target : targetRepository.findByActiveTrueOrderByTargetIdAsc()) {
                        targets.add(target.getTargetId());
                    }
                } catch (DataAccessException e) {
                    throw new StoreIOException("Failed to load active targets for message " + message.getId(), e);
                }
            }
        }
        return targets;
    }
}
