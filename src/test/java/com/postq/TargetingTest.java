package com.postq;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TargetingTest {

    @Test
    void shouldRejectNullTargetIdWithValidationError() {
        MessageValidationException exception = assertThrows(MessageValidationException.class,
                () -> Targeting.explicit(Arrays.asList("chat-1", null)));

        assertEquals("Target ids must not contain null", exception.getMessage());
    }

    @Test
    void shouldDefaultMissingModeAndIds() {
        Targeting targeting = new Targeting(null, null);

        assertEquals(TargetsMode.ALL, targeting.mode());
        assertTrue(targeting.targetIds().isEmpty());
    }

    @Test
    void shouldCopyTargetIds() {
        List<String> ids = new ArrayList<>(List.of("chat-1"));
        Targeting targeting = Targeting.explicit(ids);
        ids.add("chat-2");

        assertEquals(List.of("chat-1"), targeting.targetIds());
    }
}
