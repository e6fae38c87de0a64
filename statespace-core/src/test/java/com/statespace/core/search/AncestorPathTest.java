package com.statespace.core.search;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class AncestorPathTest {

    @Test
    void emptyPathContainsNothing() {
        AncestorPath empty = AncestorPath.empty();

        assertFalse(empty.contains(0L), "the sentinel's own identifier is not a member");
        assertTrue(empty.extend(0L).contains(0L));
    }

    @Test
    void extendLeavesReceiverUntouched() {
        AncestorPath base = AncestorPath.empty().extend(1L).extend(2L);
        AncestorPath left = base.extend(3L);
        AncestorPath right = base.extend(4L);

        assertFalse(base.contains(3L));
        assertTrue(left.contains(1L));
        assertTrue(left.contains(3L));
        assertFalse(left.contains(4L), "siblings do not see each other's extensions");
        assertTrue(right.contains(4L));
        assertFalse(right.contains(3L));
    }
}
