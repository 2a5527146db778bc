package com.hermes.core.pagination;

import com.hermes.core.exception.ValidationException;
import org.junit.jupiter.api.Test;
import java.util.List;
import java.util.Set;
import static org.junit.jupiter.api.Assertions.*;

class PaginationPolicyTest {

    private final PaginationPolicy policy = new PaginationPolicy(10, 100);

    @Test
    void resolve_withNoParameters_shouldUseDefaults() {
        PageRequest page = policy.resolve(null, null, null);
        
        assertEquals(0, page.offset());
        assertEquals(10, page.limit());
        assertTrue(page.expand().isEmpty());
    }

    @Test
    void resolve_withBlankParameters_shouldUseDefaults() {
        PageRequest page = policy.resolve("", " ", List.of());
        
        assertEquals(0, page.offset());
        assertEquals(10, page.limit());
    }

    @Test
    void resolve_shouldParseOffsetAndLimit() {
        PageRequest page = policy.resolve("20", "5", null);
        
        assertEquals(20, page.offset());
        assertEquals(5, page.limit());
    }

    @Test
    void resolve_shouldCapLimitAtMaximum() {
        PageRequest page = policy.resolve("0", "5000", null);
        
        assertEquals(100, page.limit());
    }

    @Test
    void resolve_withNegativeOffset_shouldFail() {
        ValidationException e = assertThrows(ValidationException.class,
            () -> policy.resolve("-1", null, null));
        
        assertEquals(ValidationException.ERROR_CODE, e.getErrorCode());
        assertTrue(e.getMessage().contains("offset"));
    }

    @Test
    void resolve_withNonPositiveLimit_shouldFail() {
        assertThrows(ValidationException.class, () -> policy.resolve(null, "0", null));
        assertThrows(ValidationException.class, () -> policy.resolve(null, "-3", null));
    }

    @Test
    void resolve_withNonIntegerInput_shouldFail() {
        assertThrows(ValidationException.class, () -> policy.resolve("abc", null, null));
        assertThrows(ValidationException.class, () -> policy.resolve(null, "1.5", null));
    }

    @Test
    void resolve_shouldCollectRepeatedAndCommaSeparatedExpand() {
        PageRequest page = policy.resolve(null, null, List.of("labors", "quests,events", " fates "));
        
        assertEquals(Set.of("labors", "quests", "events", "fates"), page.expand());
    }

    @Test
    void resolve_shouldKeepUnknownAndCaseSensitiveNames() {
        PageRequest page = policy.resolve(null, null, List.of("Labors", "bogus"));
        
        assertFalse(page.expands("labors"));
        assertTrue(page.expands("Labors"));
        assertTrue(page.expands("bogus"));
    }

    @Test
    void constructor_shouldRejectInconsistentPageSizes() {
        assertThrows(IllegalArgumentException.class, () -> new PaginationPolicy(0, 10));
        assertThrows(IllegalArgumentException.class, () -> new PaginationPolicy(20, 10));
    }
}
