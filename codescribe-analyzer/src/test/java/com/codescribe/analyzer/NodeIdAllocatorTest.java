package com.codescribe.analyzer;

import com.codescribe.analyzer.static_analysis.NodeIdAllocator;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NodeIdAllocatorTest {

    @Test
    void punctuationCollapsesToUnderscores() {
        assertEquals("System_out_println", NodeIdAllocator.sanitize("System.out.println"));
        assertEquals("a_b_c_", NodeIdAllocator.sanitize("a.b(c)"));
        assertEquals("repo_find", NodeIdAllocator.sanitize("repo .  find"));
    }

    @Test
    void leadingDigitGetsPrefix() {
        assertEquals("n_1abc", NodeIdAllocator.sanitize("1abc"));
    }

    @Test
    void emptyLabelBecomesNode() {
        assertEquals("node", NodeIdAllocator.sanitize(""));
    }

    @Test
    void unicodeLettersAreKept() {
        assertEquals("größe", NodeIdAllocator.sanitize("größe"));
    }

    @Test
    void sanitizingTwiceChangesNothing() {
        for (String label : List.of("1a.b", "", "größe!", "a__b", "9")) {
            String once = NodeIdAllocator.sanitize(label);
            assertEquals(once, NodeIdAllocator.sanitize(once), label);
        }
    }

    @Test
    void collidingLabelsGetNumberedSuffixes() {
        NodeIdAllocator ids = new NodeIdAllocator();
        assertEquals("a_b", ids.allocate("a.b"));
        assertEquals("a_b_2", ids.allocate("a-b"));
        assertEquals("a_b_3", ids.allocate("a b"));
    }

    @Test
    void sameLabelKeepsItsId() {
        NodeIdAllocator ids = new NodeIdAllocator();
        String first = ids.allocate("x.y");
        ids.allocate("x-y");
        assertEquals(first, ids.allocate("x.y"));
    }

    @Test
    void suffixedIdDoesNotClashWithLiteralLabel() {
        NodeIdAllocator ids = new NodeIdAllocator();
        assertEquals("a", ids.allocate("a"));
        assertEquals("a_2", ids.allocate("a_2"));
        assertEquals("a_2_2", ids.allocate("a-2"));
    }
}
