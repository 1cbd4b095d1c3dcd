package com.enclave.core.security;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ContainerPathsTest {

    @Test
    void normalizeResolvesRelativeAgainstBase() {
        assertEquals("/repo/source/src/a.py", ContainerPaths.normalize("/repo/source", "src/a.py"));
        assertEquals("/repo/source/a.py", ContainerPaths.normalize("/repo/source", "./src/../a.py"));
    }

    @Test
    void normalizeKeepsAbsoluteInput() {
        assertEquals("/etc/passwd", ContainerPaths.normalize("/repo/source", "/etc/passwd"));
        assertEquals("/repo", ContainerPaths.normalize("/", "//repo//"));
    }

    @Test
    void dotDotAboveRootStaysAtRoot() {
        assertEquals("/", ContainerPaths.normalize("/", "../../.."));
    }

    @Test
    void isWithinRejectsEscapes() {
        assertTrue(ContainerPaths.isWithin("/repo/source", "/repo/source"));
        assertTrue(ContainerPaths.isWithin("/repo/source", "/repo/source/README.md"));
        assertTrue(ContainerPaths.isWithin("/repo/source", "docs/guide.md"));
        assertFalse(ContainerPaths.isWithin("/repo/source", "/repo/../secret"));
        assertFalse(ContainerPaths.isWithin("/repo/source", "../secret"));
        assertFalse(ContainerPaths.isWithin("/repo/source", "/repo/source-other/file"));
    }

    @Test
    void joinProducesSingleSeparators() {
        assertEquals("/workspace/tests/test_app.py", ContainerPaths.join("/workspace/", "tests/test_app.py"));
    }
}
