package com.pagereader.app;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class CliArgsTest {

    @Test
    void single_image_with_defaults() {
        CliArgs a = CliArgs.parse(new String[]{"-i", "page.png"});

        assertEquals(Path.of("page.png"), a.image());
        assertNull(a.folder());
        assertTrue(a.checkErrors());
        assertFalse(a.saveOutput());
        assertTrue(a.hasTarget());
    }

    @Test
    void long_forms_and_flags() {
        CliArgs a = CliArgs.parse(new String[]{"--folder=scans", "--no-check", "--output"});

        assertEquals(Path.of("scans"), a.folder());
        assertFalse(a.checkErrors());
        assertTrue(a.saveOutput());
    }

    @Test
    void help_and_no_target() {
        CliArgs a = CliArgs.parse(new String[]{"-h"});
        assertTrue(a.help());
        assertFalse(a.hasTarget());
        assertFalse(CliArgs.parse(new String[0]).hasTarget());
    }

    @Test
    void bad_arguments_are_rejected() {
        assertThrows(IllegalArgumentException.class, () -> CliArgs.parse(new String[]{"--bogus"}));
        assertThrows(IllegalArgumentException.class, () -> CliArgs.parse(new String[]{"-i"}));
        assertThrows(IllegalArgumentException.class, () -> CliArgs.parse(new String[]{"-d", "-o"}));
    }
}
