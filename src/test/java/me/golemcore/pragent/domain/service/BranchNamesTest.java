package me.golemcore.pragent.domain.service;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;

class BranchNamesTest {

    private static final Clock CLOCK = Clock.fixed(Instant.ofEpochMilli(1700000000000L), ZoneOffset.UTC);

    @Test
    void shouldDeriveSlugFromFirstTwentyCharacters() {
        assertEquals("feature/1700000000000-add-dark-mode-toggle",
                BranchNames.derive("Add dark mode toggle to the header", CLOCK));
    }

    @Test
    void shouldReplaceEveryNonAlphanumericCharacter() {
        assertEquals("feature/1700000000000-fix--readme--typo-",
                BranchNames.derive("Fix: README, typo!", CLOCK));
    }

    @Test
    void shouldKeepRequestedBranchTrimmed() {
        assertEquals("feature/custom", BranchNames.resolve("  feature/custom ", "ignored", CLOCK));
    }

    @Test
    void shouldDeriveWhenRequestedBranchIsBlank() {
        assertEquals("feature/1700000000000-docs", BranchNames.resolve(" ", "docs", CLOCK));
        assertEquals("feature/1700000000000-", BranchNames.resolve(null, null, CLOCK));
    }
}
