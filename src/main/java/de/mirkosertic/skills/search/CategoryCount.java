package de.mirkosertic.skills.search;

public record CategoryCount(String category, long count) {
}
