package com.github.musiKk.stubs.parser;

import java.util.Arrays;
import java.util.List;

public record ParseTarget(List<Integer> version, String platform) {

    public static final ParseTarget DEFAULT = new ParseTarget(List.of(2, 7, 6), "linux");

    public ParseTarget {
        version = List.copyOf(version);
        if (version.isEmpty() || version.size() > 3) {
            throw new IllegalArgumentException("version must have 1 to 3 components: " + version);
        }
    }

    public static ParseTarget of(String version, String platform) {
        return new ParseTarget(parseVersion(version), platform);
    }

    public static List<Integer> parseVersion(String dotted) {
        List<Integer> version;
        try {
            version = Arrays.stream(dotted.trim().split("\\."))
                    .map(Integer::valueOf)
                    .toList();
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid version: " + dotted, e);
        }
        if (version.size() > 3) {
            throw new IllegalArgumentException("invalid version: " + dotted);
        }
        return version;
    }

    public ParseTarget withVersion(List<Integer> version) {
        return new ParseTarget(version, platform);
    }

    public ParseTarget withPlatform(String platform) {
        return new ParseTarget(version, platform);
    }

    public String versionString() {
        return String.join(".", version.stream().map(String::valueOf).toList());
    }
}
