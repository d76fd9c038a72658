package com.arbor.container;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Semantic version of the container format, {@code major.minor.patch}. Only the major component takes part
 * in compatibility decisions. Pre-release suffixes ({@code 1.0.0rc3}) are tolerated: minor and patch are read
 * from their leading digits and default to 0. The major component has no upper bound, so any all-digit major
 * compares correctly.
 */
public final class FormatVersion {

    private final String text;
    private final BigInteger major;
    private final int minor;
    private final int patch;

    private FormatVersion(String text, BigInteger major, int minor, int patch) {
        this.text = text;
        this.major = major;
        this.minor = minor;
        this.patch = patch;
    }

    /**
     * Parses a version string.
     *
     * @throws IllegalArgumentException if the text is blank or its major component is not a number
     */
    public static FormatVersion parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Version is missing");
        }
        String trimmed = text.trim();
        String[] parts = trimmed.split("\\.", -1);
        BigInteger major;
        try {
            major = new BigInteger(parts[0]);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Version has no numeric major component: " + text, e);
        }
        if (major.signum() < 0) {
            throw new IllegalArgumentException("Version has a negative major component: " + text);
        }
        int minor = parts.length > 1 ? leadingNumber(parts[1]) : 0;
        int patch = parts.length > 2 ? leadingNumber(parts[2]) : 0;
        return new FormatVersion(trimmed, major, minor, patch);
    }

    /** First release of the given major line, e.g. {@code 2.0.0}. */
    public static FormatVersion firstOfMajor(BigInteger major) {
        return new FormatVersion(major + ".0.0", major, 0, 0);
    }

    public static FormatVersion firstOfMajor(long major) {
        return firstOfMajor(BigInteger.valueOf(major));
    }

    private static int leadingNumber(String s) {
        int end = 0;
        while (end < s.length() && Character.isDigit(s.charAt(end))) {
            end++;
        }
        if (end == 0) return 0;
        try {
            return Integer.parseInt(s.substring(0, end));
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    public BigInteger getMajor() {
        return major;
    }

    public int getMinor() {
        return minor;
    }

    public int getPatch() {
        return patch;
    }

    /** True when a reader of this version can load a file written by {@code other} (same or older major). */
    public boolean canRead(FormatVersion other) {
        return other.major.compareTo(major) <= 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FormatVersion that = (FormatVersion) o;
        return Objects.equals(text, that.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(text);
    }

    @Override
    public String toString() {
        return text;
    }
}
