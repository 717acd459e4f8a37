package com.neal.snowchange.domain;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Comparable form of a version string, split on digit runs into alternating text and number
 * segments. {@code "1.2.2"} becomes {@code ["", 1, ".", 2, ".", 2, ""]}.
 *
 * <p>Numbers compare by value, text compares case-insensitively, and a key that runs out of
 * segments first sorts lower.
 *
 * @author Neal
 */
public final class VersionKey implements Comparable<VersionKey> {
    private static final Pattern DIGITS = Pattern.compile("[0-9]+");

    private final String raw;
    private final List<Segment> segments;

    private VersionKey(String raw, List<Segment> segments) {
        this.raw = raw;
        this.segments = Collections.unmodifiableList(segments);
    }

    public static VersionKey parse(String raw) {
        String value = raw == null ? "" : raw;
        List<Segment> segments = new ArrayList<>();
        Matcher matcher = DIGITS.matcher(value);
        int last = 0;
        while (matcher.find()) {
            segments.add(Segment.text(value.substring(last, matcher.start())));
            segments.add(Segment.number(matcher.group()));
            last = matcher.end();
        }
        segments.add(Segment.text(value.substring(last)));
        return new VersionKey(value, segments);
    }

    public String getRaw() {
        return raw;
    }

    public List<Segment> getSegments() {
        return segments;
    }

    public boolean isGreaterThan(VersionKey other) {
        return compareTo(other) > 0;
    }

    @Override
    public int compareTo(VersionKey other) {
        int size = Math.min(segments.size(), other.segments.size());
        for (int i = 0; i < size; i++) {
            int result = segments.get(i).compareTo(other.segments.get(i));
            if (result != 0) {
                return result;
            }
        }
        return Integer.compare(segments.size(), other.segments.size());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof VersionKey)) {
            return false;
        }
        return segments.equals(((VersionKey) o).segments);
    }

    @Override
    public int hashCode() {
        return segments.hashCode();
    }

    @Override
    public String toString() {
        return segments.toString();
    }

    /**
     * One piece of a version key, either a non-negative number or lower-cased text.
     */
    public static final class Segment implements Comparable<Segment> {
        private final BigInteger number;
        private final String text;

        private Segment(BigInteger number, String text) {
            this.number = number;
            this.text = text;
        }

        static Segment number(String digits) {
            return new Segment(new BigInteger(digits), null);
        }

        static Segment text(String text) {
            return new Segment(null, text.toLowerCase(Locale.ROOT));
        }

        public boolean isNumeric() {
            return number != null;
        }

        @Override
        public int compareTo(Segment other) {
            if (isNumeric() && other.isNumeric()) {
                return number.compareTo(other.number);
            }
            if (!isNumeric() && !other.isNumeric()) {
                return text.compareTo(other.text);
            }
            // mixed kinds never occur for well-formed keys, fall back to text order
            return toString().compareTo(other.toString());
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof Segment)) {
                return false;
            }
            Segment segment = (Segment) o;
            return isNumeric() ? segment.isNumeric() && number.equals(segment.number) : !segment.isNumeric() && text.equals(segment.text);
        }

        @Override
        public int hashCode() {
            return isNumeric() ? number.hashCode() : text.hashCode() * 31;
        }

        @Override
        public String toString() {
            return isNumeric() ? number.toString() : text;
        }
    }
}
