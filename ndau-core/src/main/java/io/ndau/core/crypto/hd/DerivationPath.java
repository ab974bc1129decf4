// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ndau.core.crypto.hd;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import io.ndau.core.error.KeyException;

/**
 * A path through an HD key tree, such as {@code /44'/20036'/100/1}.
 *
 * <p>
 * The root is written {@code /}. Every other path is one or more {@code /n} segments,
 * where {@code n} is a decimal index no larger than {@code 2^32 - 1} and a trailing
 * apostrophe marks a hardened step. Whitespace anywhere in the string is ignored. There is
 * no leading {@code m}.
 *
 * @param elements the steps from the root, in order
 */
public record DerivationPath(List<Element> elements) {

    private static final Pattern VALID = Pattern.compile("^(/[0-9]+'?)+$");
    private static final Pattern SEGMENT = Pattern.compile("/([0-9]+)('?)");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final long MAX_INDEX = 0xFFFFFFFFL;

    private static final DerivationPath ROOT = new DerivationPath(List.of());

    public DerivationPath {
        elements = List.copyOf(Objects.requireNonNull(elements, "elements cannot be null"));
    }

    /**
     * Returns the empty path.
     *
     * @return {@code /}
     */
    public static DerivationPath root() {
        return ROOT;
    }

    /**
     * Parses a path string.
     *
     * @param path the path, e.g. {@code "/1/2'"}
     * @return the parsed path
     * @throws KeyException with kind PARSE_FAILURE if any part of the string is malformed
     */
    public static DerivationPath parse(final String path) {
        Objects.requireNonNull(path, "path cannot be null");

        final String stripped = WHITESPACE.matcher(path).replaceAll("");
        if (stripped.equals("/")) {
            return ROOT;
        }
        if (!VALID.matcher(stripped).matches()) {
            throw KeyException.parseFailure("not a valid path string: " + path);
        }

        final List<Element> elements = new ArrayList<>();
        final Matcher matcher = SEGMENT.matcher(stripped);
        while (matcher.find()) {
            final String digits = matcher.group(1);
            final long index;
            try {
                index = Long.parseLong(digits);
            } catch (NumberFormatException e) {
                throw KeyException.parseFailure("path index out of range: " + digits, e);
            }
            if (index > MAX_INDEX) {
                throw KeyException.parseFailure("path index out of range: " + digits);
            }
            elements.add(new Element((int) index, !matcher.group(2).isEmpty()));
        }
        return new DerivationPath(elements);
    }

    public int size() {
        return elements.size();
    }

    public boolean isRoot() {
        return elements.isEmpty();
    }

    /**
     * Returns whether {@code candidate} lies strictly below this path.
     *
     * @param candidate the possible descendant
     * @return {@code true} if {@code candidate} is longer and starts with every step of this path
     */
    public boolean isParentOf(final DerivationPath candidate) {
        Objects.requireNonNull(candidate, "candidate cannot be null");
        if (candidate.size() <= size()) {
            return false;
        }
        return candidate.elements.subList(0, size()).equals(elements);
    }

    /**
     * Returns the steps that lead from this path down to {@code descendant}.
     *
     * @param descendant a path this path is a parent of
     * @return the remaining steps
     * @throws KeyException with kind PARSE_FAILURE if {@code descendant} is not below this path
     */
    public DerivationPath relativize(final DerivationPath descendant) {
        if (!isParentOf(descendant)) {
            throw KeyException.parseFailure("child is not descended from parent");
        }
        return new DerivationPath(descendant.elements.subList(size(), descendant.size()));
    }

    /**
     * Returns the canonical string form, with no whitespace.
     */
    @Override
    public String toString() {
        if (elements.isEmpty()) {
            return "/";
        }
        final StringBuilder sb = new StringBuilder();
        for (final Element element : elements) {
            sb.append(element);
        }
        return sb.toString();
    }

    /**
     * One step of a path.
     *
     * @param index    the index, as an unsigned 32-bit value
     * @param hardened whether the step is hardened
     */
    public record Element(int index, boolean hardened) {

        @Override
        public String toString() {
            return "/" + Integer.toUnsignedString(index) + (hardened ? "'" : "");
        }
    }
}
