package org.broadinstitute.hcdetect.utils;

import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Argument checks for the count-table code and the framed warning shown for recoverable conditions.
 */
public final class Utils {

    private Utils(){}

    private static final int WARNING_WIDTH = 68;
    private static final String WARNING_PREFIX = "* ";
    private static final String WARNING_BORDER = StringUtils.repeat('*', WARNING_PREFIX.length() + WARNING_WIDTH);

    /**
     * Logs {@code msg} at warn level inside a star banner, one log line per banner line.
     */
    public static void warnUser(final Logger logger, final String msg) {
        warnUserLines(msg).forEach(logger::warn);
    }

    /**
     * The banner lines {@link #warnUser(Logger, String)} logs: borders, a heading and the message wrapped at
     * {@value #WARNING_WIDTH} characters.
     */
    public static List<String> warnUserLines(final String msg) {
        final List<String> lines = new ArrayList<>();
        lines.add(WARNING_BORDER);
        lines.add(WARNING_PREFIX + "WARNING:");
        lines.add(WARNING_PREFIX);
        for (final String paragraph : msg.split("\\r?\\n")) {
            final StringBuilder line = new StringBuilder();
            for (final String word : paragraph.split(" ")) {
                if (line.length() > 0 && line.length() + 1 + word.length() > WARNING_WIDTH) {
                    lines.add(WARNING_PREFIX + line);
                    line.setLength(0);
                }
                if (line.length() > 0) {
                    line.append(' ');
                }
                line.append(word);
            }
            lines.add(WARNING_PREFIX + line);
        }
        lines.add(WARNING_BORDER);
        return lines;
    }

    /**
     * @return {@code object}
     * @throws IllegalArgumentException if {@code object} is {@code null}.
     */
    public static <T> T nonNull(final T object) {
        return nonNull(object, "Null object is not allowed here.");
    }

    /**
     * @return {@code object}
     * @throws IllegalArgumentException with {@code message} if {@code object} is {@code null}.
     */
    public static <T> T nonNull(final T object, final String message) {
        validateArg(object != null, message);
        return object;
    }

    /**
     * @return {@code collection}
     * @throws IllegalArgumentException if {@code collection} is {@code null} or empty.
     */
    public static <I, T extends Collection<I>> T nonEmpty(final T collection, final String message) {
        nonNull(collection, "The collection is null: " + message);
        validateArg(!collection.isEmpty(), () -> "The collection is empty: " + message);
        return collection;
    }

    /**
     * @throws IllegalArgumentException if {@code collection} is {@code null} or holds a {@code null}.
     */
    public static void containsNoNull(final Collection<?> collection, final String message) {
        nonNull(collection, message);
        // Collection.contains(null) throws on some Set implementations
        validateArg(collection.stream().allMatch(Objects::nonNull), message);
    }

    /**
     * Returns the elements in iteration order as a set.
     *
     * @throws IllegalArgumentException naming the first repeated element, if any.
     */
    public static <E> Set<E> checkForDuplicatesAndReturnSet(final Collection<E> c, final String message) {
        final Set<E> set = new LinkedHashSet<>();
        for (final E element : c) {
            validateArg(set.add(element), () -> String.format("%s  Value %s appears more than once.", message, element));
        }
        return set;
    }

    public static void validateArg(final boolean condition, final String msg){
        if (!condition){
            throw new IllegalArgumentException(msg);
        }
    }

    public static void validateArg(final boolean condition, final Supplier<String> msg){
        if (!condition){
            throw new IllegalArgumentException(msg.get());
        }
    }
}
