/*
 * Copyright 2019 LINE Corporation
 *
 * LINE Corporation licenses this file to you under the Apache License,
 * version 2.0 (the "License"); you may not use this file except in compliance
 * with the License. You may obtain a copy of the License at:
 *
 *   https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 * WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 * License for the specific language governing permissions and limitations
 * under the License.
 */

package com.linecorp.pathmatch.internal;

import static java.util.Objects.requireNonNull;

import java.util.List;

import javax.annotation.Nullable;

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;

/**
 * Utilities for splitting, joining and escaping paths and path patterns.
 */
public final class PathUtil {

    public static final char PATH_SEPARATOR = '/';

    private static final char ESCAPE = '\\';

    private static final Splitter PATH_SPLITTER = Splitter.on(PATH_SEPARATOR);

    private static final Joiner PATH_JOINER = Joiner.on(PATH_SEPARATOR);

    /**
     * Returns whether the specified {@code path} starts with {@code '/'}.
     */
    public static boolean isAbsolutePath(@Nullable String path) {
        return path != null && !path.isEmpty() && path.charAt(0) == PATH_SEPARATOR;
    }

    /**
     * Returns whether the specified {@code path} ends with {@code '/'}. The root path {@code "/"} is
     * never regarded as having a trailing slash.
     */
    public static boolean hasTrailingSlash(String path) {
        return path.length() > 1 && path.charAt(path.length() - 1) == PATH_SEPARATOR;
    }

    /**
     * Removes a single trailing {@code '/'} from the specified {@code path}, except for the root path.
     */
    public static String stripTrailingSlash(String path) {
        return hasTrailingSlash(path) ? path.substring(0, path.length() - 1) : path;
    }

    /**
     * Splits the specified absolute {@code path} into its components, ignoring the leading {@code '/'}
     * and a single trailing {@code '/'}.
     * <ul>
     *   <li>{@code "/"} -> {@code []}</li>
     *   <li>{@code "/a/b"} -> {@code ["a", "b"]}</li>
     *   <li>{@code "/a/b/"} -> {@code ["a", "b"]}</li>
     * </ul>
     *
     * @return the components, or {@code null} if the {@code path} is not absolute or contains an empty
     *         component such as {@code "/a//b"}.
     */
    @Nullable
    public static List<String> splitPath(String path) {
        requireNonNull(path, "path");
        if (!isAbsolutePath(path) || path.contains("//")) {
            return null;
        }
        final String stripped = stripTrailingSlash(path);
        if (stripped.length() == 1) {
            return ImmutableList.of();
        }

        final List<String> components = PATH_SPLITTER.splitToList(stripped.substring(1));
        for (String component : components) {
            if (component.isEmpty()) {
                return null;
            }
        }
        return components;
    }

    /**
     * Joins the components in {@code [fromIndex, toIndex)} with {@code '/'}.
     */
    public static String join(List<String> components, int fromIndex, int toIndex) {
        if (toIndex - fromIndex == 1) {
            return components.get(fromIndex);
        }
        return PATH_JOINER.join(components.subList(fromIndex, toIndex));
    }

    /**
     * Escapes {@code '\\'}, <code>'{'</code>, <code>'}'</code> and {@code '*'} with a backslash so that
     * the specified text is compiled as a literal when embedded into a path pattern.
     */
    public static String escape(String text) {
        requireNonNull(text, "text");
        StringBuilder buf = null;
        for (int i = 0; i < text.length(); i++) {
            final char ch = text.charAt(i);
            if (ch == ESCAPE || ch == '{' || ch == '}' || ch == '*') {
                if (buf == null) {
                    buf = new StringBuilder(text.length() + 8);
                    buf.append(text, 0, i);
                }
                buf.append(ESCAPE);
            }
            if (buf != null) {
                buf.append(ch);
            }
        }
        return buf != null ? buf.toString() : text;
    }

    /**
     * Removes the escaping backslashes from the specified pattern segment. A trailing backslash which
     * escapes nothing is kept as is.
     */
    public static String unescape(String segment) {
        requireNonNull(segment, "segment");
        if (segment.indexOf(ESCAPE) < 0) {
            return segment;
        }
        final StringBuilder buf = new StringBuilder(segment.length());
        for (int i = 0; i < segment.length(); i++) {
            final char ch = segment.charAt(i);
            if (ch == ESCAPE && i + 1 < segment.length()) {
                buf.append(segment.charAt(++i));
            } else {
                buf.append(ch);
            }
        }
        return buf.toString();
    }

    /**
     * Returns the index of the first occurrence of {@code ch} in {@code segment} which is not escaped
     * with a backslash, or {@code -1}.
     */
    public static int indexOfUnescaped(String segment, char ch) {
        for (int i = 0; i < segment.length(); i++) {
            final char c = segment.charAt(i);
            if (c == ESCAPE) {
                i++;
            } else if (c == ch) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Returns whether the specified pattern segment ends with a backslash which escapes nothing.
     */
    public static boolean hasDanglingEscape(String segment) {
        int backslashes = 0;
        for (int i = segment.length() - 1; i >= 0 && segment.charAt(i) == ESCAPE; i--) {
            backslashes++;
        }
        return backslashes % 2 != 0;
    }

    private PathUtil() {}
}
