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

package com.linecorp.pathmatch;

import static java.util.Objects.requireNonNull;

import javax.annotation.Nullable;

/**
 * A {@link IllegalArgumentException} raised by {@link PatternCompiler} when a path pattern is
 * malformed. A failure to match a path is never reported with an exception; see
 * {@link MatchResult#isMatched()}.
 */
public final class InvalidPatternException extends IllegalArgumentException {

    private static final long serialVersionUID = -2781853640262934218L;

    private final String pattern;
    private final String reason;
    private final int position;

    /**
     * Creates a new instance.
     *
     * @param reason why the {@code pattern} was rejected
     * @param pattern the rejected path pattern
     */
    public InvalidPatternException(String reason, String pattern) {
        this(reason, pattern, -1, null);
    }

    /**
     * Creates a new instance.
     *
     * @param reason why the {@code pattern} was rejected
     * @param pattern the rejected path pattern
     * @param position the index of the offending character in the {@code pattern}, or {@code -1}
     */
    public InvalidPatternException(String reason, String pattern, int position) {
        this(reason, pattern, position, null);
    }

    /**
     * Creates a new instance with the specified {@code cause}.
     */
    public InvalidPatternException(String reason, String pattern, int position, @Nullable Throwable cause) {
        super(message(requireNonNull(reason, "reason"), requireNonNull(pattern, "pattern"), position),
              cause);
        this.pattern = pattern;
        this.reason = reason;
        this.position = position;
    }

    private static String message(String reason, String pattern, int position) {
        if (position < 0) {
            return "pattern: " + pattern + " (" + reason + ')';
        }
        return "pattern: " + pattern + " (" + reason + " at index " + position + ')';
    }

    /**
     * Returns the rejected path pattern.
     */
    public String pattern() {
        return pattern;
    }

    /**
     * Returns why the pattern was rejected, without the pattern itself.
     */
    public String reason() {
        return reason;
    }

    /**
     * Returns the index of the offending character in the {@link #pattern()}, or {@code -1} if the
     * problem is not attributable to a single position.
     */
    public int position() {
        return position;
    }
}
