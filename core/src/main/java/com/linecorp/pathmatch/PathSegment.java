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

import java.util.Map;
import java.util.regex.Pattern;

import javax.annotation.Nullable;

/**
 * A single {@code '/'}-delimited component of a compiled path pattern. The set of implementations is
 * closed; use {@link #type()} to tell them apart:
 * <ul>
 *   <li>{@link SegmentType#LITERAL} - {@code users}</li>
 *   <li>{@link SegmentType#VARIABLE} - {@code {id}} or {@code {id:[0-9]+}}</li>
 *   <li>{@link SegmentType#WILDCARD} - {@code *}</li>
 *   <li>{@link SegmentType#MULTI_WILDCARD} - {@code **}</li>
 * </ul>
 * A {@link PathSegment} is immutable and does not drive matching by itself. {@link PathMatcher} calls
 * {@link #matches(String, boolean)} and {@link #extractVariables(String)} on it.
 */
public abstract class PathSegment {

    private static final PathSegment WILDCARD = new WildcardSegment(false);
    private static final PathSegment MULTI_WILDCARD = new WildcardSegment(true);

    /**
     * Returns a new literal segment which matches {@code value} only.
     */
    public static PathSegment ofLiteral(String value) {
        return new LiteralSegment(value);
    }

    /**
     * Returns a new variable segment which matches any non-empty path component.
     */
    public static PathSegment ofVariable(String name) {
        return new VariableSegment(name, null);
    }

    /**
     * Returns a new variable segment which matches a path component only when the whole component
     * matches the specified {@code constraint}.
     */
    public static PathSegment ofVariable(String name, @Nullable Pattern constraint) {
        return new VariableSegment(name, constraint);
    }

    /**
     * Returns the {@code *} segment.
     */
    public static PathSegment ofWildcard() {
        return WILDCARD;
    }

    /**
     * Returns the {@code **} segment.
     */
    public static PathSegment ofMultiWildcard() {
        return MULTI_WILDCARD;
    }

    PathSegment() {}

    /**
     * Returns the {@link SegmentType} of this segment.
     */
    public abstract SegmentType type();

    /**
     * Returns whether this segment accepts the specified path {@code component}.
     *
     * @param component a single path component, which never contains {@code '/'}
     * @param caseInsensitive whether a literal comparison should ignore case
     */
    public abstract boolean matches(String component, boolean caseInsensitive);

    /**
     * Returns the variables bound by this segment when it accepts the specified {@code component}.
     * Only a {@link SegmentType#VARIABLE} segment returns a non-empty {@link Map}.
     */
    public abstract Map<String, String> extractVariables(String component);

    /**
     * Returns the textual form of this segment as it would appear in a path pattern.
     */
    public abstract String segmentString();

    /**
     * Returns whether this segment is a {@link SegmentType#LITERAL}.
     */
    public final boolean isLiteral() {
        return type() == SegmentType.LITERAL;
    }

    /**
     * Returns whether this segment is a {@link SegmentType#WILDCARD} or
     * {@link SegmentType#MULTI_WILDCARD}.
     */
    public final boolean isWildcard() {
        return type().isWildcard();
    }

    @Override
    public String toString() {
        return segmentString();
    }
}
