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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import java.util.List;
import java.util.Set;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

/**
 * A path pattern compiled by {@link PatternCompiler}. It holds three things:
 * <ul>
 *   <li>The source text of the pattern, e.g. {@code /users/{id}/posts/**}.</li>
 *   <li>The {@link PathSegment}s of the pattern, in order.</li>
 *   <li>The properties derived from the segments when the pattern was compiled, such as
 *       {@link #specificityRank()}.</li>
 * </ul>
 * A {@link CompiledPattern} is immutable and may be shared by any number of threads.
 */
public final class CompiledPattern {

    private final String sourceText;
    private final List<PathSegment> segments;
    private final Set<String> variableNames;
    private final boolean isStatic;
    private final boolean hasWildcard;
    private final boolean hasVariables;
    private final int wildcardCount;
    private final int multiWildcardCount;
    private final boolean caseInsensitive;
    private final boolean optionalTrailingSlash;
    private final boolean trailingSlash;
    private final long specificityRank;

    CompiledPattern(String sourceText, List<PathSegment> segments, Set<String> variableNames,
                    boolean hasWildcard, boolean hasVariables, int wildcardCount, int multiWildcardCount,
                    boolean caseInsensitive, boolean optionalTrailingSlash, boolean trailingSlash,
                    long specificityRank) {
        this.sourceText = requireNonNull(sourceText, "sourceText");
        this.segments = ImmutableList.copyOf(requireNonNull(segments, "segments"));
        this.variableNames = ImmutableSet.copyOf(requireNonNull(variableNames, "variableNames"));
        checkArgument(hasVariables == !this.variableNames.isEmpty(),
                      "hasVariables: %s (expected: %s)", hasVariables, !this.variableNames.isEmpty());
        checkArgument(hasWildcard == (wildcardCount > 0),
                      "wildcardCount: %s (expected: %s)", wildcardCount, hasWildcard ? "> 0" : "0");
        this.hasWildcard = hasWildcard;
        this.hasVariables = hasVariables;
        isStatic = !hasWildcard && !hasVariables;
        this.wildcardCount = wildcardCount;
        this.multiWildcardCount = multiWildcardCount;
        this.caseInsensitive = caseInsensitive;
        this.optionalTrailingSlash = optionalTrailingSlash;
        this.trailingSlash = trailingSlash;
        this.specificityRank = specificityRank;
    }

    /**
     * Returns the normalized source text this pattern was compiled from.
     */
    public String sourceText() {
        return sourceText;
    }

    /**
     * Returns the {@link PathSegment}s of this pattern. The root pattern {@code "/"} has no segments.
     */
    public List<PathSegment> segments() {
        return segments;
    }

    /**
     * Returns the names of the variables declared in this pattern, in the order of appearance.
     */
    public Set<String> variableNames() {
        return variableNames;
    }

    /**
     * Returns whether this pattern consists of literal segments only.
     */
    public boolean isStatic() {
        return isStatic;
    }

    /**
     * Returns whether this pattern contains {@code *} or {@code **}.
     */
    public boolean hasWildcard() {
        return hasWildcard;
    }

    /**
     * Returns whether this pattern declares at least one variable.
     */
    public boolean hasVariables() {
        return hasVariables;
    }

    /**
     * Returns the number of {@code *} and {@code **} segments.
     */
    public int wildcardCount() {
        return wildcardCount;
    }

    /**
     * Returns the number of {@code **} segments.
     */
    public int multiWildcardCount() {
        return multiWildcardCount;
    }

    /**
     * Returns whether literal segments of this pattern are matched ignoring case.
     */
    public boolean caseInsensitive() {
        return caseInsensitive;
    }

    /**
     * Returns whether a single trailing slash is ignored when matching this pattern.
     */
    public boolean optionalTrailingSlash() {
        return optionalTrailingSlash;
    }

    /**
     * Returns whether the {@link #sourceText()} ends with a slash, e.g. {@code /users/}.
     */
    public boolean hasTrailingSlash() {
        return trailingSlash;
    }

    /**
     * Returns the specificity of this pattern. A higher rank means a more specific pattern. The rank
     * depends only on the {@link #segments()}: it compares like the tuple of the numbers of literal,
     * constrained variable, variable, {@code *} and {@code **} segments.
     */
    public long specificityRank() {
        return specificityRank;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CompiledPattern)) {
            return false;
        }
        final CompiledPattern that = (CompiledPattern) o;
        return caseInsensitive == that.caseInsensitive &&
               optionalTrailingSlash == that.optionalTrailingSlash &&
               sourceText.equals(that.sourceText);
    }

    @Override
    public int hashCode() {
        int hash = sourceText.hashCode();
        hash = hash * 31 + Boolean.hashCode(caseInsensitive);
        return hash * 31 + Boolean.hashCode(optionalTrailingSlash);
    }

    @Override
    public String toString() {
        return sourceText;
    }
}
