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

import java.util.List;
import java.util.Map;
import java.util.Set;

import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * The outcome of matching a path against a {@link CompiledPattern}. Use {@link #isMatched()} to tell
 * whether the match succeeded; a failed match is a regular result, not an error.
 *
 * @see MatchResultBuilder
 */
public final class MatchResult {

    /**
     * Returns a {@link MatchResult} which represents a failed match.
     *
     * @param path the path that did not match
     * @param pattern the source text of the pattern, or an empty string if no pattern was involved
     */
    public static MatchResult noMatch(String path, String pattern) {
        return new MatchResult(false, path, pattern, ImmutableMap.of(), ImmutableList.of(),
                               ImmutableList.of());
    }

    /**
     * Returns a new {@link MatchResultBuilder}.
     */
    public static MatchResultBuilder builder() {
        return new MatchResultBuilder();
    }

    private final boolean matched;
    private final String path;
    private final String pattern;
    private final Map<String, String> variables;
    private final List<String> segments;
    private final List<String> wildcards;

    MatchResult(boolean matched, String path, String pattern, Map<String, String> variables,
                List<String> segments, List<String> wildcards) {
        this.matched = matched;
        this.path = requireNonNull(path, "path");
        this.pattern = requireNonNull(pattern, "pattern");
        this.variables = ImmutableMap.copyOf(variables);
        this.segments = ImmutableList.copyOf(segments);
        this.wildcards = ImmutableList.copyOf(wildcards);
    }

    /**
     * Returns whether the path matched the pattern.
     */
    public boolean isMatched() {
        return matched;
    }

    /**
     * Returns the path that was matched.
     */
    public String path() {
        return path;
    }

    /**
     * Returns the source text of the pattern that was matched against. {@link PathMatcher#matchBest}
     * returns an empty string here when none of the candidates matched.
     */
    public String pattern() {
        return pattern;
    }

    /**
     * Returns the variables bound by the match, e.g. <code>{id=42}</code> for the pattern
     * {@code /users/{id}} and the path {@code /users/42}.
     */
    public Map<String, String> variables() {
        return variables;
    }

    /**
     * Returns the value bound to the variable with the specified {@code name}.
     */
    @Nullable
    public String variable(String name) {
        return variables.get(requireNonNull(name, "name"));
    }

    /**
     * Returns the names of the bound variables.
     */
    public Set<String> variableNames() {
        return variables.keySet();
    }

    /**
     * Returns the components of the matched path, e.g. {@code ["users", "42"]} for {@code /users/42}.
     * Empty when the match failed.
     */
    public List<String> segments() {
        return segments;
    }

    /**
     * Returns the text captured by each {@code *} and {@code **} of the pattern, in the order the
     * wildcards appear. A {@code **} captures the components it consumed joined with {@code '/'},
     * e.g. {@code ["a/b"]} for the pattern {@code /static/**}{@code /file.js} and the path
     * {@code /static/a/b/file.js}.
     */
    public List<String> wildcards() {
        return wildcards;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof MatchResult)) {
            return false;
        }
        final MatchResult that = (MatchResult) o;
        return matched == that.matched &&
               path.equals(that.path) &&
               pattern.equals(that.pattern) &&
               variables.equals(that.variables) &&
               segments.equals(that.segments) &&
               wildcards.equals(that.wildcards);
    }

    @Override
    public int hashCode() {
        int hash = Boolean.hashCode(matched);
        hash = hash * 31 + path.hashCode();
        hash = hash * 31 + pattern.hashCode();
        hash = hash * 31 + variables.hashCode();
        hash = hash * 31 + segments.hashCode();
        return hash * 31 + wildcards.hashCode();
    }

    @Override
    public String toString() {
        final MoreObjects.ToStringHelper helper = MoreObjects.toStringHelper(this)
                                                             .add("matched", matched)
                                                             .add("path", path)
                                                             .add("pattern", pattern);
        if (matched) {
            helper.add("variables", variables)
                  .add("wildcards", wildcards);
        }
        return helper.toString();
    }
}
