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

import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import javax.annotation.Nullable;

import com.google.common.collect.ImmutableList;

/**
 * Builds a new successful {@link MatchResult}.
 */
public final class MatchResultBuilder {

    @Nullable
    private String path;

    @Nullable
    private String pattern;

    // A later binding of the same name replaces an earlier one.
    private final Map<String, String> variables = new LinkedHashMap<>();

    private List<String> segments = ImmutableList.of();

    private final ImmutableList.Builder<String> wildcards = ImmutableList.builder();

    MatchResultBuilder() {}

    /**
     * Sets the matched path.
     */
    public MatchResultBuilder path(String path) {
        this.path = requireNonNull(path, "path");
        return this;
    }

    /**
     * Sets the source text of the matched pattern.
     */
    public MatchResultBuilder pattern(String pattern) {
        this.pattern = requireNonNull(pattern, "pattern");
        return this;
    }

    /**
     * Binds a variable.
     */
    public MatchResultBuilder variable(String name, String value) {
        variables.put(requireNonNull(name, "name"), requireNonNull(value, "value"));
        return this;
    }

    /**
     * Binds all specified variables.
     */
    public MatchResultBuilder variables(Map<String, String> variables) {
        requireNonNull(variables, "variables").forEach(this::variable);
        return this;
    }

    /**
     * Sets the components of the matched path.
     */
    public MatchResultBuilder segments(List<String> segments) {
        this.segments = ImmutableList.copyOf(requireNonNull(segments, "segments"));
        return this;
    }

    /**
     * Adds the text captured by the next wildcard of the pattern.
     */
    public MatchResultBuilder wildcard(String captured) {
        wildcards.add(requireNonNull(captured, "captured"));
        return this;
    }

    /**
     * Returns a newly-created successful {@link MatchResult}.
     *
     * @throws IllegalStateException if {@link #path(String)} or {@link #pattern(String)} was not set
     */
    public MatchResult build() {
        checkState(path != null, "path not set");
        checkState(pattern != null, "pattern not set");
        return new MatchResult(true, path, pattern, variables, segments, wildcards.build());
    }
}
