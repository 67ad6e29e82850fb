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

import com.google.common.base.MoreObjects;

/**
 * The tunables shared by {@link PatternCompiler} and {@link PathMatcher}. An instance is immutable;
 * use {@link #toBuilder()} to derive a modified copy.
 *
 * @see Flags
 */
public final class ParserConfiguration {

    private static final ParserConfiguration DEFAULT = new ParserConfigurationBuilder().build();

    /**
     * Returns the default {@link ParserConfiguration}, whose properties are taken from {@link Flags}.
     */
    public static ParserConfiguration of() {
        return DEFAULT;
    }

    /**
     * Returns a new {@link ParserConfigurationBuilder} initialized with the defaults from {@link Flags}.
     */
    public static ParserConfigurationBuilder builder() {
        return new ParserConfigurationBuilder();
    }

    private final boolean caseInsensitive;
    private final boolean optionalTrailingSlash;
    private final boolean strict;
    private final int maxSegments;
    private final int cacheCapacity;

    ParserConfiguration(boolean caseInsensitive, boolean optionalTrailingSlash, boolean strict,
                        int maxSegments, int cacheCapacity) {
        this.caseInsensitive = caseInsensitive;
        this.optionalTrailingSlash = optionalTrailingSlash;
        this.strict = strict;
        this.maxSegments = maxSegments;
        this.cacheCapacity = cacheCapacity;
    }

    /**
     * Returns whether literal segments are compared ignoring case. Variable constraints are not
     * affected.
     */
    public boolean caseInsensitive() {
        return caseInsensitive;
    }

    /**
     * Returns whether a single trailing slash in a path or a pattern is ignored. When {@code false},
     * a path and a pattern must agree on the presence of a trailing slash.
     */
    public boolean optionalTrailingSlash() {
        return optionalTrailingSlash;
    }

    /**
     * Returns whether path patterns are validated strictly. A strict {@link PatternCompiler} also
     * rejects a literal containing an unescaped {@code '*'}, a literal ending with a backslash that
     * escapes nothing, and a variable name that appears more than once.
     */
    public boolean strict() {
        return strict;
    }

    /**
     * Returns the maximum number of segments a path pattern may have.
     */
    public int maxSegments() {
        return maxSegments;
    }

    /**
     * Returns the maximum number of entries in each of the compiled pattern cache and the match
     * result cache. {@code 0} means caching is disabled.
     */
    public int cacheCapacity() {
        return cacheCapacity;
    }

    /**
     * Returns a new {@link ParserConfigurationBuilder} initialized with the properties of this
     * configuration.
     */
    public ParserConfigurationBuilder toBuilder() {
        return new ParserConfigurationBuilder()
                .caseInsensitive(caseInsensitive)
                .optionalTrailingSlash(optionalTrailingSlash)
                .strict(strict)
                .maxSegments(maxSegments)
                .cacheCapacity(cacheCapacity);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ParserConfiguration)) {
            return false;
        }
        final ParserConfiguration that = (ParserConfiguration) o;
        return caseInsensitive == that.caseInsensitive &&
               optionalTrailingSlash == that.optionalTrailingSlash &&
               strict == that.strict &&
               maxSegments == that.maxSegments &&
               cacheCapacity == that.cacheCapacity;
    }

    @Override
    public int hashCode() {
        int hash = Boolean.hashCode(caseInsensitive);
        hash = hash * 31 + Boolean.hashCode(optionalTrailingSlash);
        hash = hash * 31 + Boolean.hashCode(strict);
        hash = hash * 31 + maxSegments;
        return hash * 31 + cacheCapacity;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .add("caseInsensitive", caseInsensitive)
                          .add("optionalTrailingSlash", optionalTrailingSlash)
                          .add("strict", strict)
                          .add("maxSegments", maxSegments)
                          .add("cacheCapacity", cacheCapacity)
                          .toString();
    }
}
