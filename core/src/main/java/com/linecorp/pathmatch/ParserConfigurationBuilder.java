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
import static com.linecorp.pathmatch.Flags.MAX_SEGMENTS_LIMIT;

/**
 * Builds a new {@link ParserConfiguration}.
 */
public final class ParserConfigurationBuilder {

    private boolean caseInsensitive = Flags.caseInsensitive();
    private boolean optionalTrailingSlash = Flags.optionalTrailingSlash();
    private boolean strict = Flags.strict();
    private int maxSegments = Flags.maxSegments();
    private int cacheCapacity = Flags.cacheCapacity();

    ParserConfigurationBuilder() {}

    /**
     * Sets whether literal segments are compared ignoring case.
     */
    public ParserConfigurationBuilder caseInsensitive(boolean caseInsensitive) {
        this.caseInsensitive = caseInsensitive;
        return this;
    }

    /**
     * Sets whether a single trailing slash in a path or a pattern is ignored.
     */
    public ParserConfigurationBuilder optionalTrailingSlash(boolean optionalTrailingSlash) {
        this.optionalTrailingSlash = optionalTrailingSlash;
        return this;
    }

    /**
     * Sets whether path patterns are validated strictly.
     *
     * @see ParserConfiguration#strict()
     */
    public ParserConfigurationBuilder strict(boolean strict) {
        this.strict = strict;
        return this;
    }

    /**
     * Sets the maximum number of segments a path pattern may have.
     */
    public ParserConfigurationBuilder maxSegments(int maxSegments) {
        checkArgument(maxSegments > 0 && maxSegments <= MAX_SEGMENTS_LIMIT,
                      "maxSegments: %s (expected: 1-%s)", maxSegments, MAX_SEGMENTS_LIMIT);
        this.maxSegments = maxSegments;
        return this;
    }

    /**
     * Sets the maximum number of entries in each cache. {@code 0} disables caching.
     */
    public ParserConfigurationBuilder cacheCapacity(int cacheCapacity) {
        checkArgument(cacheCapacity >= 0, "cacheCapacity: %s (expected: >= 0)", cacheCapacity);
        this.cacheCapacity = cacheCapacity;
        return this;
    }

    /**
     * Returns a newly-created {@link ParserConfiguration} based on the properties set so far.
     */
    public ParserConfiguration build() {
        return new ParserConfiguration(caseInsensitive, optionalTrailingSlash, strict,
                                       maxSegments, cacheCapacity);
    }
}
