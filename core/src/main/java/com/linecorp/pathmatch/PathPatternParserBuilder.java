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

import io.micrometer.core.instrument.MeterRegistry;

/**
 * Builds a new {@link PathPatternParser}.
 * <pre>{@code
 * PathPatternParser parser =
 *         PathPatternParser.builder()
 *                          .configuration(ParserConfiguration.builder()
 *                                                            .caseInsensitive(true)
 *                                                            .cacheCapacity(4096)
 *                                                            .build())
 *                          .meterRegistry(registry)
 *                          .build();
 * }</pre>
 */
public final class PathPatternParserBuilder {

    private ParserConfiguration config = ParserConfiguration.of();

    @Nullable
    private MeterRegistry meterRegistry;

    PathPatternParserBuilder() {}

    /**
     * Sets the {@link ParserConfiguration}. {@link ParserConfiguration#of()} is used by default.
     */
    public PathPatternParserBuilder configuration(ParserConfiguration config) {
        this.config = requireNonNull(config, "config");
        return this;
    }

    /**
     * Sets the {@link MeterRegistry} which collects the statistics of the compiled pattern cache
     * ({@code pathmatch.patterns}) and the match result cache ({@code pathmatch.matches}).
     * No metrics are collected by default.
     */
    public PathPatternParserBuilder meterRegistry(MeterRegistry meterRegistry) {
        this.meterRegistry = requireNonNull(meterRegistry, "meterRegistry");
        return this;
    }

    /**
     * Returns a newly-created {@link PathPatternParser} based on the properties set so far.
     */
    public PathPatternParser build() {
        return new PathPatternParser(config, meterRegistry);
    }
}
