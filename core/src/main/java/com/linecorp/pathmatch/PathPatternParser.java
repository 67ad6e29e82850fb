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

import java.util.Set;

import javax.annotation.Nullable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableSet;

import com.linecorp.pathmatch.internal.PathUtil;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.cache.CaffeineCacheMetrics;

/**
 * The entry point which combines a {@link PatternCompiler} and a {@link PathMatcher} sharing one
 * {@link ParserConfiguration}.
 * <pre>{@code
 * PathPatternParser parser = PathPatternParser.of();
 * CompiledPattern pattern = parser.compile("/api/users/{id}/posts/{postId}");
 * MatchResult result = parser.match("/api/users/42/posts/7", pattern);
 * assert result.isMatched();
 * assert "42".equals(result.variable("id"));
 * }</pre>
 *
 * <p>All methods are safe to call from multiple threads. Changing the configuration with
 * {@link #configuration(ParserConfiguration)} or one of its shortcuts invalidates both caches;
 * patterns compiled earlier keep the configuration they were compiled with.
 */
public final class PathPatternParser {

    private static final Logger logger = LoggerFactory.getLogger(PathPatternParser.class);

    static final String PATTERN_CACHE_NAME = "pathmatch.patterns";
    static final String MATCH_CACHE_NAME = "pathmatch.matches";

    /**
     * Returns a new {@link PathPatternParser} with {@link ParserConfiguration#of()}.
     */
    public static PathPatternParser of() {
        return builder().build();
    }

    /**
     * Returns a new {@link PathPatternParser} with the specified {@link ParserConfiguration}.
     */
    public static PathPatternParser of(ParserConfiguration config) {
        return builder().configuration(config).build();
    }

    /**
     * Returns a new {@link PathPatternParserBuilder}.
     */
    public static PathPatternParserBuilder builder() {
        return new PathPatternParserBuilder();
    }

    /**
     * Escapes the characters that have a special meaning in a path pattern, i.e. {@code '\\'},
     * <code>'{'</code>, <code>'}'</code> and {@code '*'}, so that the specified {@code text} is
     * compiled as a literal.
     */
    public static String escape(String text) {
        return PathUtil.escape(text);
    }

    private final PatternCompiler compiler;
    private final PathMatcher matcher;

    PathPatternParser(ParserConfiguration config, @Nullable MeterRegistry meterRegistry) {
        compiler = new PatternCompiler(config);
        matcher = new PathMatcher(config.cacheCapacity());
        if (meterRegistry != null) {
            CaffeineCacheMetrics.monitor(meterRegistry, compiler.cache(), PATTERN_CACHE_NAME);
            CaffeineCacheMetrics.monitor(meterRegistry, matcher.cache(), MATCH_CACHE_NAME);
        }
    }

    /**
     * Compiles the specified path {@code pattern}.
     *
     * @throws InvalidPatternException if the {@code pattern} is malformed
     */
    public CompiledPattern compile(String pattern) {
        return compiler.compile(pattern);
    }

    /**
     * Matches the specified {@code path} against the specified {@code pattern}.
     *
     * @see PathMatcher#match(String, CompiledPattern)
     */
    public MatchResult match(String path, CompiledPattern pattern) {
        return matcher.match(path, pattern);
    }

    /**
     * Returns the {@link MatchResult} of the most specific candidate which matches the specified
     * {@code path}.
     *
     * @see PathMatcher#matchBest(String, Iterable)
     */
    public MatchResult matchBest(String path, Iterable<CompiledPattern> candidates) {
        return matcher.matchBest(path, candidates);
    }

    /**
     * Compiles the specified {@code pattern} and returns whether the specified {@code path} matches it.
     *
     * @return {@code false} if the {@code pattern} is malformed or does not match the {@code path}
     */
    public boolean matches(String path, String pattern) {
        requireNonNull(path, "path");
        final CompiledPattern compiled;
        try {
            compiled = compile(pattern);
        } catch (InvalidPatternException e) {
            logger.debug("Treating an invalid pattern as a mismatch: {}", e.getMessage());
            return false;
        }
        return match(path, compiled).isMatched();
    }

    /**
     * Returns the names of the variables declared in the specified {@code pattern}.
     *
     * @return the variable names in the order of appearance, or an empty {@link Set} if the
     *         {@code pattern} is malformed
     */
    public Set<String> extractVariables(String pattern) {
        try {
            return compile(pattern).variableNames();
        } catch (InvalidPatternException e) {
            logger.debug("No variables for an invalid pattern: {}", e.getMessage());
            return ImmutableSet.of();
        }
    }

    /**
     * Returns the current {@link ParserConfiguration}.
     */
    public ParserConfiguration configuration() {
        return compiler.configuration();
    }

    /**
     * Replaces the {@link ParserConfiguration} and invalidates the compiled pattern and match result
     * caches.
     */
    public synchronized PathPatternParser configuration(ParserConfiguration config) {
        requireNonNull(config, "config");
        compiler.configuration(config);
        matcher.cacheCapacity(config.cacheCapacity());
        return this;
    }

    /**
     * Sets whether literal segments are compared ignoring case, invalidating the caches.
     */
    public synchronized PathPatternParser caseInsensitive(boolean caseInsensitive) {
        return configuration(configuration().toBuilder().caseInsensitive(caseInsensitive).build());
    }

    /**
     * Sets whether a single trailing slash is ignored, invalidating the caches.
     */
    public synchronized PathPatternParser optionalTrailingSlash(boolean optionalTrailingSlash) {
        return configuration(configuration().toBuilder()
                                            .optionalTrailingSlash(optionalTrailingSlash)
                                            .build());
    }

    /**
     * Sets whether path patterns are validated strictly, invalidating the caches.
     */
    public synchronized PathPatternParser strict(boolean strict) {
        return configuration(configuration().toBuilder().strict(strict).build());
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .add("configuration", configuration())
                          .toString();
    }
}
