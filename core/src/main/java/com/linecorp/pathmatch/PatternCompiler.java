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

import static com.linecorp.pathmatch.internal.PathUtil.PATH_SEPARATOR;
import static java.util.Objects.requireNonNull;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.google.common.annotations.VisibleForTesting;

import com.linecorp.pathmatch.internal.PathUtil;

/**
 * Compiles a path pattern string into a {@link CompiledPattern}. The supported syntax is:
 * <ul>
 *   <li>{@code /} - the separator, which must also be the first character</li>
 *   <li>{@code users} - a literal; <code>'{'</code>, <code>'}'</code>, {@code '*'} and {@code '\\'}
 *       must be escaped with a backslash (see {@link PathPatternParser#escape(String)})</li>
 *   <li>{@code *} - matches exactly one path component</li>
 *   <li>{@code **} - matches one or more path components</li>
 *   <li><code>{name}</code> - a variable</li>
 *   <li><code>{name:regex}</code> - a variable whose value must fully match {@code regex}</li>
 * </ul>
 *
 * <p>Compiled patterns are cached by their normalized source text, up to
 * {@link ParserConfiguration#cacheCapacity()} entries. This class is thread-safe.
 */
public final class PatternCompiler {

    private static final Logger logger = LoggerFactory.getLogger(PatternCompiler.class);

    private static final Pattern VARIABLE_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    // Each SegmentType gets 12 bits, which is enough for Flags.MAX_SEGMENTS_LIMIT segments.
    @VisibleForTesting
    static final long LITERAL_WEIGHT = 1L << 48;
    @VisibleForTesting
    static final long CONSTRAINED_VARIABLE_WEIGHT = 1L << 36;
    @VisibleForTesting
    static final long VARIABLE_WEIGHT = 1L << 24;
    @VisibleForTesting
    static final long WILDCARD_WEIGHT = 1L << 12;
    @VisibleForTesting
    static final long MULTI_WILDCARD_WEIGHT = 1L;

    private volatile ParserConfiguration config;

    // Keyed by the configuration as well, so that a compilation which raced with
    // configuration(ParserConfiguration) is never served under the new configuration.
    private final Cache<CacheKey, CompiledPattern> cache;

    /**
     * Creates a new instance with {@link ParserConfiguration#of()}.
     */
    public PatternCompiler() {
        this(ParserConfiguration.of());
    }

    /**
     * Creates a new instance with the specified {@link ParserConfiguration}.
     */
    public PatternCompiler(ParserConfiguration config) {
        this.config = requireNonNull(config, "config");
        cache = Caffeine.newBuilder()
                        .maximumSize(config.cacheCapacity())
                        .recordStats()
                        .build();
    }

    /**
     * Returns the current {@link ParserConfiguration}.
     */
    public ParserConfiguration configuration() {
        return config;
    }

    /**
     * Replaces the {@link ParserConfiguration} and invalidates the compiled pattern cache. Patterns
     * compiled before this call keep the properties they were compiled with.
     */
    public synchronized void configuration(ParserConfiguration config) {
        requireNonNull(config, "config");
        final ParserConfiguration oldConfig = this.config;
        this.config = config;
        if (oldConfig.cacheCapacity() != config.cacheCapacity()) {
            cache.policy().eviction().ifPresent(eviction -> eviction.setMaximum(config.cacheCapacity()));
        }
        invalidateCache();
        logger.debug("Configuration changed: {} -> {}", oldConfig, config);
    }

    /**
     * Removes all cached {@link CompiledPattern}s.
     */
    public void invalidateCache() {
        cache.invalidateAll();
    }

    Cache<?, ?> cache() {
        return cache;
    }

    /**
     * Compiles the specified path {@code pattern} with the current {@link ParserConfiguration}.
     * Leading and trailing whitespace is ignored.
     *
     * @throws InvalidPatternException if the {@code pattern} is malformed
     */
    public CompiledPattern compile(String pattern) {
        requireNonNull(pattern, "pattern");
        final ParserConfiguration config = this.config;
        final String normalized = pattern.trim();
        if (config.cacheCapacity() == 0) {
            return doCompile(normalized, config);
        }

        final CacheKey key = new CacheKey(normalized, config);
        final CompiledPattern cached = cache.getIfPresent(key);
        if (cached != null) {
            logger.trace("Compiled pattern cache hit: {}", normalized);
            return cached;
        }

        final CompiledPattern compiled = doCompile(normalized, config);
        // Keep the first one if another thread compiled the same pattern concurrently.
        final CompiledPattern existing = cache.asMap().putIfAbsent(key, compiled);
        return existing != null ? existing : compiled;
    }

    private static CompiledPattern doCompile(String pattern, ParserConfiguration config) {
        validate(pattern, config);

        final List<PathSegment> segments = new ArrayList<>();
        final Set<String> variableNames = new LinkedHashSet<>();
        boolean hasWildcard = false;
        int wildcardCount = 0;
        int multiWildcardCount = 0;
        long rank = 0;

        int start = 1;
        while (start < pattern.length()) {
            int end = pattern.indexOf(PATH_SEPARATOR, start);
            if (end < 0) {
                end = pattern.length();
            }
            final PathSegment segment = parseSegment(pattern, start, end, config);
            segments.add(segment);

            switch (segment.type()) {
                case LITERAL:
                    rank += LITERAL_WEIGHT;
                    break;
                case VARIABLE:
                    final VariableSegment variable = (VariableSegment) segment;
                    if (!variableNames.add(variable.name()) && config.strict()) {
                        throw new InvalidPatternException(
                                "duplicate variable name: " + variable.name(), pattern, start);
                    }
                    rank += variable.isConstrained() ? CONSTRAINED_VARIABLE_WEIGHT : VARIABLE_WEIGHT;
                    break;
                case WILDCARD:
                    hasWildcard = true;
                    wildcardCount++;
                    rank += WILDCARD_WEIGHT;
                    break;
                case MULTI_WILDCARD:
                    hasWildcard = true;
                    wildcardCount++;
                    multiWildcardCount++;
                    rank += MULTI_WILDCARD_WEIGHT;
                    break;
                default:
                    throw new Error("unexpected segment type: " + segment.type());
            }
            start = end + 1;
        }

        final CompiledPattern compiled = new CompiledPattern(
                pattern, segments, variableNames, hasWildcard, !variableNames.isEmpty(),
                wildcardCount, multiWildcardCount, config.caseInsensitive(),
                config.optionalTrailingSlash(), PathUtil.hasTrailingSlash(pattern), rank);
        logger.debug("Compiled a path pattern: {} (segments: {}, rank: {})",
                     pattern, segments.size(), rank);
        return compiled;
    }

    /**
     * Performs the structural checks which do not depend on how each segment is classified.
     */
    private static void validate(String pattern, ParserConfiguration config) {
        if (!PathUtil.isAbsolutePath(pattern)) {
            throw new InvalidPatternException("must start with '" + PATH_SEPARATOR + '\'', pattern, 0);
        }

        final int doubleSlash = pattern.indexOf("//");
        if (doubleSlash >= 0) {
            throw new InvalidPatternException("doubled separator", pattern, doubleSlash);
        }

        int openBrace = -1;
        int segmentCount = 0;
        for (int i = 0; i < pattern.length(); i++) {
            final char ch = pattern.charAt(i);
            switch (ch) {
                case '\\':
                    // A backslash before a separator escapes nothing.
                    if (i + 1 < pattern.length() && pattern.charAt(i + 1) != PATH_SEPARATOR) {
                        i++;
                    }
                    break;
                case '{':
                    if (openBrace >= 0) {
                        throw new InvalidPatternException("nested variable", pattern, i);
                    }
                    openBrace = i;
                    break;
                case '}':
                    if (openBrace < 0) {
                        throw new InvalidPatternException("unmatched closing brace", pattern, i);
                    }
                    openBrace = -1;
                    break;
                case PATH_SEPARATOR:
                    if (openBrace >= 0) {
                        throw new InvalidPatternException("unmatched opening brace", pattern, openBrace);
                    }
                    if (i + 1 < pattern.length()) {
                        segmentCount++;
                    }
                    break;
            }
        }
        if (openBrace >= 0) {
            throw new InvalidPatternException("unmatched opening brace", pattern, openBrace);
        }

        if (segmentCount > config.maxSegments()) {
            throw new InvalidPatternException(
                    "too many segments: " + segmentCount + " (expected: <= " + config.maxSegments() + ')',
                    pattern);
        }
    }

    /**
     * Classifies {@code pattern.substring(start, end)}.
     */
    private static PathSegment parseSegment(String pattern, int start, int end, ParserConfiguration config) {
        final String raw = pattern.substring(start, end);
        if ("**".equals(raw)) {
            return PathSegment.ofMultiWildcard();
        }
        if ("*".equals(raw)) {
            return PathSegment.ofWildcard();
        }

        final int openBrace = PathUtil.indexOfUnescaped(raw, '{');
        final int closeBrace = PathUtil.indexOfUnescaped(raw, '}');
        if (openBrace < 0 && closeBrace < 0) {
            return parseLiteral(pattern, start, raw, config);
        }
        if (openBrace != 0 || closeBrace != raw.length() - 1) {
            throw new InvalidPatternException("a variable must occupy a whole segment", pattern,
                                              start + Math.max(openBrace, 0));
        }
        return parseVariable(pattern, start, raw.substring(1, raw.length() - 1));
    }

    private static PathSegment parseLiteral(String pattern, int start, String raw,
                                            ParserConfiguration config) {
        if (config.strict()) {
            final int asterisk = PathUtil.indexOfUnescaped(raw, '*');
            if (asterisk >= 0) {
                throw new InvalidPatternException("unescaped '*' in a literal", pattern, start + asterisk);
            }
            if (PathUtil.hasDanglingEscape(raw)) {
                throw new InvalidPatternException("dangling escape character", pattern,
                                                  start + raw.length() - 1);
            }
        }
        return PathSegment.ofLiteral(PathUtil.unescape(raw));
    }

    private static PathSegment parseVariable(String pattern, int start, String content) {
        final int colon = content.indexOf(':');
        final String name = (colon < 0 ? content : content.substring(0, colon)).trim();
        if (name.isEmpty()) {
            throw new InvalidPatternException("empty variable name", pattern, start);
        }
        if (!VARIABLE_NAME.matcher(name).matches()) {
            throw new InvalidPatternException(
                    "invalid variable name: " + name + " (expected: " + VARIABLE_NAME.pattern() + ')',
                    pattern, start + 1);
        }
        if (colon < 0) {
            return PathSegment.ofVariable(name);
        }

        final String constraint = content.substring(colon + 1).trim();
        if (constraint.isEmpty()) {
            throw new InvalidPatternException("empty constraint for variable: " + name, pattern,
                                              start + colon + 2);
        }
        try {
            return PathSegment.ofVariable(name, Pattern.compile(constraint));
        } catch (PatternSyntaxException e) {
            throw new InvalidPatternException("invalid constraint for variable " + name + ": " + constraint,
                                              pattern, start + colon + 2, e);
        }
    }

    private static final class CacheKey {
        private final String pattern;
        private final ParserConfiguration config;

        CacheKey(String pattern, ParserConfiguration config) {
            this.pattern = pattern;
            this.config = config;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof CacheKey)) {
                return false;
            }
            final CacheKey that = (CacheKey) o;
            return pattern.equals(that.pattern) && config.equals(that.config);
        }

        @Override
        public int hashCode() {
            return pattern.hashCode() * 31 + config.hashCode();
        }

        @Override
        public String toString() {
            return pattern;
        }
    }
}
