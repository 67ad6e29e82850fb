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

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

import javax.annotation.Nullable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.google.common.collect.ImmutableList;

import com.linecorp.pathmatch.internal.PathUtil;

/**
 * Matches paths against {@link CompiledPattern}s.
 *
 * <p>A pattern is matched segment by segment. A {@code **} in the middle of a pattern is matched by
 * trying each possible split point from left to right and matching the rest of the pattern against
 * the rest of the path recursively; the first split point for which the whole path is consumed wins.
 * The depth of the recursion is bounded by the number of {@code **} segments of the pattern, and a
 * remainder of the pattern that failed to match a remainder of the path is never tried again, so a
 * match takes at most {@code O(segments * components^2)} steps.
 *
 * <p>Results of {@link #match(String, CompiledPattern)} are cached by path and pattern, up to the
 * capacity specified when this matcher was created. This class is thread-safe.
 */
public final class PathMatcher {

    private static final Logger logger = LoggerFactory.getLogger(PathMatcher.class);

    /**
     * The order in which {@link #matchBest(String, Iterable)} tries candidates:
     * <ol>
     *   <li>static patterns first,</li>
     *   <li>then fewer {@code **} segments,</li>
     *   <li>then higher {@link CompiledPattern#specificityRank()},</li>
     *   <li>then the {@link CompiledPattern#sourceText()} in lexicographical order, so that the order
     *       never depends on the order of the candidates.</li>
     * </ol>
     */
    public static final Comparator<CompiledPattern> SPECIFICITY_ORDER =
            Comparator.comparing((CompiledPattern p) -> !p.isStatic())
                      .thenComparingInt(CompiledPattern::multiWildcardCount)
                      .thenComparing(Comparator.comparingLong(CompiledPattern::specificityRank).reversed())
                      .thenComparing(CompiledPattern::sourceText)
                      .thenComparing(CompiledPattern::caseInsensitive)
                      .thenComparing(CompiledPattern::optionalTrailingSlash);

    private final Cache<MatchKey, MatchResult> cache;

    private volatile int cacheCapacity;

    /**
     * Creates a new instance whose cache capacity is {@link ParserConfiguration#cacheCapacity()} of
     * {@link ParserConfiguration#of()}.
     */
    public PathMatcher() {
        this(ParserConfiguration.of().cacheCapacity());
    }

    /**
     * Creates a new instance which caches up to {@code cacheCapacity} results. {@code 0} disables
     * caching.
     */
    public PathMatcher(int cacheCapacity) {
        checkArgument(cacheCapacity >= 0, "cacheCapacity: %s (expected: >= 0)", cacheCapacity);
        this.cacheCapacity = cacheCapacity;
        cache = Caffeine.newBuilder()
                        .maximumSize(cacheCapacity)
                        .recordStats()
                        .build();
    }

    /**
     * Changes the capacity of the match result cache and invalidates it.
     */
    public synchronized void cacheCapacity(int cacheCapacity) {
        checkArgument(cacheCapacity >= 0, "cacheCapacity: %s (expected: >= 0)", cacheCapacity);
        if (this.cacheCapacity != cacheCapacity) {
            this.cacheCapacity = cacheCapacity;
            cache.policy().eviction().ifPresent(eviction -> eviction.setMaximum(cacheCapacity));
        }
        invalidateCache();
    }

    /**
     * Removes all cached {@link MatchResult}s.
     */
    public void invalidateCache() {
        cache.invalidateAll();
    }

    Cache<?, ?> cache() {
        return cache;
    }

    /**
     * Matches the specified {@code path} against the specified {@code pattern}. This method never
     * throws an exception for a malformed or non-matching {@code path}; it returns a
     * {@link MatchResult} whose {@link MatchResult#isMatched()} is {@code false} instead.
     */
    public MatchResult match(String path, CompiledPattern pattern) {
        requireNonNull(path, "path");
        requireNonNull(pattern, "pattern");
        if (cacheCapacity == 0) {
            return doMatch(path, pattern);
        }

        final MatchKey key = new MatchKey(path, pattern);
        final MatchResult cached = cache.getIfPresent(key);
        if (cached != null) {
            return cached;
        }
        final MatchResult result = doMatch(path, pattern);
        cache.put(key, result);
        return result;
    }

    /**
     * Matches the specified {@code path} against the specified {@code candidates} in
     * {@link #SPECIFICITY_ORDER} and returns the first successful {@link MatchResult}. The candidates
     * which were tried are not stored in the match result cache.
     *
     * @return the {@link MatchResult} of the most specific matching candidate, or
     *         {@link MatchResult#noMatch(String, String)} with an empty pattern if none matched.
     */
    public MatchResult matchBest(String path, Iterable<CompiledPattern> candidates) {
        requireNonNull(path, "path");
        requireNonNull(candidates, "candidates");

        final List<CompiledPattern> sorted = new ArrayList<>();
        for (CompiledPattern candidate : candidates) {
            sorted.add(requireNonNull(candidate, "candidates contains null."));
        }
        sorted.sort(SPECIFICITY_ORDER);

        for (CompiledPattern candidate : sorted) {
            if (candidate.isStatic() && isExactMatch(path, candidate)) {
                logger.trace("Best match for {}: {} (exact)", path, candidate);
                return exactMatch(path, candidate);
            }
            final MatchResult result = doMatch(path, candidate);
            if (result.isMatched()) {
                logger.trace("Best match for {}: {}", path, candidate);
                return result;
            }
        }
        return MatchResult.noMatch(path, "");
    }

    /**
     * Returns whether the {@code path} equals the source text of the static {@code pattern}, which
     * makes the segment walk unnecessary.
     */
    private static boolean isExactMatch(String path, CompiledPattern pattern) {
        return !pattern.caseInsensitive() &&
               pattern.sourceText().indexOf('\\') < 0 &&
               path.equals(pattern.sourceText());
    }

    private static MatchResult exactMatch(String path, CompiledPattern pattern) {
        final List<String> components = PathUtil.splitPath(path);
        assert components != null;
        return MatchResult.builder()
                          .path(path)
                          .pattern(pattern.sourceText())
                          .segments(components)
                          .build();
    }

    private static MatchResult doMatch(String path, CompiledPattern pattern) {
        if (!pattern.optionalTrailingSlash() &&
            PathUtil.hasTrailingSlash(path) != pattern.hasTrailingSlash()) {
            return MatchResult.noMatch(path, pattern.sourceText());
        }

        // splitPath() drops one trailing slash, which is all the optional trailing slash policy needs.
        final List<String> components = PathUtil.splitPath(path);
        if (components == null) {
            return MatchResult.noMatch(path, pattern.sourceText());
        }

        final MatchState state = new MatchState(pattern, components);
        if (!matchSegments(pattern.segments(), 0, components, 0, state)) {
            return MatchResult.noMatch(path, pattern.sourceText());
        }

        final MatchResultBuilder builder = MatchResult.builder()
                                                      .path(path)
                                                      .pattern(pattern.sourceText())
                                                      .segments(components);
        state.copyTo(builder);
        return builder.build();
    }

    /**
     * Matches {@code segments[segmentIndex..]} against {@code components[componentIndex..]}.
     *
     * @return {@code true} if and only if both were consumed completely
     */
    private static boolean matchSegments(List<PathSegment> segments, int segmentIndex,
                                         List<String> components, int componentIndex, MatchState state) {
        int s = segmentIndex;
        int c = componentIndex;
        while (s < segments.size()) {
            final PathSegment segment = segments.get(s);
            switch (segment.type()) {
                case LITERAL:
                case VARIABLE: {
                    if (c >= components.size()) {
                        return false;
                    }
                    final String component = components.get(c);
                    if (!segment.matches(component, state.caseInsensitive)) {
                        return false;
                    }
                    state.bind(segment.extractVariables(component));
                    break;
                }
                case WILDCARD:
                    if (c >= components.size()) {
                        return false;
                    }
                    state.capture(c, c + 1);
                    break;
                case MULTI_WILDCARD:
                    if (s == segments.size() - 1) {
                        // A trailing '**' needs at least one component.
                        if (c >= components.size()) {
                            return false;
                        }
                        state.capture(c, components.size());
                        return true;
                    }
                    return matchMultiWildcard(segments, s, components, c, state);
                default:
                    throw new Error("unexpected segment type: " + segment.type());
            }
            s++;
            c++;
        }
        return c == components.size();
    }

    /**
     * Matches the {@code **} at {@code segments[segmentIndex]}, which is followed by at least one more
     * segment, by backtracking over the number of components it consumes.
     */
    private static boolean matchMultiWildcard(List<PathSegment> segments, int segmentIndex,
                                              List<String> components, int componentIndex,
                                              MatchState state) {
        // Every remaining segment, including another '**', needs at least one component.
        final int minRemaining = segments.size() - segmentIndex - 1;
        final int lastSplit = components.size() - minRemaining;
        final int boundVariables = state.boundVariables();
        final int capturedWildcards = state.capturedWildcards();

        for (int split = componentIndex + 1; split <= lastSplit; split++) {
            if (state.hasFailed(segmentIndex + 1, split)) {
                continue;
            }
            state.capture(componentIndex, split);
            if (matchSegments(segments, segmentIndex + 1, components, split, state)) {
                return true;
            }
            state.rollback(boundVariables, capturedWildcards);
            // Whether a remainder matches never depends on the bindings made before it.
            state.markFailed(segmentIndex + 1, split);
        }
        return false;
    }

    /**
     * The bindings accumulated while walking a pattern. The lists can be truncated to undo the
     * bindings of a failed split point. Wildcard captures are kept as component ranges and joined
     * only once the whole pattern has matched.
     */
    private static final class MatchState {
        final boolean caseInsensitive;
        private final List<String> components;
        private final int stride;
        private final List<String> variableNames = new ArrayList<>();
        private final List<String> variableValues = new ArrayList<>();
        // Two entries per capture: the first component and the end (exclusive).
        private final List<Integer> wildcardBounds = new ArrayList<>();

        // (segmentIndex, componentIndex) pairs whose remainders are known not to match.
        @Nullable
        private BitSet failed;

        MatchState(CompiledPattern pattern, List<String> components) {
            caseInsensitive = pattern.caseInsensitive();
            this.components = components;
            stride = components.size() + 1;
        }

        void bind(Map<String, String> variables) {
            variables.forEach((name, value) -> {
                variableNames.add(name);
                variableValues.add(value);
            });
        }

        void capture(int from, int to) {
            wildcardBounds.add(from);
            wildcardBounds.add(to);
        }

        int boundVariables() {
            return variableNames.size();
        }

        int capturedWildcards() {
            return wildcardBounds.size();
        }

        void rollback(int boundVariables, int capturedWildcards) {
            truncate(variableNames, boundVariables);
            truncate(variableValues, boundVariables);
            truncate(wildcardBounds, capturedWildcards);
        }

        boolean hasFailed(int segmentIndex, int componentIndex) {
            return failed != null && failed.get(segmentIndex * stride + componentIndex);
        }

        void markFailed(int segmentIndex, int componentIndex) {
            if (failed == null) {
                failed = new BitSet();
            }
            failed.set(segmentIndex * stride + componentIndex);
        }

        void copyTo(MatchResultBuilder builder) {
            for (int i = 0; i < variableNames.size(); i++) {
                builder.variable(variableNames.get(i), variableValues.get(i));
            }
            for (int i = 0; i < wildcardBounds.size(); i += 2) {
                final int from = wildcardBounds.get(i);
                final int to = wildcardBounds.get(i + 1);
                builder.wildcard(PathUtil.join(components, from, to));
            }
        }

        private static <T> void truncate(List<T> list, int size) {
            list.subList(size, list.size()).clear();
        }
    }

    private static final class MatchKey {
        private final String path;
        private final CompiledPattern pattern;

        MatchKey(String path, CompiledPattern pattern) {
            this.path = path;
            this.pattern = pattern;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof MatchKey)) {
                return false;
            }
            final MatchKey that = (MatchKey) o;
            return path.equals(that.path) && pattern.equals(that.pattern);
        }

        @Override
        public int hashCode() {
            return path.hashCode() * 31 + pattern.hashCode();
        }

        @Override
        public String toString() {
            return ImmutableList.of(path, pattern.sourceText()).toString();
        }
    }
}
