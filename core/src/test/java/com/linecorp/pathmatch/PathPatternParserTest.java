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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.Test;

import com.google.common.collect.ImmutableList;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

public class PathPatternParserTest {

    private static PathPatternParser newParser() {
        return PathPatternParser.of(ParserConfiguration.builder()
                                                       .caseInsensitive(false)
                                                       .optionalTrailingSlash(false)
                                                       .strict(false)
                                                       .cacheCapacity(100)
                                                       .build());
    }

    @Test
    public void compileAndMatch() {
        final PathPatternParser parser = newParser();
        final CompiledPattern pattern = parser.compile("/api/users/{id}/posts/{postId}");
        final MatchResult result = parser.match("/api/users/42/posts/7", pattern);
        assertThat(result.isMatched()).isTrue();
        assertThat(result.variable("id")).isEqualTo("42");
        assertThat(result.variable("postId")).isEqualTo("7");
    }

    @Test
    public void matchBest() {
        final PathPatternParser parser = newParser();
        final List<CompiledPattern> routes = ImmutableList.of(parser.compile("/users/{id}"),
                                                              parser.compile("/users/me"));
        assertThat(parser.matchBest("/users/me", routes).pattern()).isEqualTo("/users/me");
        assertThat(parser.matchBest("/users/1", routes).pattern()).isEqualTo("/users/{id}");
        assertThat(parser.matchBest("/groups/1", routes).isMatched()).isFalse();
    }

    @Test
    public void matches() {
        final PathPatternParser parser = newParser();
        assertThat(parser.matches("/users/42", "/users/{id}")).isTrue();
        assertThat(parser.matches("/users", "/users/{id}")).isFalse();
        assertThat(parser.matches("/users/42", "/users/{id")).isFalse();
        assertThat(parser.matches("/users/42", "users/{id}")).isFalse();
        assertThatThrownBy(() -> parser.matches(null, "/users")).isInstanceOf(NullPointerException.class);
    }

    @Test
    public void extractVariables() {
        final PathPatternParser parser = newParser();
        assertThat(parser.extractVariables("/api/users/{userId}/posts/{postId:[0-9]+}"))
                .containsExactly("userId", "postId");
        assertThat(parser.extractVariables("/api/users")).isEmpty();
        assertThat(parser.extractVariables("/api/users/{userId")).isEmpty();
    }

    @Test
    public void escape() {
        assertThat(PathPatternParser.escape("users")).isEqualTo("users");
        assertThat(PathPatternParser.escape("user{id}")).isEqualTo("user\\{id\\}");
        assertThat(PathPatternParser.escape("path*")).isEqualTo("path\\*");

        final PathPatternParser parser = newParser();
        final String pattern = "/files/" + PathPatternParser.escape("{draft}*");
        assertThat(parser.matches("/files/{draft}*", pattern)).isTrue();
        assertThat(parser.matches("/files/anything", pattern)).isFalse();
    }

    @Test
    public void caseInsensitiveShortcut() {
        final PathPatternParser parser = newParser();
        final CompiledPattern before = parser.compile("/Users/{id}");
        assertThat(parser.matches("/users/1", "/Users/{id}")).isFalse();

        assertThat(parser.caseInsensitive(true)).isSameAs(parser);
        assertThat(parser.configuration().caseInsensitive()).isTrue();
        assertThat(parser.matches("/users/1", "/Users/{id}")).isTrue();
        assertThat(parser.compile("/Users/{id}")).isNotSameAs(before);

        // A pattern compiled earlier keeps its properties.
        assertThat(parser.match("/users/1", before).isMatched()).isFalse();

        parser.caseInsensitive(false);
        assertThat(parser.matches("/users/1", "/Users/{id}")).isFalse();
    }

    @Test
    public void optionalTrailingSlashShortcut() {
        final PathPatternParser parser = newParser();
        assertThat(parser.matches("/users/", "/users")).isFalse();
        parser.optionalTrailingSlash(true);
        assertThat(parser.configuration().optionalTrailingSlash()).isTrue();
        assertThat(parser.matches("/users/", "/users")).isTrue();
        assertThat(parser.matches("/users", "/users/")).isTrue();
    }

    @Test
    public void strictShortcut() {
        final PathPatternParser parser = newParser();
        assertThat(parser.compile("/files/file*.js").isStatic()).isTrue();

        parser.strict(true);
        assertThat(parser.configuration().strict()).isTrue();
        assertThatThrownBy(() -> parser.compile("/files/file*.js"))
                .isInstanceOf(InvalidPatternException.class);
        assertThat(parser.matches("/files/file*.js", "/files/file*.js")).isFalse();
        assertThat(parser.extractVariables("/a/{id}/b/{id}")).isEmpty();

        parser.strict(false);
        assertThat(parser.extractVariables("/a/{id}/b/{id}")).containsExactly("id");
    }

    @Test
    public void configurationReplacement() {
        final PathPatternParser parser = newParser();
        final ParserConfiguration config = ParserConfiguration.builder()
                                                              .caseInsensitive(true)
                                                              .optionalTrailingSlash(true)
                                                              .strict(true)
                                                              .maxSegments(2)
                                                              .cacheCapacity(0)
                                                              .build();
        parser.configuration(config);
        assertThat(parser.configuration()).isSameAs(config);
        assertThat(parser.matches("/A/B/", "/a/b")).isTrue();
        assertThatThrownBy(() -> parser.compile("/a/b/c")).isInstanceOf(InvalidPatternException.class);
        assertThat(parser.compile("/a/b")).isNotSameAs(parser.compile("/a/b"));
        assertThat(parser.toString()).contains("configuration");
    }

    @Test
    public void collectsCacheMetrics() {
        final MeterRegistry registry = new SimpleMeterRegistry();
        final PathPatternParser parser =
                PathPatternParser.builder()
                                 .configuration(ParserConfiguration.builder().cacheCapacity(100).build())
                                 .meterRegistry(registry)
                                 .build();

        final CompiledPattern pattern = parser.compile("/users/{id}");
        assertThat(parser.compile("/users/{id}")).isSameAs(pattern);
        parser.match("/users/1", pattern);
        parser.match("/users/1", pattern);
        parser.match("/users/2", pattern);

        assertThat(gets(registry, PathPatternParser.PATTERN_CACHE_NAME, "hit")).isEqualTo(1.0);
        assertThat(gets(registry, PathPatternParser.PATTERN_CACHE_NAME, "miss")).isEqualTo(1.0);
        assertThat(gets(registry, PathPatternParser.MATCH_CACHE_NAME, "hit")).isEqualTo(1.0);
        assertThat(gets(registry, PathPatternParser.MATCH_CACHE_NAME, "miss")).isEqualTo(2.0);
    }

    private static double gets(MeterRegistry registry, String cacheName, String result) {
        return registry.get("cache.gets")
                       .tag("cache", cacheName)
                       .tag("result", result)
                       .functionCounter()
                       .count();
    }

    @Test
    public void concurrentCompileAndMatch() throws Exception {
        final PathPatternParser parser = newParser();
        final List<String> patterns = ImmutableList.of("/", "/users", "/users/me", "/users/{id}",
                                                       "/users/{id}/posts/{postId}", "/static/**",
                                                       "/static/**/index.html");
        final ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            final List<Callable<Void>> tasks = new ArrayList<>();
            for (int i = 0; i < 64; i++) {
                final int seed = i;
                tasks.add(() -> {
                    for (int j = 0; j < 200; j++) {
                        final List<CompiledPattern> routes = new ArrayList<>();
                        for (String pattern : patterns) {
                            routes.add(parser.compile(pattern));
                        }
                        final String id = String.valueOf(seed * 1000 + j);
                        final MatchResult post = parser.matchBest("/users/" + id + "/posts/" + j, routes);
                        assertThat(post.pattern()).isEqualTo("/users/{id}/posts/{postId}");
                        assertThat(post.variable("id")).isEqualTo(id);
                        assertThat(parser.matchBest("/users/me", routes).pattern()).isEqualTo("/users/me");
                        assertThat(parser.matchBest("/static/" + id + "/index.html", routes).wildcards())
                                .containsExactly(id);
                    }
                    return null;
                });
            }
            for (Future<Void> future : executor.invokeAll(tasks)) {
                future.get();
            }
        } finally {
            executor.shutdown();
            assertThat(executor.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
        }
    }

    @Test
    public void concurrentConfigurationChanges() throws Exception {
        final PathPatternParser parser = newParser();
        final ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            final Future<?> toggler = executor.submit(() -> {
                for (int i = 0; i < 500; i++) {
                    parser.caseInsensitive(i % 2 == 0);
                }
            });
            final List<Future<?>> readers = new ArrayList<>();
            for (int i = 0; i < 3; i++) {
                readers.add(executor.submit(() -> {
                    for (int j = 0; j < 2000; j++) {
                        final CompiledPattern pattern = parser.compile("/Users/{id}");
                        // Whatever configuration the pattern was compiled with decides the result.
                        final boolean matched = parser.match("/users/" + j, pattern).isMatched();
                        assertThat(matched).isEqualTo(pattern.caseInsensitive());
                        assertThat(parser.match("/Users/" + j, pattern).isMatched()).isTrue();
                    }
                }));
            }
            toggler.get();
            for (Future<?> reader : readers) {
                reader.get();
            }
        } finally {
            executor.shutdown();
            assertThat(executor.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
        }
        parser.caseInsensitive(false);
        assertThat(parser.compile("/Users/{id}").caseInsensitive()).isFalse();
    }
}
