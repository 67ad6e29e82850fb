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
import static org.assertj.core.api.Assertions.catchThrowableOfType;

import java.util.regex.PatternSyntaxException;

import org.junit.Test;

public class PatternCompilerTest {

    private static PatternCompiler compiler() {
        return new PatternCompiler(config().build());
    }

    private static ParserConfigurationBuilder config() {
        return ParserConfiguration.builder()
                                  .caseInsensitive(false)
                                  .optionalTrailingSlash(false)
                                  .strict(false)
                                  .maxSegments(256)
                                  .cacheCapacity(100);
    }

    private static InvalidPatternException reject(PatternCompiler compiler, String pattern) {
        final InvalidPatternException cause =
                catchThrowableOfType(() -> compiler.compile(pattern), InvalidPatternException.class);
        assertThat(cause).as("pattern %s must be rejected", pattern).isNotNull();
        assertThat(cause.pattern()).isEqualTo(pattern);
        assertThat(cause.getMessage()).startsWith("pattern: " + pattern + " (");
        return cause;
    }

    @Test
    public void staticPattern() {
        final CompiledPattern pattern = compiler().compile("/api/health");
        assertThat(pattern.sourceText()).isEqualTo("/api/health");
        assertThat(pattern.isStatic()).isTrue();
        assertThat(pattern.hasWildcard()).isFalse();
        assertThat(pattern.hasVariables()).isFalse();
        assertThat(pattern.variableNames()).isEmpty();
        assertThat(pattern.segments()).containsExactly(PathSegment.ofLiteral("api"),
                                                       PathSegment.ofLiteral("health"));
        assertThat(pattern.specificityRank()).isEqualTo(2 * PatternCompiler.LITERAL_WEIGHT);
        assertThat(pattern.toString()).isEqualTo("/api/health");
    }

    @Test
    public void root() {
        final CompiledPattern pattern = compiler().compile("/");
        assertThat(pattern.segments()).isEmpty();
        assertThat(pattern.isStatic()).isTrue();
        assertThat(pattern.hasTrailingSlash()).isFalse();
        assertThat(pattern.specificityRank()).isZero();
    }

    @Test
    public void classifiesSegments() {
        final CompiledPattern pattern = compiler().compile("/api/*/**/{id}/{sku:[A-Z0-9]+}");
        assertThat(pattern.segments()).extracting(PathSegment::type)
                                      .containsExactly(SegmentType.LITERAL,
                                                       SegmentType.WILDCARD,
                                                       SegmentType.MULTI_WILDCARD,
                                                       SegmentType.VARIABLE,
                                                       SegmentType.VARIABLE);
        assertThat(pattern.isStatic()).isFalse();
        assertThat(pattern.hasWildcard()).isTrue();
        assertThat(pattern.hasVariables()).isTrue();
        assertThat(pattern.wildcardCount()).isEqualTo(2);
        assertThat(pattern.multiWildcardCount()).isOne();
        assertThat(pattern.variableNames()).containsExactly("id", "sku");

        final VariableSegment sku = (VariableSegment) pattern.segments().get(4);
        assertThat(sku.name()).isEqualTo("sku");
        assertThat(sku.isConstrained()).isTrue();
        assertThat(sku.constraintSource()).isEqualTo("[A-Z0-9]+");
    }

    @Test
    public void variableNamesKeepOrderOfAppearance() {
        final CompiledPattern pattern = compiler().compile("/api/users/{userId}/posts/{postId}");
        assertThat(pattern.variableNames()).containsExactly("userId", "postId");
        assertThat(pattern.isStatic()).isFalse();
        assertThat(pattern.hasWildcard()).isFalse();
    }

    @Test
    public void variableWhitespaceIsTrimmed() {
        final CompiledPattern pattern = compiler().compile("/users/{ id : [0-9]+ }");
        final VariableSegment id = (VariableSegment) pattern.segments().get(1);
        assertThat(id.name()).isEqualTo("id");
        assertThat(id.constraintSource()).isEqualTo("[0-9]+");
    }

    @Test
    public void constraintMayContainColon() {
        final CompiledPattern pattern = compiler().compile("/at/{time:\\d+:\\d+}");
        final VariableSegment time = (VariableSegment) pattern.segments().get(1);
        assertThat(time.name()).isEqualTo("time");
        assertThat(time.constraintSource()).isEqualTo("\\d+:\\d+");
    }

    @Test
    public void patternIsTrimmed() {
        assertThat(compiler().compile("  /users  ").sourceText()).isEqualTo("/users");
    }

    @Test
    public void trailingSlash() {
        assertThat(compiler().compile("/users/").hasTrailingSlash()).isTrue();
        assertThat(compiler().compile("/users").hasTrailingSlash()).isFalse();
        assertThat(compiler().compile("/users/").segments()).containsExactly(PathSegment.ofLiteral("users"));
    }

    @Test
    public void escapedLiteral() {
        final CompiledPattern pattern = compiler().compile("/user\\{id\\}/a\\*b");
        assertThat(pattern.isStatic()).isTrue();
        final LiteralSegment first = (LiteralSegment) pattern.segments().get(0);
        assertThat(first.value()).isEqualTo("user{id}");
        assertThat(first.segmentString()).isEqualTo("user\\{id\\}");
        assertThat(((LiteralSegment) pattern.segments().get(1)).value()).isEqualTo("a*b");
    }

    @Test
    public void escapeProducesStaticPattern() {
        final String text = "{weird}*name";
        final CompiledPattern pattern = compiler().compile('/' + PathPatternParser.escape(text));
        assertThat(pattern.isStatic()).isTrue();
        assertThat(((LiteralSegment) pattern.segments().get(0)).value()).isEqualTo(text);
    }

    @Test
    public void rejectsRelativePattern() {
        final PatternCompiler compiler = compiler();
        assertThat(reject(compiler, "home").position()).isZero();
        assertThat(reject(compiler, "").position()).isZero();
        assertThatThrownBy(() -> compiler.compile("   ")).isInstanceOf(InvalidPatternException.class);
    }

    @Test
    public void rejectsDoubledSeparator() {
        assertThat(reject(compiler(), "/home//page").position()).isEqualTo(5);
    }

    @Test
    public void rejectsUnbalancedBraces() {
        final PatternCompiler compiler = compiler();
        assertThat(reject(compiler, "/users/{id").position()).isEqualTo(7);
        assertThat(reject(compiler, "/users/{id/posts").position()).isEqualTo(7);
        assertThat(reject(compiler, "/users/id}").position()).isEqualTo(9);
        assertThat(reject(compiler, "/users/{{id}}").position()).isEqualTo(8);
    }

    @Test
    public void rejectsBadVariable() {
        final PatternCompiler compiler = compiler();
        assertThat(reject(compiler, "/users/{}").reason()).isEqualTo("empty variable name");
        assertThat(reject(compiler, "/users/{ }").reason()).isEqualTo("empty variable name");
        assertThat(reject(compiler, "/users/{1id}").reason()).startsWith("invalid variable name: 1id");
        assertThat(reject(compiler, "/users/{user-id}").position()).isEqualTo(8);
        assertThat(reject(compiler, "/users/{id:}").reason()).isEqualTo("empty constraint for variable: id");
    }

    @Test
    public void rejectsPartialVariableSegment() {
        final PatternCompiler compiler = compiler();
        assertThat(reject(compiler, "/users/{id}x").position()).isEqualTo(7);
        assertThat(reject(compiler, "/a{b}").position()).isEqualTo(2);
        assertThat(reject(compiler, "/file-{name}.txt").reason())
                .isEqualTo("a variable must occupy a whole segment");
    }

    @Test
    public void rejectsInvalidConstraint() {
        final InvalidPatternException cause = reject(compiler(), "/items/{sku:[0-9}");
        assertThat(cause.position()).isEqualTo(12);
        assertThat(cause).hasCauseInstanceOf(PatternSyntaxException.class);
    }

    @Test
    public void rejectsTooManySegments() {
        final PatternCompiler compiler = new PatternCompiler(config().maxSegments(3).build());
        assertThat(compiler.compile("/a/b/c").segments()).hasSize(3);
        assertThat(compiler.compile("/a/b/c/").segments()).hasSize(3);
        final InvalidPatternException cause = reject(compiler, "/a/b/c/d");
        assertThat(cause.position()).isEqualTo(-1);
        assertThat(cause.reason()).startsWith("too many segments: 4");
    }

    @Test
    public void nullPattern() {
        assertThatThrownBy(() -> compiler().compile(null)).isInstanceOf(NullPointerException.class);
    }

    @Test
    public void lenientModeAcceptsQuestionableLiterals() {
        final PatternCompiler compiler = compiler();
        assertThat(((LiteralSegment) compiler.compile("/files/file*.js").segments().get(1)).value())
                .isEqualTo("file*.js");
        assertThat(((LiteralSegment) compiler.compile("/a\\").segments().get(0)).value())
                .isEqualTo("a\\");

        final CompiledPattern duplicate = compiler.compile("/a/{id}/b/{id}");
        assertThat(duplicate.variableNames()).containsExactly("id");
    }

    @Test
    public void strictModeRejectsQuestionableLiterals() {
        final PatternCompiler compiler = new PatternCompiler(config().strict(true).build());
        assertThat(reject(compiler, "/files/file*.js").position()).isEqualTo(11);
        assertThat(reject(compiler, "/a\\").reason()).isEqualTo("dangling escape character");
        assertThat(reject(compiler, "/a/{id}/b/{id}").reason()).isEqualTo("duplicate variable name: id");

        // Escaped or whole-segment asterisks are still fine.
        assertThat(compiler.compile("/files/file\\*.js").isStatic()).isTrue();
        assertThat(compiler.compile("/files/*").hasWildcard()).isTrue();
    }

    @Test
    public void rankPrefersMoreSpecificSegments() {
        final PatternCompiler compiler = compiler();
        final long literal = compiler.compile("/users/me").specificityRank();
        final long constrained = compiler.compile("/users/{id:[0-9]+}").specificityRank();
        final long variable = compiler.compile("/users/{id}").specificityRank();
        final long wildcard = compiler.compile("/users/*").specificityRank();
        final long multiWildcard = compiler.compile("/users/**").specificityRank();

        assertThat(literal).isGreaterThan(constrained);
        assertThat(constrained).isGreaterThan(variable);
        assertThat(variable).isGreaterThan(wildcard);
        assertThat(wildcard).isGreaterThan(multiWildcard);
    }

    @Test
    public void rankDoesNotDependOnLength() {
        final PatternCompiler compiler = compiler();
        final StringBuilder manyVariables = new StringBuilder();
        for (int i = 0; i < 200; i++) {
            manyVariables.append("/{v").append(i).append('}');
        }
        assertThat(compiler.compile("/a").specificityRank())
                .isGreaterThan(compiler.compile(manyVariables.toString()).specificityRank());
        assertThat(compiler.compile("/a/{b}").specificityRank())
                .isGreaterThan(compiler.compile("/{a}/{b}/{c}/{d}/{e}/{f}").specificityRank());
    }

    @Test
    public void rankIsDeterministic() {
        final String pattern = "/api/{version:v[0-9]+}/*/{id}/**";
        assertThat(compiler().compile(pattern).specificityRank())
                .isEqualTo(compiler().compile(pattern).specificityRank())
                .isEqualTo(PatternCompiler.LITERAL_WEIGHT +
                           PatternCompiler.CONSTRAINED_VARIABLE_WEIGHT +
                           PatternCompiler.WILDCARD_WEIGHT +
                           PatternCompiler.VARIABLE_WEIGHT +
                           PatternCompiler.MULTI_WILDCARD_WEIGHT);
    }

    @Test
    public void patternCarriesConfiguration() {
        final PatternCompiler compiler = new PatternCompiler(config().caseInsensitive(true)
                                                                     .optionalTrailingSlash(true)
                                                                     .build());
        final CompiledPattern pattern = compiler.compile("/Users");
        assertThat(pattern.caseInsensitive()).isTrue();
        assertThat(pattern.optionalTrailingSlash()).isTrue();
    }

    @Test
    public void cachesCompiledPatterns() {
        final PatternCompiler compiler = compiler();
        final CompiledPattern first = compiler.compile("/users/{id}");
        assertThat(compiler.compile("/users/{id}")).isSameAs(first);
        assertThat(compiler.compile(" /users/{id} ")).isSameAs(first);

        compiler.invalidateCache();
        final CompiledPattern second = compiler.compile("/users/{id}");
        assertThat(second).isNotSameAs(first).isEqualTo(first);
    }

    @Test
    public void zeroCapacityDisablesCache() {
        final PatternCompiler compiler = new PatternCompiler(config().cacheCapacity(0).build());
        final CompiledPattern first = compiler.compile("/users/{id}");
        final CompiledPattern second = compiler.compile("/users/{id}");
        assertThat(second).isNotSameAs(first).isEqualTo(first);
        assertThat(compiler.cache().estimatedSize()).isZero();
    }

    @Test
    public void configurationChangeInvalidatesCache() {
        final PatternCompiler compiler = compiler();
        final CompiledPattern before = compiler.compile("/Users");
        assertThat(before.caseInsensitive()).isFalse();

        compiler.configuration(compiler.configuration().toBuilder().caseInsensitive(true).build());
        assertThat(compiler.cache().estimatedSize()).isZero();

        final CompiledPattern after = compiler.compile("/Users");
        assertThat(after).isNotSameAs(before).isNotEqualTo(before);
        assertThat(after.caseInsensitive()).isTrue();
        // A pattern compiled earlier keeps its properties.
        assertThat(before.caseInsensitive()).isFalse();
    }

    @Test
    public void configurationChangeAppliesValidation() {
        final PatternCompiler compiler = compiler();
        assertThat(compiler.compile("/files/file*.js").isStatic()).isTrue();
        compiler.configuration(compiler.configuration().toBuilder().strict(true).build());
        reject(compiler, "/files/file*.js");
    }
}
