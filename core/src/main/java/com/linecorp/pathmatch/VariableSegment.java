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

import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

import javax.annotation.Nullable;

import com.google.common.collect.ImmutableMap;

final class VariableSegment extends PathSegment {

    private final String name;

    /**
     * Compiled once when the pattern is compiled. Always evaluated as a full match.
     */
    @Nullable
    private final Pattern constraint;

    VariableSegment(String name, @Nullable Pattern constraint) {
        this.name = requireNonNull(name, "name");
        this.constraint = constraint;
    }

    String name() {
        return name;
    }

    @Nullable
    Pattern constraint() {
        return constraint;
    }

    /**
     * Returns the source text of the constraint, or {@code null} if unconstrained.
     */
    @Nullable
    String constraintSource() {
        return constraint != null ? constraint.pattern() : null;
    }

    boolean isConstrained() {
        return constraint != null;
    }

    @Override
    public SegmentType type() {
        return SegmentType.VARIABLE;
    }

    @Override
    public boolean matches(String component, boolean caseInsensitive) {
        if (component.isEmpty()) {
            return false;
        }
        return constraint == null || constraint.matcher(component).matches();
    }

    @Override
    public Map<String, String> extractVariables(String component) {
        return ImmutableMap.of(name, component);
    }

    @Override
    public String segmentString() {
        if (constraint == null) {
            return '{' + name + '}';
        }
        return '{' + name + ':' + constraint.pattern() + '}';
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof VariableSegment)) {
            return false;
        }
        final VariableSegment that = (VariableSegment) o;
        return name.equals(that.name) &&
               Objects.equals(constraintSource(), that.constraintSource());
    }

    @Override
    public int hashCode() {
        return name.hashCode() * 31 + Objects.hashCode(constraintSource());
    }
}
