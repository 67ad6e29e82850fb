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

import com.google.common.collect.ImmutableMap;

import com.linecorp.pathmatch.internal.PathUtil;

final class LiteralSegment extends PathSegment {

    private final String value;

    LiteralSegment(String value) {
        this.value = requireNonNull(value, "value");
    }

    /**
     * Returns the unescaped value, e.g. {@code user{id}} for the pattern segment {@code user\{id\}}.
     */
    String value() {
        return value;
    }

    @Override
    public SegmentType type() {
        return SegmentType.LITERAL;
    }

    @Override
    public boolean matches(String component, boolean caseInsensitive) {
        return caseInsensitive ? value.equalsIgnoreCase(component) : value.equals(component);
    }

    @Override
    public Map<String, String> extractVariables(String component) {
        return ImmutableMap.of();
    }

    @Override
    public String segmentString() {
        return PathUtil.escape(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof LiteralSegment)) {
            return false;
        }
        return value.equals(((LiteralSegment) o).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }
}
