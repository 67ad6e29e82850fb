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

import java.util.Map;

import com.google.common.collect.ImmutableMap;

/**
 * {@code *} or {@code **}. How many path components are consumed is decided by {@link PathMatcher};
 * on its own a wildcard accepts any single component.
 */
final class WildcardSegment extends PathSegment {

    private final boolean multiSegment;

    WildcardSegment(boolean multiSegment) {
        this.multiSegment = multiSegment;
    }

    boolean isMultiSegment() {
        return multiSegment;
    }

    @Override
    public SegmentType type() {
        return multiSegment ? SegmentType.MULTI_WILDCARD : SegmentType.WILDCARD;
    }

    @Override
    public boolean matches(String component, boolean caseInsensitive) {
        return true;
    }

    @Override
    public Map<String, String> extractVariables(String component) {
        return ImmutableMap.of();
    }

    @Override
    public String segmentString() {
        return multiSegment ? "**" : "*";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof WildcardSegment && multiSegment == ((WildcardSegment) o).multiSegment;
    }

    @Override
    public int hashCode() {
        return Boolean.hashCode(multiSegment);
    }
}
