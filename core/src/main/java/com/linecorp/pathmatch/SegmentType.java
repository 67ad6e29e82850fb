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

/**
 * The type of a {@link PathSegment}.
 */
public enum SegmentType {
    /**
     * A fixed path component, e.g. {@code users} in {@code /users/{id}}.
     */
    LITERAL(false),
    /**
     * A named variable, optionally constrained by a regular expression, e.g. {@code {id}} or
     * {@code {id:[0-9]+}}.
     */
    VARIABLE(false),
    /**
     * {@code *}, which matches exactly one path component.
     */
    WILDCARD(true),
    /**
     * {@code **}, which matches one or more path components.
     */
    MULTI_WILDCARD(true);

    private final boolean wildcard;

    SegmentType(boolean wildcard) {
        this.wildcard = wildcard;
    }

    /**
     * Returns whether this type is either {@link #WILDCARD} or {@link #MULTI_WILDCARD}.
     */
    public boolean isWildcard() {
        return wildcard;
    }
}
