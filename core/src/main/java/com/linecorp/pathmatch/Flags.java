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

import java.util.function.IntPredicate;

import javax.annotation.Nullable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Ascii;

/**
 * The system properties that affect the default {@link ParserConfiguration}.
 * Each property is read once, when this class is initialized, e.g.
 * {@code -Dcom.linecorp.pathmatch.cacheCapacity=4096}.
 */
public final class Flags {

    private static final Logger logger = LoggerFactory.getLogger(Flags.class);

    private static final String PREFIX = "com.linecorp.pathmatch.";

    /**
     * The largest value allowed for {@code maxSegments}. A specificity rank reserves 12 bits for the
     * number of segments of each {@link SegmentType}.
     */
    static final int MAX_SEGMENTS_LIMIT = 4095;

    private static final boolean DEFAULT_CASE_INSENSITIVE = false;
    private static final boolean CASE_INSENSITIVE =
            getBoolean("caseInsensitive", DEFAULT_CASE_INSENSITIVE);

    private static final boolean DEFAULT_OPTIONAL_TRAILING_SLASH = false;
    private static final boolean OPTIONAL_TRAILING_SLASH =
            getBoolean("optionalTrailingSlash", DEFAULT_OPTIONAL_TRAILING_SLASH);

    private static final boolean DEFAULT_STRICT = false;
    private static final boolean STRICT = getBoolean("strict", DEFAULT_STRICT);

    private static final int DEFAULT_MAX_SEGMENTS = 256;
    private static final int MAX_SEGMENTS =
            getInt("maxSegments", DEFAULT_MAX_SEGMENTS, value -> value > 0 && value <= MAX_SEGMENTS_LIMIT);

    private static final int DEFAULT_CACHE_CAPACITY = 1000;
    private static final int CACHE_CAPACITY =
            getInt("cacheCapacity", DEFAULT_CACHE_CAPACITY, value -> value >= 0);

    static {
        logger.info("Default path pattern configuration: caseInsensitive={}, optionalTrailingSlash={}, " +
                    "strict={}, maxSegments={}, cacheCapacity={}",
                    CASE_INSENSITIVE, OPTIONAL_TRAILING_SLASH, STRICT, MAX_SEGMENTS, CACHE_CAPACITY);
    }

    /**
     * Returns whether literal segments are compared case-insensitively by default.
     *
     * <p>The default value of this flag is {@value #DEFAULT_CASE_INSENSITIVE}. Specify the
     * {@code -Dcom.linecorp.pathmatch.caseInsensitive=true} JVM option to override the default.
     */
    public static boolean caseInsensitive() {
        return CASE_INSENSITIVE;
    }

    /**
     * Returns whether a single trailing slash is ignored by default.
     *
     * <p>The default value of this flag is {@value #DEFAULT_OPTIONAL_TRAILING_SLASH}. Specify the
     * {@code -Dcom.linecorp.pathmatch.optionalTrailingSlash=true} JVM option to override the default.
     */
    public static boolean optionalTrailingSlash() {
        return OPTIONAL_TRAILING_SLASH;
    }

    /**
     * Returns whether path patterns are validated strictly by default.
     *
     * <p>The default value of this flag is {@value #DEFAULT_STRICT}. Specify the
     * {@code -Dcom.linecorp.pathmatch.strict=true} JVM option to override the default.
     */
    public static boolean strict() {
        return STRICT;
    }

    /**
     * Returns the default maximum number of segments in a path pattern.
     *
     * <p>The default value of this flag is {@value #DEFAULT_MAX_SEGMENTS}. Specify the
     * {@code -Dcom.linecorp.pathmatch.maxSegments=<integer>} JVM option to override the default.
     */
    public static int maxSegments() {
        return MAX_SEGMENTS;
    }

    /**
     * Returns the default capacity of the compiled pattern cache and the match result cache.
     * {@code 0} disables caching.
     *
     * <p>The default value of this flag is {@value #DEFAULT_CACHE_CAPACITY}. Specify the
     * {@code -Dcom.linecorp.pathmatch.cacheCapacity=<integer>} JVM option to override the default.
     */
    public static int cacheCapacity() {
        return CACHE_CAPACITY;
    }

    @VisibleForTesting
    static boolean getBoolean(String name, boolean defaultValue) {
        final String fullName = PREFIX + name;
        final String value = getNormalized(fullName);
        final boolean result;
        if (value == null) {
            result = defaultValue;
        } else if ("true".equals(value)) {
            result = true;
        } else if ("false".equals(value)) {
            result = false;
        } else {
            logger.warn("{}: {} (invalid; using default: {})", fullName, value, defaultValue);
            result = defaultValue;
        }
        logger.debug("{}: {}", fullName, result);
        return result;
    }

    @VisibleForTesting
    static int getInt(String name, int defaultValue, IntPredicate validator) {
        final String fullName = PREFIX + name;
        final String value = getNormalized(fullName);
        int result = defaultValue;
        if (value != null) {
            try {
                final int parsed = Integer.parseInt(value);
                if (validator.test(parsed)) {
                    result = parsed;
                } else {
                    logger.warn("{}: {} (out of range; using default: {})", fullName, value, defaultValue);
                }
            } catch (NumberFormatException e) {
                logger.warn("{}: {} (invalid; using default: {})", fullName, value, defaultValue);
            }
        }
        logger.debug("{}: {}", fullName, result);
        return result;
    }

    @Nullable
    private static String getNormalized(String fullName) {
        final String value = System.getProperty(fullName);
        if (value == null) {
            return null;
        }
        return Ascii.toLowerCase(value.trim());
    }

    private Flags() {}
}
