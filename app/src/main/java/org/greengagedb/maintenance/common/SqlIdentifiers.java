/**
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *     http://www.apache.org/licenses/LICENSE-2.0
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.greengagedb.maintenance.common;

import lombok.experimental.UtilityClass;

import java.util.regex.Pattern;

/**
 * Validation and quoting of table and column names that end up in maintenance SQL.
 *
 * <p>Maintenance statements ({@code VACUUM FULL}, {@code REINDEX TABLE}) cannot take
 * identifiers as bind parameters, so every name coming from configuration or from the
 * bloat view goes through {@link #quote(String)} first.
 */
@UtilityClass
public final class SqlIdentifiers {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_$]*");
    private static final int MAX_IDENTIFIER_LENGTH = 63;

    /**
     * Quote a plain or schema-qualified identifier.
     *
     * @param name Identifier such as {@code waypoint} or {@code public.waypoint}
     * @return Quoted identifier such as {@code "public"."waypoint"}
     * @throws IllegalArgumentException If the name is empty or contains unsupported characters
     */
    public static String quote(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Identifier cannot be null or empty");
        }
        String[] parts = name.trim().split("\\.", -1);
        if (parts.length > 2) {
            throw new IllegalArgumentException("Identifier has too many parts: " + name);
        }
        StringBuilder quoted = new StringBuilder();
        for (String part : parts) {
            validatePart(part, name);
            if (!quoted.isEmpty()) {
                quoted.append('.');
            }
            quoted.append('"').append(part).append('"');
        }
        return quoted.toString();
    }

    private static void validatePart(String part, String name) {
        if (part.length() > MAX_IDENTIFIER_LENGTH || !IDENTIFIER.matcher(part).matches()) {
            throw new IllegalArgumentException("Identifier contains invalid characters: " + name);
        }
    }
}
