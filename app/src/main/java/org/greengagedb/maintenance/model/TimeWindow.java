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
package org.greengagedb.maintenance.model;

import org.greengagedb.maintenance.job.InvalidJobConfigurationException;

import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Objects;

/**
 * Daily maintenance window {@code [start, end)} in UTC.
 *
 * <p>Windows crossing midnight are not supported: {@code start} must be before {@code end}.
 *
 * @param start First allowed time of day (inclusive)
 * @param end   First disallowed time of day (exclusive)
 */
public record TimeWindow(LocalTime start, LocalTime end) {
    private static final DateTimeFormatter TIME_OF_DAY = DateTimeFormatter.ofPattern("H:mm[:ss]");

    public TimeWindow {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (!start.isBefore(end)) {
            throw new InvalidJobConfigurationException(
                    "Window start %s must be before end %s".formatted(start, end));
        }
    }

    /**
     * Parse a window from {@code H:mm} or {@code H:mm:ss} strings; the hour may have one or two digits.
     *
     * @param start Start time of day
     * @param end   End time of day
     * @return Parsed window
     * @throws InvalidJobConfigurationException If either value is malformed or start is not before end
     */
    public static TimeWindow parse(String start, String end) {
        return new TimeWindow(parseTime(start, "start"), parseTime(end, "end"));
    }

    private static LocalTime parseTime(String value, String label) {
        if (value == null || value.isBlank()) {
            throw new InvalidJobConfigurationException("Window " + label + " time is not configured");
        }
        try {
            return LocalTime.parse(value.trim(), TIME_OF_DAY);
        } catch (DateTimeParseException e) {
            throw new InvalidJobConfigurationException(
                    "Invalid window %s time '%s'".formatted(label, value), e);
        }
    }

    public boolean contains(LocalTime time) {
        return !time.isBefore(start) && time.isBefore(end);
    }

    @Override
    public String toString() {
        return start + "-" + end;
    }
}
