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
package org.greengagedb.maintenance.window;

import org.greengagedb.maintenance.model.TimeWindow;

import java.time.Clock;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.Objects;

/**
 * Decides whether destructive maintenance may run at the current time of day.
 *
 * <p>Used twice per cleanup run: once as the pre-run veto when the trigger fires, and at
 * the top of every batch iteration. Each call samples the clock again, so the two checks
 * can disagree near the end of the window.
 */
public class WindowGate {
    private final TimeWindow window;
    private final Clock clock;

    public WindowGate(TimeWindow window, Clock clock) {
        this.window = Objects.requireNonNull(window, "window");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * @return {@code true} iff {@code window.start <= now < window.end}
     */
    public static boolean allows(LocalTime now, TimeWindow window) {
        return window.contains(now);
    }

    /**
     * Sample the clock in UTC and check it against the window.
     */
    public boolean isOpen() {
        return allows(now(), window);
    }

    public LocalTime now() {
        return LocalTime.now(clock.withZone(ZoneOffset.UTC));
    }

    public TimeWindow getWindow() {
        return window;
    }
}
