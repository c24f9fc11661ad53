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
package org.greengagedb.maintenance.scheduler;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;

/**
 * A periodic trigger to register with a {@link PeriodicTrigger}.
 *
 * @param id        Unique trigger identity
 * @param cron      Cron expression
 * @param veto      Evaluated at every firing; {@code true} skips the firing
 * @param onFire    Invoked for every firing that is not vetoed
 * @param onMisfire Invoked with the lateness of a firing that started late
 */
public record TriggerRegistration(String id,
                                  String cron,
                                  Optional<BooleanSupplier> veto,
                                  Runnable onFire,
                                  Consumer<Duration> onMisfire) {

    public TriggerRegistration {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(cron, "cron");
        Objects.requireNonNull(onFire, "onFire");
        veto = veto == null ? Optional.empty() : veto;
        onMisfire = onMisfire == null ? lateness -> { } : onMisfire;
    }

    public boolean isVetoed() {
        return veto.map(BooleanSupplier::getAsBoolean).orElse(false);
    }
}
