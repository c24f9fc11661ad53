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
package org.greengagedb.maintenance.job;

import org.greengagedb.maintenance.model.JobDescriptor;
import org.greengagedb.maintenance.model.JobKind;
import org.greengagedb.maintenance.model.MaintenanceRun;
import org.greengagedb.maintenance.model.TimeWindow;

import java.sql.SQLException;
import java.util.Optional;

/**
 * Configurable job for tests of the runner, reporter and scheduler.
 */
public class FakeJob implements MaintenanceJob {

    @FunctionalInterface
    public interface Body {
        MaintenanceRun execute() throws SQLException;
    }

    private final String name;
    private final JobKind kind;
    private final Optional<TimeWindow> window;
    private boolean enabled = true;
    private String detail = "";
    private String hashtag;
    private RuntimeException describeFailure;
    private Body body = () -> {
        throw new UnsupportedOperationException("no body");
    };

    public FakeJob(JobKind kind) {
        this(kind.id(), kind, Optional.empty());
    }

    public FakeJob(String name, JobKind kind, Optional<TimeWindow> window) {
        this.name = name;
        this.kind = kind;
        this.window = window;
    }

    public FakeJob body(Body body) {
        this.body = body;
        return this;
    }

    public FakeJob disabled() {
        this.enabled = false;
        return this;
    }

    public FakeJob detail(String detail) {
        this.detail = detail;
        return this;
    }

    public FakeJob hashtag(String hashtag) {
        this.hashtag = hashtag;
        return this;
    }

    public FakeJob failDescribe(RuntimeException failure) {
        this.describeFailure = failure;
        return this;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public JobKind getKind() {
        return kind;
    }

    @Override
    public JobDescriptor describe() {
        if (describeFailure != null) {
            throw describeFailure;
        }
        return new JobDescriptor(name, "0 0 1 * * ?", enabled, kind, window);
    }

    @Override
    public MaintenanceRun execute() throws SQLException {
        return body.execute();
    }

    @Override
    public String getStartedDetail() {
        return detail;
    }

    @Override
    public Optional<String> getHashtag() {
        return Optional.ofNullable(hashtag);
    }
}
