/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.kubicorn.reconciler.reconciler;

import io.kubicorn.reconciler.api.cluster.ClusterSnapshot;
import io.kubicorn.reconciler.api.resources.CloudResource;

import lombok.NonNull;
import lombok.Value;

/**
 * Outcome of a single reconciliation phase: the resource it produced and the snapshot to use for
 * the next step.
 *
 * @param <R> The resource kind.
 */
@Value
public class ReconcileResult<R extends CloudResource> {
    @NonNull ClusterSnapshot snapshot;
    @NonNull R resource;

    public static <R extends CloudResource> ReconcileResult<R> of(
            ClusterSnapshot snapshot, R resource) {
        return new ReconcileResult<>(snapshot, resource);
    }
}
