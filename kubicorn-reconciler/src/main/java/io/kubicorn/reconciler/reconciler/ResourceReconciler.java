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

/**
 * The reconciliation protocol of one resource kind.
 *
 * <p>Every phase receives the declared resource together with the current snapshot and returns a
 * fresh resource value plus the snapshot for the next phase. Implementations keep no state
 * between calls.
 *
 * @param <R> The resource kind to be reconciled.
 */
public interface ResourceReconciler<R extends CloudResource> {

    /**
     * Reads the live state of the resource from the provider.
     *
     * @param declared the declared resource
     * @param snapshot the last known snapshot
     * @return the observed resource, with an empty identifier if nothing exists on the provider
     */
    ReconcileResult<R> actual(R declared, ClusterSnapshot snapshot);

    /**
     * Computes the desired state of the resource from the declaration only. Never calls the
     * provider.
     *
     * @param declared the declared resource
     * @param snapshot the current snapshot
     * @return the expected resource
     */
    ReconcileResult<R> expected(R declared, ClusterSnapshot snapshot);

    /**
     * Converges the provider toward the expected state. Does nothing when actual and expected are
     * already equal.
     *
     * @param declared the declared resource
     * @param actual result of {@link #actual}
     * @param expected result of {@link #expected}
     * @param snapshot the current snapshot
     * @return the applied resource carrying the provider identifier
     */
    ReconcileResult<R> apply(R declared, R actual, R expected, ClusterSnapshot snapshot);

    /**
     * Removes the resource from the provider.
     *
     * @param declared the declared resource
     * @param actual result of {@link #actual}, must carry an identifier
     * @param snapshot the current snapshot
     * @return the deleted resource with an empty identifier
     */
    ReconcileResult<R> delete(R declared, R actual, ClusterSnapshot snapshot);
}
