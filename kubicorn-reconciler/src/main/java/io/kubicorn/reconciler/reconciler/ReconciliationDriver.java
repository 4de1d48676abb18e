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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Runs the reconciliation protocol for declared resources. Resources are processed one at a time
 * and the snapshot returned by each phase is handed to the next one.
 */
public class ReconciliationDriver {

    private static final Logger LOG = LoggerFactory.getLogger(ReconciliationDriver.class);

    /**
     * Converges a single resource: actual, expected, then apply.
     *
     * @param target the declared resource and its reconciler
     * @param snapshot the current snapshot
     * @return the outcome of apply
     */
    public <R extends CloudResource> ReconcileResult<R> reconcile(
            ReconcileTarget<R> target, ClusterSnapshot snapshot) {
        var reconciler = target.getReconciler();
        var declared = target.getDeclared();
        LOG.debug("Reconciling {}", declared.getName());

        var actual = reconciler.actual(declared, snapshot);
        var expected = reconciler.expected(declared, actual.getSnapshot());
        return reconciler.apply(
                declared, actual.getResource(), expected.getResource(), expected.getSnapshot());
    }

    /**
     * Removes a single resource: actual, then delete if the resource exists.
     *
     * @param target the declared resource and its reconciler
     * @param snapshot the current snapshot
     * @return the outcome of delete, or of actual if nothing exists
     */
    public <R extends CloudResource> ReconcileResult<R> teardown(
            ReconcileTarget<R> target, ClusterSnapshot snapshot) {
        var reconciler = target.getReconciler();
        var declared = target.getDeclared();
        LOG.debug("Tearing down {}", declared.getName());

        var actual = reconciler.actual(declared, snapshot);
        if (!actual.getResource().hasIdentifier()) {
            LOG.info("Resource {} does not exist, nothing to delete", declared.getName());
            return actual;
        }
        return reconciler.delete(declared, actual.getResource(), actual.getSnapshot());
    }

    /**
     * Reconciles the targets in order.
     *
     * @return the snapshot after the last target
     */
    public ClusterSnapshot reconcileAll(
            List<? extends ReconcileTarget<?>> targets, ClusterSnapshot snapshot) {
        var current = snapshot;
        for (ReconcileTarget<?> target : targets) {
            current = reconcile(target, current).getSnapshot();
        }
        return current;
    }

    /**
     * Tears the targets down in reverse order.
     *
     * @return the snapshot after the last target
     */
    public ClusterSnapshot teardownAll(
            List<? extends ReconcileTarget<?>> targets, ClusterSnapshot snapshot) {
        var reversed = new ArrayList<ReconcileTarget<?>>(targets);
        Collections.reverse(reversed);
        var current = snapshot;
        for (ReconcileTarget<?> target : reversed) {
            current = teardown(target, current).getSnapshot();
        }
        return current;
    }
}
