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

import io.kubicorn.reconciler.TestUtils;
import io.kubicorn.reconciler.TestingEc2Service;
import io.kubicorn.reconciler.api.cluster.ClusterSnapshot;
import io.kubicorn.reconciler.api.resources.PublicRouteTable;
import io.kubicorn.reconciler.reconciler.diff.ResourceComparator;
import io.kubicorn.reconciler.reconciler.network.PublicRouteTableReconciler;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static io.kubicorn.reconciler.TestUtils.CLUSTER_NAME;
import static io.kubicorn.reconciler.TestUtils.GATEWAY_ID;
import static io.kubicorn.reconciler.TestUtils.SUBNET_A;
import static io.kubicorn.reconciler.TestUtils.SUBNET_A_ID;
import static io.kubicorn.reconciler.TestUtils.SUBNET_B_ID;
import static io.kubicorn.reconciler.TestingEc2Service.DESCRIBE_ROUTE_TABLES;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

/** Tests for {@link ReconciliationDriver}. */
public class ReconciliationDriverTest {

    private TestingEc2Service ec2Service;
    private PublicRouteTableReconciler reconciler;
    private ReconciliationDriver driver;
    private ClusterSnapshot snapshot;

    @BeforeEach
    public void setup() {
        ec2Service = new TestingEc2Service();
        ec2Service.addInternetGateway(GATEWAY_ID, CLUSTER_NAME);
        reconciler =
                new PublicRouteTableReconciler(
                        ec2Service, new ResourceComparator(), TestUtils.defaultConfiguration());
        driver = new ReconciliationDriver();
        snapshot = TestUtils.buildSnapshot();
    }

    @Test
    public void testReconcileIsIdempotent() {
        var target = reconciler.targets(snapshot).get(0);

        var first = driver.reconcile(target, snapshot);
        assertEquals(4, ec2Service.getMutations().size());
        assertTrue(first.getResource().getIdentifier().startsWith("rtb-"));

        ec2Service.clearCalls();
        var second = driver.reconcile(target, first.getSnapshot());

        assertEquals(List.of(DESCRIBE_ROUTE_TABLES), ec2Service.getCalls());
        assertEquals(SUBNET_A, second.getResource().getIdentifier());
        assertEquals(1, ec2Service.getRouteTables().size());
    }

    @Test
    public void testReconcileAllAndTeardownAll() {
        var targets = reconciler.targets(snapshot);
        var before = TestUtils.buildSnapshot();

        var reconciled = driver.reconcileAll(targets, snapshot);

        assertEquals(before, snapshot);
        assertEquals(before, reconciled);
        var routeTables = ec2Service.getRouteTables();
        assertEquals(2, routeTables.size());
        assertEquals(SUBNET_A_ID, routeTables.get(0).associations().get(0).subnetId());
        assertEquals(SUBNET_B_ID, routeTables.get(1).associations().get(0).subnetId());

        ec2Service.clearCalls();
        driver.reconcileAll(targets, reconciled);
        assertTrue(ec2Service.getMutations().isEmpty());

        driver.teardownAll(targets, reconciled);
        assertTrue(ec2Service.getRouteTables().isEmpty());
        assertEquals(
                List.of(routeTables.get(1).routeTableId(), routeTables.get(0).routeTableId()),
                ec2Service.getDeletedRouteTableIds());
    }

    @Test
    public void testTeardownWithoutResourceSkipsDelete() {
        var target = reconciler.targets(snapshot).get(0);

        var result = driver.teardown(target, snapshot);

        assertFalse(result.getResource().hasIdentifier());
        assertSame(snapshot, result.getSnapshot());
        assertEquals(List.of(DESCRIBE_ROUTE_TABLES), ec2Service.getCalls());
    }

    @Test
    public void testSnapshotsAreThreadedThroughPhases() {
        var recording = new RecordingReconciler();
        var declared = PublicRouteTable.forSubnet(snapshot.findPublicSubnet(SUBNET_A).get());

        var result = driver.reconcile(ReconcileTarget.of(recording, declared), snapshot);

        assertEquals(List.of("actual", "expected", "apply"), recording.phases);
        assertSame(snapshot, recording.received.get(0));
        assertEquals("actual", recording.received.get(1).getName());
        assertEquals("expected", recording.received.get(2).getName());
        assertEquals("apply", result.getSnapshot().getName());
        assertEquals(CLUSTER_NAME, snapshot.getName());
    }

    /** Reconciler renaming the snapshot after every phase to make the handover visible. */
    private static class RecordingReconciler implements ResourceReconciler<PublicRouteTable> {
        private final List<String> phases = new ArrayList<>();
        private final List<ClusterSnapshot> received = new ArrayList<>();

        private ReconcileResult<PublicRouteTable> record(
                String phase, PublicRouteTable resource, ClusterSnapshot snapshot) {
            phases.add(phase);
            received.add(snapshot);
            return ReconcileResult.of(snapshot.toBuilder().name(phase).build(), resource);
        }

        @Override
        public ReconcileResult<PublicRouteTable> actual(
                PublicRouteTable declared, ClusterSnapshot snapshot) {
            return record("actual", declared, snapshot);
        }

        @Override
        public ReconcileResult<PublicRouteTable> expected(
                PublicRouteTable declared, ClusterSnapshot snapshot) {
            return record("expected", declared, snapshot);
        }

        @Override
        public ReconcileResult<PublicRouteTable> apply(
                PublicRouteTable declared,
                PublicRouteTable actual,
                PublicRouteTable expected,
                ClusterSnapshot snapshot) {
            return record("apply", expected, snapshot);
        }

        @Override
        public ReconcileResult<PublicRouteTable> delete(
                PublicRouteTable declared, PublicRouteTable actual, ClusterSnapshot snapshot) {
            return record("delete", actual, snapshot);
        }
    }
}
