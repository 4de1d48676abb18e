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

package io.kubicorn.reconciler;

import org.apache.flink.annotation.VisibleForTesting;

import io.kubicorn.reconciler.api.cluster.ClusterSnapshot;
import io.kubicorn.reconciler.api.utils.ClusterSnapshotUtils;
import io.kubicorn.reconciler.config.ReconcilerConfiguration;
import io.kubicorn.reconciler.reconciler.ReconciliationDriver;
import io.kubicorn.reconciler.reconciler.diff.ResourceComparator;
import io.kubicorn.reconciler.reconciler.network.PublicRouteTableReconciler;
import io.kubicorn.reconciler.service.AwsEc2Service;
import io.kubicorn.reconciler.service.Ec2ClientFactory;
import io.kubicorn.reconciler.service.Ec2Service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Locale;
import java.util.function.Function;

/** Reconciles the public route tables of a declared cluster against AWS. */
public class KubicornReconciler {

    private static final Logger LOG = LoggerFactory.getLogger(KubicornReconciler.class);

    /** Supported commands. */
    public enum Command {
        APPLY,
        DELETE;

        public static Command fromString(String command) {
            try {
                return valueOf(command.toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown command: " + command, e);
            }
        }
    }

    private final ReconciliationDriver driver;
    private final PublicRouteTableReconciler routeTableReconciler;

    public KubicornReconciler(ReconcilerConfiguration configuration, Ec2Service ec2Service) {
        this.driver = new ReconciliationDriver();
        this.routeTableReconciler =
                new PublicRouteTableReconciler(
                        ec2Service, new ResourceComparator(), configuration);
    }

    public ClusterSnapshot run(Command command, ClusterSnapshot snapshot) {
        var targets = routeTableReconciler.targets(snapshot);
        LOG.info(
                "Running {} on {} resources of cluster {}",
                command,
                targets.size(),
                snapshot.getName());
        switch (command) {
            case APPLY:
                return driver.reconcileAll(targets, snapshot);
            case DELETE:
                return driver.teardownAll(targets, snapshot);
            default:
                throw new IllegalArgumentException("Unsupported command " + command);
        }
    }

    public static void main(String... args) {
        int exitCode =
                execute(
                        args,
                        configuration ->
                                new AwsEc2Service(Ec2ClientFactory.createClient(configuration)));
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    @VisibleForTesting
    static int execute(
            String[] args, Function<ReconcilerConfiguration, Ec2Service> ec2ServiceFactory) {
        if (args.length != 2) {
            LOG.error("Usage: KubicornReconciler <apply|delete> <cluster-file>");
            return 1;
        }
        try {
            var command = Command.fromString(args[0]);
            var snapshot = ClusterSnapshotUtils.readSnapshot(Path.of(args[1]));
            var configuration = ReconcilerConfiguration.load();

            try (var ec2Service = ec2ServiceFactory.apply(configuration)) {
                var result =
                        new KubicornReconciler(configuration, ec2Service).run(command, snapshot);
                LOG.info(
                        "Cluster {} after {}:\n{}",
                        result.getName(),
                        command,
                        ClusterSnapshotUtils.writeSnapshotAsYaml(result));
            }
            return 0;
        } catch (Exception e) {
            LOG.error("Failed to {} cluster file {}", args[0], args[1], e);
            return 1;
        }
    }
}
