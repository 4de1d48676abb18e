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

package io.kubicorn.reconciler.api.cluster;

import org.apache.flink.annotation.Experimental;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Optional;

/**
 * Immutable, point-in-time description of a cluster's declared and observed topology.
 *
 * <p>Instances are never modified. Every reconciliation step that changes the topology returns a
 * new snapshot through one of the {@code with*} methods, leaving references to previous snapshots
 * valid and unaffected.
 */
@Experimental
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class ClusterSnapshot {

    /** Cluster name, used as owner tag value and for gateway correlation. */
    @NonNull String name;

    /** Provider network the cluster lives in. */
    @NonNull @Builder.Default Network network = Network.builder().build();

    /**
     * Looks up a public subnet record of this snapshot by its logical name.
     *
     * @param subnetName Logical subnet name.
     * @return The first subnet with the given name, if any.
     */
    public Optional<PublicSubnet> findPublicSubnet(String subnetName) {
        return network.getPublicSubnets().stream()
                .filter(subnet -> subnet.getName().equals(subnetName))
                .findFirst();
    }

    /**
     * Creates a copy of this snapshot with the given network.
     *
     * @param network New network description.
     * @return New snapshot, this instance is unchanged.
     */
    public ClusterSnapshot withNetwork(@NonNull Network network) {
        return toBuilder().network(network).build();
    }

    /**
     * Creates a copy of this snapshot where the public subnet with the same name is replaced by
     * the given record, or the record is appended if no such subnet exists.
     *
     * @param subnet Subnet record to fold in.
     * @return New snapshot, this instance is unchanged.
     */
    public ClusterSnapshot withPublicSubnet(@NonNull PublicSubnet subnet) {
        return withNetwork(network.withPublicSubnet(subnet));
    }
}
