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

package io.kubicorn.reconciler.api.resources;

import org.apache.flink.annotation.Experimental;

import io.kubicorn.reconciler.api.cluster.PublicSubnet;
import io.kubicorn.reconciler.api.diff.DiffType;
import io.kubicorn.reconciler.api.diff.ResourceDiff;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/** Route table routing one public subnet of the cluster to the internet gateway. */
@Experimental
@Value
@Builder(toBuilder = true)
public class PublicRouteTable implements CloudResource {

    @NonNull String name;

    @NonNull @Builder.Default String identifier = "";

    @Singular Map<String, String> tags;

    /** The subnet this route table is associated with. */
    @ResourceDiff(DiffType.IGNORE)
    @NonNull
    PublicSubnet clusterPublicSubnet;

    /**
     * Declares the route table of a public subnet. The route table shares the subnet name.
     *
     * @param subnet Public subnet record.
     * @return declared route table without identifier.
     */
    public static PublicRouteTable forSubnet(PublicSubnet subnet) {
        return PublicRouteTable.builder()
                .name(subnet.getName())
                .clusterPublicSubnet(subnet)
                .build();
    }
}
