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

package io.kubicorn.reconciler.api.tags;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reserved tag keys. The same keys are used to mark ownership and association when creating
 * provider objects and as lookup filters when reading them back, so the exact strings are part of
 * the contract with the provider.
 */
public final class TagConventions {

    public static final String NAME = "Name";
    public static final String KUBERNETES_CLUSTER = "KubernetesCluster";

    /** Value is the logical name of the public subnet the route table belongs to. */
    public static final String PUBLIC_ROUTE_TABLE_SUBNET_PAIR =
            "kubicorn-public-route-table-subnet-pair";

    /** Value is the cluster name. */
    public static final String INTERNET_GATEWAY_NAME = "kubicorn-internet-gateway-name";

    private static final String FILTER_PREFIX = "tag:";

    private TagConventions() {}

    /**
     * Provider filter name matching the given tag key.
     *
     * @param tagKey Tag key.
     * @return filter name, e.g. {@code tag:Name}.
     */
    public static String filterName(String tagKey) {
        return FILTER_PREFIX + tagKey;
    }

    /**
     * Descriptive tags every owned resource carries.
     *
     * @param name Human readable resource name.
     * @param clusterName Owning cluster.
     * @return mutable tag map.
     */
    public static Map<String, String> ownershipTags(String name, String clusterName) {
        var tags = new LinkedHashMap<String, String>();
        tags.put(NAME, name);
        tags.put(KUBERNETES_CLUSTER, clusterName);
        return tags;
    }
}
