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

package io.kubicorn.reconciler.service;

import software.amazon.awssdk.services.ec2.model.InternetGateway;
import software.amazon.awssdk.services.ec2.model.RouteTable;

import java.util.List;
import java.util.Map;

/**
 * The EC2 operations used by the reconcilers.
 *
 * <p>Every operation is a single blocking provider call. Failures surface as {@link
 * software.amazon.awssdk.core.exception.SdkException} and are never retried here.
 */
public interface Ec2Service extends AutoCloseable {

    /**
     * Lists the route tables carrying the given tag.
     *
     * @param tagKey Tag key used as filter.
     * @param tagValue Required tag value.
     * @return matching route tables, possibly empty.
     */
    List<RouteTable> describeRouteTablesByTag(String tagKey, String tagValue);

    /**
     * Creates an empty route table in the given VPC.
     *
     * @param vpcId VPC id.
     * @return the created route table.
     */
    RouteTable createRouteTable(String vpcId);

    List<InternetGateway> describeInternetGatewaysByTag(String tagKey, String tagValue);

    void createRoute(String routeTableId, String destinationCidrBlock, String gatewayId);

    /**
     * Associates a route table with a subnet.
     *
     * @return the association id.
     */
    String associateRouteTable(String routeTableId, String subnetId);

    void disassociateRouteTable(String associationId);

    void deleteRouteTable(String routeTableId);

    /**
     * Applies all tags to the resource in one call.
     *
     * @param resourceId Id of any taggable EC2 resource.
     * @param tags Tags to apply.
     */
    void createTags(String resourceId, Map<String, String> tags);

    /** Releases the underlying client, a no-op for services without one. */
    @Override
    default void close() {}
}
