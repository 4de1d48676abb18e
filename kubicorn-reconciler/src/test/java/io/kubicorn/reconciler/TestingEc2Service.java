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

import io.kubicorn.reconciler.api.tags.TagConventions;
import io.kubicorn.reconciler.service.Ec2Service;

import lombok.Getter;
import software.amazon.awssdk.services.ec2.model.Ec2Exception;
import software.amazon.awssdk.services.ec2.model.InternetGateway;
import software.amazon.awssdk.services.ec2.model.Route;
import software.amazon.awssdk.services.ec2.model.RouteTable;
import software.amazon.awssdk.services.ec2.model.RouteTableAssociation;
import software.amazon.awssdk.services.ec2.model.Tag;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/** In-memory EC2 service for tests. Records every call in order. */
public class TestingEc2Service implements Ec2Service {

    public static final String DESCRIBE_ROUTE_TABLES = "describeRouteTables";
    public static final String CREATE_ROUTE_TABLE = "createRouteTable";
    public static final String DESCRIBE_INTERNET_GATEWAYS = "describeInternetGateways";
    public static final String CREATE_ROUTE = "createRoute";
    public static final String ASSOCIATE_ROUTE_TABLE = "associateRouteTable";
    public static final String DISASSOCIATE_ROUTE_TABLE = "disassociateRouteTable";
    public static final String DELETE_ROUTE_TABLE = "deleteRouteTable";
    public static final String CREATE_TAGS = "createTags";

    @Getter private final List<String> calls = new ArrayList<>();
    @Getter private final List<Map<String, String>> tagRequests = new ArrayList<>();
    @Getter private final List<String> deletedRouteTableIds = new ArrayList<>();

    private final Map<String, FakeRouteTable> routeTables = new LinkedHashMap<>();
    private final List<InternetGateway> internetGateways = new ArrayList<>();
    private final Set<String> failingOperations = new HashSet<>();
    private int idCounter = 0;

    public void addInternetGateway(String gatewayId, String clusterName) {
        internetGateways.add(
                InternetGateway.builder()
                        .internetGatewayId(gatewayId)
                        .tags(tag(TagConventions.INTERNET_GATEWAY_NAME, clusterName))
                        .build());
    }

    /** Seeds a route table without going through the recorded operations. */
    public String addRouteTable(Map<String, String> tags, String... subnetIds) {
        var routeTable = new FakeRouteTable(nextId("rtb"), "vpc-seeded");
        routeTable.tags.putAll(tags);
        for (String subnetId : subnetIds) {
            routeTable.associations.put(nextId("rtbassoc"), subnetId);
        }
        routeTables.put(routeTable.id, routeTable);
        return routeTable.id;
    }

    public void failOn(String operation) {
        failingOperations.add(operation);
    }

    public void clearCalls() {
        calls.clear();
        tagRequests.clear();
    }

    public List<String> getMutations() {
        return calls.stream().filter(c -> !c.startsWith("describe")).collect(Collectors.toList());
    }

    public List<RouteTable> getRouteTables() {
        return routeTables.values().stream()
                .map(FakeRouteTable::toRouteTable)
                .collect(Collectors.toList());
    }

    @Override
    public List<RouteTable> describeRouteTablesByTag(String tagKey, String tagValue) {
        record(DESCRIBE_ROUTE_TABLES);
        return routeTables.values().stream()
                .filter(rt -> tagValue.equals(rt.tags.get(tagKey)))
                .map(FakeRouteTable::toRouteTable)
                .collect(Collectors.toList());
    }

    @Override
    public RouteTable createRouteTable(String vpcId) {
        record(CREATE_ROUTE_TABLE);
        var routeTable = new FakeRouteTable(nextId("rtb"), vpcId);
        routeTables.put(routeTable.id, routeTable);
        return routeTable.toRouteTable();
    }

    @Override
    public List<InternetGateway> describeInternetGatewaysByTag(String tagKey, String tagValue) {
        record(DESCRIBE_INTERNET_GATEWAYS);
        return internetGateways.stream()
                .filter(
                        gw ->
                                gw.tags().stream()
                                        .anyMatch(
                                                t ->
                                                        t.key().equals(tagKey)
                                                                && t.value().equals(tagValue)))
                .collect(Collectors.toList());
    }

    @Override
    public void createRoute(String routeTableId, String destinationCidrBlock, String gatewayId) {
        record(CREATE_ROUTE);
        getRouteTable(routeTableId).routes.put(destinationCidrBlock, gatewayId);
    }

    @Override
    public String associateRouteTable(String routeTableId, String subnetId) {
        record(ASSOCIATE_ROUTE_TABLE);
        var associationId = nextId("rtbassoc");
        getRouteTable(routeTableId).associations.put(associationId, subnetId);
        return associationId;
    }

    @Override
    public void disassociateRouteTable(String associationId) {
        record(DISASSOCIATE_ROUTE_TABLE);
        routeTables.values().stream()
                .filter(rt -> rt.associations.containsKey(associationId))
                .findFirst()
                .orElseThrow(() -> error("InvalidAssociationID.NotFound: " + associationId))
                .associations
                .remove(associationId);
    }

    @Override
    public void deleteRouteTable(String routeTableId) {
        record(DELETE_ROUTE_TABLE);
        if (!getRouteTable(routeTableId).associations.isEmpty()) {
            throw error("DependencyViolation: " + routeTableId + " has associations");
        }
        routeTables.remove(routeTableId);
        deletedRouteTableIds.add(routeTableId);
    }

    @Override
    public void createTags(String resourceId, Map<String, String> tags) {
        record(CREATE_TAGS);
        tagRequests.add(Map.copyOf(tags));
        getRouteTable(resourceId).tags.putAll(tags);
    }

    private void record(String operation) {
        calls.add(operation);
        if (failingOperations.contains(operation)) {
            throw error("Injected failure of " + operation);
        }
    }

    private FakeRouteTable getRouteTable(String routeTableId) {
        var routeTable = routeTables.get(routeTableId);
        if (routeTable == null) {
            throw error("InvalidRouteTableID.NotFound: " + routeTableId);
        }
        return routeTable;
    }

    private String nextId(String prefix) {
        return prefix + "-" + (++idCounter);
    }

    private static Tag tag(String key, String value) {
        return Tag.builder().key(key).value(value).build();
    }

    private static RuntimeException error(String message) {
        return Ec2Exception.builder().message(message).build();
    }

    private static class FakeRouteTable {
        private final String id;
        private final String vpcId;
        private final Map<String, String> tags = new LinkedHashMap<>();
        private final Map<String, String> associations = new LinkedHashMap<>();
        private final Map<String, String> routes = new LinkedHashMap<>();

        private FakeRouteTable(String id, String vpcId) {
            this.id = id;
            this.vpcId = vpcId;
        }

        private RouteTable toRouteTable() {
            return RouteTable.builder()
                    .routeTableId(id)
                    .vpcId(vpcId)
                    .tags(
                            tags.entrySet().stream()
                                    .map(e -> tag(e.getKey(), e.getValue()))
                                    .collect(Collectors.toList()))
                    .associations(
                            associations.entrySet().stream()
                                    .map(
                                            e ->
                                                    RouteTableAssociation.builder()
                                                            .routeTableAssociationId(e.getKey())
                                                            .routeTableId(id)
                                                            .subnetId(e.getValue())
                                                            .build())
                                    .collect(Collectors.toList()))
                    .routes(
                            routes.entrySet().stream()
                                    .map(
                                            e ->
                                                    Route.builder()
                                                            .destinationCidrBlock(e.getKey())
                                                            .gatewayId(e.getValue())
                                                            .build())
                                    .collect(Collectors.toList()))
                    .build();
        }
    }
}
