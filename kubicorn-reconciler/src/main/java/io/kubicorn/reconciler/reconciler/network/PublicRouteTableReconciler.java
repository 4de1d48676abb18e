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

package io.kubicorn.reconciler.reconciler.network;

import io.kubicorn.reconciler.api.cluster.ClusterSnapshot;
import io.kubicorn.reconciler.api.cluster.PublicSubnet;
import io.kubicorn.reconciler.api.resources.PublicRouteTable;
import io.kubicorn.reconciler.api.tags.TagConventions;
import io.kubicorn.reconciler.config.ReconcilerConfiguration;
import io.kubicorn.reconciler.exception.AmbiguousResourceException;
import io.kubicorn.reconciler.exception.DependencyResolutionException;
import io.kubicorn.reconciler.exception.MissingIdentifierException;
import io.kubicorn.reconciler.reconciler.BaseResourceReconciler;
import io.kubicorn.reconciler.reconciler.ReconcileResult;
import io.kubicorn.reconciler.reconciler.ReconcileTarget;
import io.kubicorn.reconciler.reconciler.diff.ResourceComparator;
import io.kubicorn.reconciler.service.Ec2Service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.ec2.model.RouteTable;
import software.amazon.awssdk.services.ec2.model.Tag;

import java.util.List;
import java.util.stream.Collectors;

import static io.kubicorn.reconciler.api.tags.TagConventions.INTERNET_GATEWAY_NAME;
import static io.kubicorn.reconciler.api.tags.TagConventions.PUBLIC_ROUTE_TABLE_SUBNET_PAIR;

/**
 * Reconciles the route table of a public subnet. The route table is correlated to its subnet only
 * through the {@link TagConventions#PUBLIC_ROUTE_TABLE_SUBNET_PAIR} tag, and routes all traffic to
 * the internet gateway tagged with the cluster name.
 */
public class PublicRouteTableReconciler extends BaseResourceReconciler<PublicRouteTable> {

    private static final Logger LOG = LoggerFactory.getLogger(PublicRouteTableReconciler.class);

    public PublicRouteTableReconciler(
            Ec2Service ec2Service,
            ResourceComparator comparator,
            ReconcilerConfiguration configuration) {
        super(ec2Service, comparator, configuration);
    }

    /**
     * Declares one route table per public subnet of the snapshot, in subnet order.
     *
     * @param snapshot the cluster snapshot
     * @return reconcile targets of this reconciler
     */
    public List<ReconcileTarget<PublicRouteTable>> targets(ClusterSnapshot snapshot) {
        return snapshot.getNetwork().getPublicSubnets().stream()
                .map(PublicRouteTable::forSubnet)
                .map(routeTable -> ReconcileTarget.of(this, routeTable))
                .collect(Collectors.toList());
    }

    @Override
    protected String kind() {
        return "public route table";
    }

    @Override
    public ReconcileResult<PublicRouteTable> actual(
            PublicRouteTable declared, ClusterSnapshot snapshot) {
        LOG.debug("Observing public route table {}", declared.getName());
        var subnet = resolveSubnet(declared, snapshot);
        var builder =
                PublicRouteTable.builder().name(declared.getName()).clusterPublicSubnet(subnet);

        // Nothing can exist before the subnet does
        if (subnet.hasIdentifier()) {
            List<RouteTable> routeTables =
                    ec2Service.describeRouteTablesByTag(
                            PUBLIC_ROUTE_TABLE_SUBNET_PAIR, subnet.getName());
            if (!routeTables.isEmpty()) {
                for (Tag tag : routeTables.get(0).tags()) {
                    builder.tag(tag.key(), tag.value());
                }
                builder.name(subnet.getName()).identifier(subnet.getName());
            }
        }
        return result(builder.build(), snapshot);
    }

    @Override
    public ReconcileResult<PublicRouteTable> expected(
            PublicRouteTable declared, ClusterSnapshot snapshot) {
        LOG.debug("Computing expected public route table {}", declared.getName());
        var subnet = resolveSubnet(declared, snapshot);
        var tags = TagConventions.ownershipTags(declared.getName(), snapshot.getName());
        tags.put(PUBLIC_ROUTE_TABLE_SUBNET_PAIR, subnet.getName());
        var expected =
                PublicRouteTable.builder()
                        .name(subnet.getName())
                        .identifier(subnet.getName())
                        .tags(tags)
                        .clusterPublicSubnet(subnet)
                        .build();
        return result(expected, snapshot);
    }

    @Override
    public ReconcileResult<PublicRouteTable> apply(
            PublicRouteTable declared,
            PublicRouteTable actual,
            PublicRouteTable expected,
            ClusterSnapshot snapshot) {
        LOG.debug("Applying public route table {}", declared.getName());
        if (isInSync(actual, expected)) {
            LOG.info("Public route table [{}] is in sync, nothing to do", expected.getName());
            return ReconcileResult.of(snapshot, expected);
        }

        var routeTableId =
                ec2Service.createRouteTable(snapshot.getNetwork().getIdentifier()).routeTableId();
        LOG.info("Created public route table [{}]", routeTableId);

        var gateways =
                ec2Service.describeInternetGatewaysByTag(INTERNET_GATEWAY_NAME, snapshot.getName());
        if (gateways.size() != 1) {
            throw new AmbiguousResourceException(
                    "internet gateways",
                    gateways.size(),
                    INTERNET_GATEWAY_NAME,
                    snapshot.getName());
        }
        var gatewayId = gateways.get(0).internetGatewayId();
        LOG.info(
                "Mapping public route table [{}] to internet gateway [{}]",
                routeTableId,
                gatewayId);
        ec2Service.createRoute(
                routeTableId, configuration.getDefaultRouteDestinationCidr(), gatewayId);

        var subnetId = findSubnetIdentifier(declared.getName(), snapshot);
        ec2Service.associateRouteTable(routeTableId, subnetId);
        LOG.info("Associated route table [{}] with public subnet [{}]", routeTableId, subnetId);

        var applied =
                PublicRouteTable.builder()
                        .name(expected.getName())
                        .identifier(routeTableId)
                        .tags(expected.getTags())
                        .clusterPublicSubnet(expected.getClusterPublicSubnet())
                        .build();
        tag(applied, expected.getTags());
        return result(applied, snapshot);
    }

    @Override
    public ReconcileResult<PublicRouteTable> delete(
            PublicRouteTable declared, PublicRouteTable actual, ClusterSnapshot snapshot) {
        LOG.debug("Deleting public route table {}", declared.getName());
        if (!actual.hasIdentifier()) {
            throw new MissingIdentifierException("delete", kind(), actual.getName());
        }

        // Look up by tag, the identifier of the actual resource is the subnet handle
        var subnetName = resolveSubnet(declared, snapshot).getName();
        var routeTables =
                ec2Service.describeRouteTablesByTag(PUBLIC_ROUTE_TABLE_SUBNET_PAIR, subnetName);
        if (routeTables.size() != 1) {
            throw new AmbiguousResourceException(
                    "public route tables",
                    routeTables.size(),
                    PUBLIC_ROUTE_TABLE_SUBNET_PAIR,
                    subnetName);
        }
        var routeTable = routeTables.get(0);

        if (routeTable.associations().isEmpty()) {
            LOG.warn(
                    "Public route table [{}] has no subnet association",
                    routeTable.routeTableId());
        } else {
            ec2Service.disassociateRouteTable(
                    routeTable.associations().get(0).routeTableAssociationId());
        }
        ec2Service.deleteRouteTable(routeTable.routeTableId());
        LOG.info("Deleted public route table [{}]", routeTable.routeTableId());

        var deleted =
                PublicRouteTable.builder()
                        .name(actual.getName())
                        .tags(actual.getTags())
                        .clusterPublicSubnet(actual.getClusterPublicSubnet())
                        .build();
        return result(deleted, snapshot);
    }

    /** The subnet record of the current snapshot wins over the one captured at declaration. */
    private static PublicSubnet resolveSubnet(PublicRouteTable declared, ClusterSnapshot snapshot) {
        var declaredSubnet = declared.getClusterPublicSubnet();
        return snapshot.findPublicSubnet(declaredSubnet.getName()).orElse(declaredSubnet);
    }

    private static String findSubnetIdentifier(String subnetName, ClusterSnapshot snapshot) {
        return snapshot.findPublicSubnet(subnetName)
                .filter(PublicSubnet::hasIdentifier)
                .map(PublicSubnet::getIdentifier)
                .orElseThrow(
                        () ->
                                new DependencyResolutionException(
                                        String.format(
                                                "Unable to find public subnet identifier for [%s]",
                                                subnetName)));
    }
}
