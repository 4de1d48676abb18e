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

import io.kubicorn.reconciler.api.tags.TagConventions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.ec2.Ec2Client;
import software.amazon.awssdk.services.ec2.model.AssociateRouteTableRequest;
import software.amazon.awssdk.services.ec2.model.CreateRouteRequest;
import software.amazon.awssdk.services.ec2.model.CreateRouteTableRequest;
import software.amazon.awssdk.services.ec2.model.CreateTagsRequest;
import software.amazon.awssdk.services.ec2.model.DeleteRouteTableRequest;
import software.amazon.awssdk.services.ec2.model.DescribeInternetGatewaysRequest;
import software.amazon.awssdk.services.ec2.model.DescribeRouteTablesRequest;
import software.amazon.awssdk.services.ec2.model.DisassociateRouteTableRequest;
import software.amazon.awssdk.services.ec2.model.Filter;
import software.amazon.awssdk.services.ec2.model.InternetGateway;
import software.amazon.awssdk.services.ec2.model.RouteTable;
import software.amazon.awssdk.services.ec2.model.Tag;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** {@link Ec2Service} backed by the AWS SDK EC2 client. */
public class AwsEc2Service implements Ec2Service {

    private static final Logger LOG = LoggerFactory.getLogger(AwsEc2Service.class);

    private final Ec2Client ec2Client;

    public AwsEc2Service(Ec2Client ec2Client) {
        this.ec2Client = ec2Client;
    }

    @Override
    public List<RouteTable> describeRouteTablesByTag(String tagKey, String tagValue) {
        LOG.debug("Describing route tables with tag [{}={}]", tagKey, tagValue);
        return ec2Client
                .describeRouteTables(
                        DescribeRouteTablesRequest.builder()
                                .filters(tagFilter(tagKey, tagValue))
                                .build())
                .routeTables();
    }

    @Override
    public RouteTable createRouteTable(String vpcId) {
        return ec2Client
                .createRouteTable(CreateRouteTableRequest.builder().vpcId(vpcId).build())
                .routeTable();
    }

    @Override
    public List<InternetGateway> describeInternetGatewaysByTag(String tagKey, String tagValue) {
        LOG.debug("Describing internet gateways with tag [{}={}]", tagKey, tagValue);
        return ec2Client
                .describeInternetGateways(
                        DescribeInternetGatewaysRequest.builder()
                                .filters(tagFilter(tagKey, tagValue))
                                .build())
                .internetGateways();
    }

    @Override
    public void createRoute(String routeTableId, String destinationCidrBlock, String gatewayId) {
        ec2Client.createRoute(
                CreateRouteRequest.builder()
                        .routeTableId(routeTableId)
                        .destinationCidrBlock(destinationCidrBlock)
                        .gatewayId(gatewayId)
                        .build());
    }

    @Override
    public String associateRouteTable(String routeTableId, String subnetId) {
        return ec2Client
                .associateRouteTable(
                        AssociateRouteTableRequest.builder()
                                .routeTableId(routeTableId)
                                .subnetId(subnetId)
                                .build())
                .associationId();
    }

    @Override
    public void disassociateRouteTable(String associationId) {
        ec2Client.disassociateRouteTable(
                DisassociateRouteTableRequest.builder().associationId(associationId).build());
    }

    @Override
    public void deleteRouteTable(String routeTableId) {
        ec2Client.deleteRouteTable(
                DeleteRouteTableRequest.builder().routeTableId(routeTableId).build());
    }

    @Override
    public void createTags(String resourceId, Map<String, String> tags) {
        List<Tag> sdkTags = new ArrayList<>();
        tags.forEach(
                (key, value) -> {
                    LOG.debug("Registering tag [{}] {} on {}", key, value, resourceId);
                    sdkTags.add(Tag.builder().key(key).value(value).build());
                });
        ec2Client.createTags(
                CreateTagsRequest.builder().resources(resourceId).tags(sdkTags).build());
    }

    @Override
    public void close() {
        ec2Client.close();
    }

    private static Filter tagFilter(String tagKey, String tagValue) {
        return Filter.builder().name(TagConventions.filterName(tagKey)).values(tagValue).build();
    }
}
