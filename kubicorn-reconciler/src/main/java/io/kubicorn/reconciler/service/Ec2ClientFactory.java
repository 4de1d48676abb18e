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

import org.apache.flink.annotation.VisibleForTesting;

import io.kubicorn.reconciler.config.ReconcilerConfiguration;

import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.AwsSessionCredentials;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.http.urlconnection.UrlConnectionHttpClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.ec2.Ec2Client;

import java.net.URI;

/** Creates the EC2 client from the reconciler configuration. */
public class Ec2ClientFactory {

    public static Ec2Client createClient(ReconcilerConfiguration configuration) {
        var builder =
                Ec2Client.builder()
                        .region(Region.of(configuration.getRegion()))
                        .httpClient(UrlConnectionHttpClient.create())
                        .credentialsProvider(resolveCredentials(configuration));
        if (configuration.getEndpointOverride() != null) {
            builder.endpointOverride(URI.create(configuration.getEndpointOverride()));
        }
        return builder.build();
    }

    @VisibleForTesting
    static AwsCredentialsProvider resolveCredentials(ReconcilerConfiguration configuration) {
        if (!configuration.hasStaticCredentials()) {
            return DefaultCredentialsProvider.create();
        }
        AwsCredentials credentials =
                configuration.getSessionToken() != null
                        ? AwsSessionCredentials.create(
                                configuration.getAccessKeyId(),
                                configuration.getSecretAccessKey(),
                                configuration.getSessionToken())
                        : AwsBasicCredentials.create(
                                configuration.getAccessKeyId(), configuration.getSecretAccessKey());
        return StaticCredentialsProvider.create(credentials);
    }
}
