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

import org.apache.flink.configuration.Configuration;

import io.kubicorn.reconciler.config.ReconcilerConfigOptions;
import io.kubicorn.reconciler.config.ReconcilerConfiguration;

import org.junit.jupiter.api.Test;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsSessionCredentials;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.services.ec2.Ec2Client;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;

/** Tests for {@link Ec2ClientFactory}. */
public class Ec2ClientFactoryTest {

    @Test
    public void testDefaultCredentialsWithoutStaticKeys() {
        var conf = new Configuration();
        conf.set(ReconcilerConfigOptions.AWS_ACCESS_KEY_ID, "access");

        var provider =
                Ec2ClientFactory.resolveCredentials(
                        ReconcilerConfiguration.fromConfiguration(conf));

        assertInstanceOf(DefaultCredentialsProvider.class, provider);
    }

    @Test
    public void testStaticCredentials() {
        var conf = new Configuration();
        conf.set(ReconcilerConfigOptions.AWS_ACCESS_KEY_ID, "access");
        conf.set(ReconcilerConfigOptions.AWS_SECRET_ACCESS_KEY, "secret");

        var provider =
                Ec2ClientFactory.resolveCredentials(
                        ReconcilerConfiguration.fromConfiguration(conf));

        assertInstanceOf(StaticCredentialsProvider.class, provider);
        var credentials =
                assertInstanceOf(AwsBasicCredentials.class, provider.resolveCredentials());
        assertEquals("access", credentials.accessKeyId());
        assertEquals("secret", credentials.secretAccessKey());
    }

    @Test
    public void testSessionCredentials() {
        var conf = new Configuration();
        conf.set(ReconcilerConfigOptions.AWS_ACCESS_KEY_ID, "access");
        conf.set(ReconcilerConfigOptions.AWS_SECRET_ACCESS_KEY, "secret");
        conf.set(ReconcilerConfigOptions.AWS_SESSION_TOKEN, "token");

        var provider =
                Ec2ClientFactory.resolveCredentials(
                        ReconcilerConfiguration.fromConfiguration(conf));

        var credentials =
                assertInstanceOf(AwsSessionCredentials.class, provider.resolveCredentials());
        assertEquals("token", credentials.sessionToken());
    }

    @Test
    public void testCreateClientWithEndpointOverride() {
        var conf = new Configuration();
        conf.set(ReconcilerConfigOptions.AWS_REGION, "eu-central-1");
        conf.set(ReconcilerConfigOptions.AWS_ENDPOINT_OVERRIDE, "http://localhost:4566");
        conf.set(ReconcilerConfigOptions.AWS_ACCESS_KEY_ID, "test");
        conf.set(ReconcilerConfigOptions.AWS_SECRET_ACCESS_KEY, "test");

        try (Ec2Client client =
                Ec2ClientFactory.createClient(ReconcilerConfiguration.fromConfiguration(conf))) {
            assertEquals(Ec2Client.SERVICE_NAME, client.serviceName());
        }
    }
}
