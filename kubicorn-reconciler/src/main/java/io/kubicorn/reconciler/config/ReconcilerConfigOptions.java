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

package io.kubicorn.reconciler.config;

import org.apache.flink.configuration.ConfigOption;
import org.apache.flink.configuration.ConfigOptions;

/** This class holds configuration constants used by the reconciler. */
public class ReconcilerConfigOptions {

    public static final String RECONCILER_CONF_PREFIX = "kubicorn.reconciler.";

    public static ConfigOptions.OptionBuilder reconcilerConfig(String key) {
        return ConfigOptions.key(RECONCILER_CONF_PREFIX + key);
    }

    public static final ConfigOption<String> AWS_REGION =
            reconcilerConfig("aws.region")
                    .stringType()
                    .defaultValue("us-west-2")
                    .withDescription("AWS region the cluster is provisioned in.");

    public static final ConfigOption<String> AWS_ENDPOINT_OVERRIDE =
            reconcilerConfig("aws.endpoint-override")
                    .stringType()
                    .noDefaultValue()
                    .withDescription(
                            "Endpoint URI used instead of the regional EC2 endpoint, e.g. for local emulators.");

    public static final ConfigOption<String> AWS_ACCESS_KEY_ID =
            reconcilerConfig("aws.access-key-id")
                    .stringType()
                    .noDefaultValue()
                    .withDescription(
                            "Static access key id. The default credentials provider chain is used when either key is unset.");

    public static final ConfigOption<String> AWS_SECRET_ACCESS_KEY =
            reconcilerConfig("aws.secret-access-key")
                    .stringType()
                    .noDefaultValue()
                    .withDescription("Static secret access key.");

    public static final ConfigOption<String> AWS_SESSION_TOKEN =
            reconcilerConfig("aws.session-token")
                    .stringType()
                    .noDefaultValue()
                    .withDescription("Session token used together with the static keys.");

    public static final ConfigOption<String> ROUTE_DEFAULT_DESTINATION_CIDR =
            reconcilerConfig("route.default-destination-cidr")
                    .stringType()
                    .defaultValue("0.0.0.0/0")
                    .withDescription(
                            "Destination CIDR of the route pointing public route tables at the internet gateway.");
}
