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

import org.apache.flink.annotation.VisibleForTesting;
import org.apache.flink.configuration.Configuration;
import org.apache.flink.configuration.GlobalConfiguration;

import io.kubicorn.reconciler.utils.EnvUtils;

import lombok.Value;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/** Configuration class for the reconciler. */
@Value
public class ReconcilerConfiguration {

    private static final Logger LOG = LoggerFactory.getLogger(ReconcilerConfiguration.class);

    String region;
    String endpointOverride;
    String accessKeyId;
    String secretAccessKey;
    String sessionToken;
    String defaultRouteDestinationCidr;

    public static ReconcilerConfiguration fromConfiguration(Configuration config) {
        return new ReconcilerConfiguration(
                config.get(ReconcilerConfigOptions.AWS_REGION),
                StringUtils.trimToNull(config.get(ReconcilerConfigOptions.AWS_ENDPOINT_OVERRIDE)),
                StringUtils.trimToNull(config.get(ReconcilerConfigOptions.AWS_ACCESS_KEY_ID)),
                StringUtils.trimToNull(config.get(ReconcilerConfigOptions.AWS_SECRET_ACCESS_KEY)),
                StringUtils.trimToNull(config.get(ReconcilerConfigOptions.AWS_SESSION_TOKEN)),
                config.get(ReconcilerConfigOptions.ROUTE_DEFAULT_DESTINATION_CIDR));
    }

    public boolean hasStaticCredentials() {
        return accessKeyId != null && secretAccessKey != null;
    }

    public static ReconcilerConfiguration load() {
        return fromConfiguration(loadGlobalConfiguration(EnvUtils.get(EnvUtils.ENV_CONF_DIR)));
    }

    @VisibleForTesting
    static Configuration loadGlobalConfiguration(Optional<String> confDir) {
        if (confDir.isPresent()) {
            LOG.debug("Loading configuration from {}", confDir.get());
            return GlobalConfiguration.loadConfiguration(confDir.get());
        }
        LOG.debug("No configuration directory set, using defaults");
        return new Configuration();
    }
}
