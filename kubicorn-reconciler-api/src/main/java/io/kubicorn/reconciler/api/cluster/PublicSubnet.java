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

package io.kubicorn.reconciler.api.cluster;

import org.apache.flink.annotation.Experimental;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/** Public subnet record of the cluster network. */
@Experimental
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class PublicSubnet {

    /** Logical subnet name. */
    @NonNull String name;

    /** Provider assigned subnet id, empty until the subnet exists. */
    @NonNull @Builder.Default String identifier = "";

    /** CIDR block of the subnet. */
    String cidr;

    /** Availability zone. */
    String zone;

    @JsonIgnore
    public boolean hasIdentifier() {
        return !identifier.isEmpty();
    }
}
