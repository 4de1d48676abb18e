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

package io.kubicorn.reconciler.api.resources;

import org.apache.flink.annotation.Experimental;

import java.util.Map;

/**
 * Common view of a single infrastructure object handled by the reconciler.
 *
 * <p>The identifier is the provider assigned id of the object and is empty as long as the object
 * is not known to exist on the provider.
 */
@Experimental
public interface CloudResource {

    /**
     * Logical name, stable across reconciliations.
     *
     * @return the name of the resource.
     */
    String getName();

    /**
     * Provider assigned id.
     *
     * @return the id, or an empty string if the object does not exist (yet).
     */
    String getIdentifier();

    /**
     * Tags of the resource.
     *
     * @return tag key to tag value mapping.
     */
    Map<String, String> getTags();

    default boolean hasIdentifier() {
        return getIdentifier() != null && !getIdentifier().isEmpty();
    }
}
