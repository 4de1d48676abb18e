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

package io.kubicorn.reconciler.api.utils;

import io.kubicorn.reconciler.api.cluster.ClusterSnapshot;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/** Cluster snapshot serialization utilities. */
public class ClusterSnapshotUtils {

    private static final ObjectMapper objectMapper = new ObjectMapper();
    private static final ObjectMapper yamlObjectMapper = new ObjectMapper(new YAMLFactory());

    /**
     * Reads a snapshot from a file. Files ending with {@code .json} are read as JSON, everything
     * else as YAML.
     *
     * @param file Cluster declaration file.
     * @return the parsed snapshot.
     * @throws IOException if the file cannot be read or parsed.
     */
    public static ClusterSnapshot readSnapshot(Path file) throws IOException {
        var mapper =
                file.getFileName().toString().endsWith(".json") ? objectMapper : yamlObjectMapper;
        return mapper.readValue(Files.readAllBytes(file), ClusterSnapshot.class);
    }

    /**
     * Reads a snapshot from a YAML (or JSON) string.
     *
     * @param content Serialized snapshot.
     * @return the parsed snapshot.
     */
    public static ClusterSnapshot readSnapshot(String content) {
        try {
            return yamlObjectMapper.readValue(content, ClusterSnapshot.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Could not parse cluster snapshot", e);
        }
    }

    public static String writeSnapshotAsYaml(ClusterSnapshot snapshot) {
        return write(yamlObjectMapper, snapshot);
    }

    public static String writeSnapshotAsJson(ClusterSnapshot snapshot) {
        return write(objectMapper, snapshot);
    }

    private static String write(ObjectMapper mapper, ClusterSnapshot snapshot) {
        try {
            return mapper.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Could not serialize snapshot, this indicates a bug...", e);
        }
    }
}
