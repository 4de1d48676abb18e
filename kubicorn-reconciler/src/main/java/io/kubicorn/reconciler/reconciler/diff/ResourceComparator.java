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

package io.kubicorn.reconciler.reconciler.diff;

import io.kubicorn.reconciler.api.diff.DiffType;
import io.kubicorn.reconciler.api.resources.CloudResource;
import io.kubicorn.reconciler.exception.ResourceComparisonException;

/**
 * Structural comparison of an actual and an expected resource. Two resources are equal when no
 * field, other than the ones annotated with {@code @ResourceDiff(DiffType.IGNORE)}, differs.
 */
public class ResourceComparator {

    public <R extends CloudResource> DiffResult<R> diff(R actual, R expected) {
        if (actual == null || expected == null) {
            throw new ResourceComparisonException(
                    String.format("Cannot compare [%s] with [%s]", actual, expected));
        }
        if (actual.getClass() != expected.getClass()) {
            throw new ResourceComparisonException(
                    String.format(
                            "Cannot compare %s with %s",
                            actual.getClass().getSimpleName(),
                            expected.getClass().getSimpleName()));
        }
        return new ReflectiveDiffBuilder<>(actual, expected).build();
    }

    public <R extends CloudResource> boolean isEqual(R actual, R expected) {
        return diff(actual, expected).getType() == DiffType.IGNORE;
    }
}
