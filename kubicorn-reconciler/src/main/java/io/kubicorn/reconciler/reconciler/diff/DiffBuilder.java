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

import lombok.NonNull;
import org.apache.commons.lang3.builder.Builder;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Assists in comparing two resources field by field.
 *
 * <p>Inspired by:
 * https://github.com/apache/commons-lang/blob/master/src/main/java/org/apache/commons/lang3/builder/DiffBuilder.java
 */
public class DiffBuilder<T> implements Builder<DiffResult<T>> {

    private static final String DELIMITER = ".";

    private final T before;
    private final T after;

    private final List<Diff<?>> diffs;
    private final boolean triviallyEqual;

    public DiffBuilder(@NonNull final T before, @NonNull final T after) {
        this.diffs = new ArrayList<>();
        this.before = before;
        this.after = after;
        this.triviallyEqual = before == after || before.equals(after);
    }

    public DiffBuilder<T> append(
            @NonNull final String fieldName, final Object left, final Object right, DiffType type) {
        if (triviallyEqual || left == right) {
            return this;
        }

        if (left instanceof Object[] && right instanceof Object[]) {
            if (!Arrays.equals((Object[]) left, (Object[]) right)) {
                diffs.add(new Diff<>(fieldName, left, right, type));
            }
            return this;
        }

        if (left != null && left.equals(right)) {
            return this;
        }

        diffs.add(new Diff<>(fieldName, left, right, type));
        return this;
    }

    public DiffBuilder<T> append(
            @NonNull final String fieldName, @NonNull final DiffResult<?> diffResult) {
        if (triviallyEqual) {
            return this;
        }
        diffResult
                .getDiffList()
                .forEach(
                        diff ->
                                append(
                                        fieldName + DELIMITER + diff.getFieldName(),
                                        diff.getLeft(),
                                        diff.getRight(),
                                        diff.getType()));
        return this;
    }

    @Override
    public DiffResult<T> build() {
        return new DiffResult<>(before, after, diffs);
    }
}
