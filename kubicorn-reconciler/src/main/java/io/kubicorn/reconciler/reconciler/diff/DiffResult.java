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

import lombok.Getter;
import lombok.NonNull;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Contains a collection of the differences between two resources.
 *
 * <p>Inspired by:
 * https://github.com/apache/commons-lang/blob/master/src/main/java/org/apache/commons/lang3/builder/DiffResult.java
 */
@Getter
public class DiffResult<T> {
    @NonNull private final List<Diff<?>> diffList;
    @NonNull private final T before;
    @NonNull private final T after;
    @NonNull private final DiffType type;

    DiffResult(@NonNull T before, @NonNull T after, @NonNull List<Diff<?>> diffList) {
        this.before = before;
        this.after = after;
        this.diffList = List.copyOf(diffList);
        this.type =
                DiffType.from(diffList.stream().map(Diff::getType).collect(Collectors.toList()));
    }

    public int getNumDiffs() {
        return diffList.size();
    }

    @Override
    public String toString() {
        if (diffList.isEmpty()) {
            return "";
        }

        return String.format(
                "Diff: %s[%s]",
                before.getClass().getSimpleName(),
                diffList.stream()
                        .map(
                                diff ->
                                        diff.getFieldName()
                                                + " : "
                                                + diff.getLeft()
                                                + " -> "
                                                + diff.getRight())
                        .collect(Collectors.joining(", ")));
    }
}
