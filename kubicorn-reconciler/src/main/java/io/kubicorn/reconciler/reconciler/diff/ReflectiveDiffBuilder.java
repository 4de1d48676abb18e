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
import io.kubicorn.reconciler.api.diff.ResourceDiff;
import io.kubicorn.reconciler.exception.ResourceComparisonException;

import lombok.NonNull;
import org.apache.commons.lang3.ClassUtils;
import org.apache.commons.lang3.builder.Builder;
import org.apache.commons.lang3.reflect.FieldUtils;

import java.lang.reflect.Field;
import java.lang.reflect.InaccessibleObjectException;
import java.lang.reflect.Modifier;
import java.util.Map;
import java.util.TreeSet;

import static io.kubicorn.reconciler.api.diff.DiffType.APPLY;
import static org.apache.commons.lang3.reflect.FieldUtils.readField;

/**
 * Compares two resources of the same class with reflection. Map valued fields, such as tags, are
 * compared entry by entry so that every differing key shows up as its own {@link Diff}.
 *
 * <p>Inspired by:
 * https://github.com/apache/commons-lang/blob/master/src/main/java/org/apache/commons/lang3/builder/ReflectionDiffBuilder.java
 */
public class ReflectiveDiffBuilder<T> implements Builder<DiffResult<T>> {

    private final Object before;
    private final Object after;
    private final DiffBuilder<T> diffBuilder;

    public ReflectiveDiffBuilder(@NonNull final T before, @NonNull final T after) {
        this.before = before;
        this.after = after;
        diffBuilder = new DiffBuilder<>(before, after);
    }

    @Override
    public DiffResult<T> build() {
        if (before.equals(after)) {
            return diffBuilder.build();
        }

        appendFields(before.getClass());
        return diffBuilder.build();
    }

    private void appendFields(final Class<?> clazz) {
        for (final Field field : FieldUtils.getAllFields(clazz)) {
            if (!accept(field)) {
                continue;
            }
            try {
                var leftField = readField(field, before, true);
                var rightField = readField(field, after, true);
                var annotation = field.getAnnotation(ResourceDiff.class);
                DiffType type = annotation != null ? annotation.value() : APPLY;

                if (annotation != null && rightField == null && annotation.onNullIgnore()) {
                    continue;
                }

                if (Map.class.isAssignableFrom(field.getType())) {
                    diffBuilder.append(
                            field.getName(),
                            mapDiff((Map<?, ?>) leftField, (Map<?, ?>) rightField, type));
                } else {
                    diffBuilder.append(field.getName(), leftField, rightField, type);
                }
            } catch (final IllegalAccessException | InaccessibleObjectException ex) {
                throw new ResourceComparisonException(
                        String.format(
                                "Unable to read field [%s] of %s",
                                field.getName(), clazz.getSimpleName()),
                        ex);
            }
        }
    }

    private boolean accept(final Field field) {
        if (field.getName().indexOf(ClassUtils.INNER_CLASS_SEPARATOR_CHAR) != -1) {
            return false;
        }
        if (Modifier.isTransient(field.getModifiers())) {
            return false;
        }
        return !Modifier.isStatic(field.getModifiers());
    }

    private static DiffResult<Map<?, ?>> mapDiff(Map<?, ?> left, Map<?, ?> right, DiffType type) {
        Map<?, ?> l = left != null ? left : Map.of();
        Map<?, ?> r = right != null ? right : Map.of();
        var keys = new TreeSet<String>();
        l.keySet().forEach(k -> keys.add(String.valueOf(k)));
        r.keySet().forEach(k -> keys.add(String.valueOf(k)));
        var builder = new DiffBuilder<Map<?, ?>>(l, r);
        keys.forEach(key -> builder.append(key, l.get(key), r.get(key), type));
        return builder.build();
    }
}
