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

package io.kubicorn.reconciler.exception;

import lombok.Getter;

/** Thrown when a tag lookup that must match exactly one provider object matches zero or many. */
@Getter
public class AmbiguousResourceException extends ReconciliationException {

    private static final long serialVersionUID = -2860134447563722310L;

    private final int count;
    private final String tagKey;
    private final String tagValue;

    public AmbiguousResourceException(String kind, int count, String tagKey, String tagValue) {
        super(String.format("Found [%d] %s for tag [%s=%s]", count, kind, tagKey, tagValue));
        this.count = count;
        this.tagKey = tagKey;
        this.tagValue = tagValue;
    }
}
