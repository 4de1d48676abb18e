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

/** Thrown before any provider call when an operation needs a provider id that is not known. */
@Getter
public class MissingIdentifierException extends ReconciliationException {

    private static final long serialVersionUID = 3462198764002671452L;

    private final String resourceName;

    public MissingIdentifierException(String operation, String kind, String resourceName) {
        super(
                String.format(
                        "Unable to %s %s resource without identifier [%s]",
                        operation, kind, resourceName));
        this.resourceName = resourceName;
    }
}
