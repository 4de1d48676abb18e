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

package io.kubicorn.reconciler.reconciler;

import io.kubicorn.reconciler.api.cluster.ClusterSnapshot;
import io.kubicorn.reconciler.api.diff.DiffType;
import io.kubicorn.reconciler.api.resources.CloudResource;
import io.kubicorn.reconciler.config.ReconcilerConfiguration;
import io.kubicorn.reconciler.exception.MissingIdentifierException;
import io.kubicorn.reconciler.reconciler.diff.ResourceComparator;
import io.kubicorn.reconciler.service.Ec2Service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * BaseResourceReconciler with functionality that is common to all resource kinds.
 *
 * @param <R> The resource kind.
 */
public abstract class BaseResourceReconciler<R extends CloudResource>
        implements ResourceReconciler<R>, ImmutableClusterRenderer<R> {

    private static final Logger LOG = LoggerFactory.getLogger(BaseResourceReconciler.class);

    protected final Ec2Service ec2Service;
    protected final ResourceComparator comparator;
    protected final ReconcilerConfiguration configuration;

    public BaseResourceReconciler(
            Ec2Service ec2Service,
            ResourceComparator comparator,
            ReconcilerConfiguration configuration) {
        this.ec2Service = ec2Service;
        this.comparator = comparator;
        this.configuration = configuration;
    }

    /** Human readable name of the resource kind, used in logs and errors. */
    protected abstract String kind();

    /**
     * Checks whether the provider already matches the expected state. A resource without
     * identifier is never in sync.
     */
    protected boolean isInSync(R actual, R expected) {
        if (!actual.hasIdentifier()) {
            LOG.info("{} [{}] does not exist yet", kind(), expected.getName());
            return false;
        }
        var diff = comparator.diff(actual, expected);
        boolean equal = diff.getType() == DiffType.IGNORE;
        if (!equal) {
            LOG.info("{} [{}] is not in sync. {}", kind(), expected.getName(), diff);
        }
        return equal;
    }

    /**
     * Applies the tags to the provider object in a single call.
     *
     * @param resource resource carrying the provider identifier
     * @param tags tags to apply
     */
    protected void tag(R resource, Map<String, String> tags) {
        LOG.debug("Tagging {} {}", kind(), resource.getName());
        if (!resource.hasIdentifier()) {
            throw new MissingIdentifierException("tag", kind(), resource.getName());
        }
        ec2Service.createTags(resource.getIdentifier(), tags);
    }

    @Override
    public ClusterSnapshot render(R resource, ClusterSnapshot previous) {
        return previous;
    }

    protected ReconcileResult<R> result(R resource, ClusterSnapshot previous) {
        return ReconcileResult.of(render(resource, previous), resource);
    }
}
