/*
 * ResourceModes.java
 *
 * This source file is part of the KubeStellar placement engine project
 *
 * Copyright 2024 The KubeStellar Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.kubestellar.placement.binding;

import io.kubestellar.annotation.API;
import com.google.common.collect.ImmutableSet;

import javax.annotation.Nonnull;

/**
 * Policy telling how each resource is handled. Implementations are pure functions.
 */
@API(API.Status.UNSTABLE)
@FunctionalInterface
public interface ResourceModes {
    @Nonnull
    ResourceMode modeOf(@Nonnull GroupResource groupResource);

    /**
     * The platform's standard policy: user-defined resources go to the edge naturally denatured, and a fixed list of
     * control-plane resources is treated specially.
     */
    ResourceModes DEFAULT = Defaults::modeOf;

    /**
     * The tables behind {@link #DEFAULT}.
     */
    final class Defaults {
        static final ImmutableSet<GroupResource> FORCIBLY_DENATURED = ImmutableSet.of(
                GroupResource.of("admissionregistration.k8s.io", "mutatingwebhookconfigurations"),
                GroupResource.of("admissionregistration.k8s.io", "validatingwebhookconfigurations"),
                GroupResource.of("flowcontrol.apiserver.k8s.io", "flowschemas"),
                GroupResource.of("flowcontrol.apiserver.k8s.io", "prioritylevelconfigurations"),
                GroupResource.of("rbac.authorization.k8s.io", "clusterroles"),
                GroupResource.of("rbac.authorization.k8s.io", "clusterrolebindings"),
                GroupResource.of("rbac.authorization.k8s.io", "roles"),
                GroupResource.of("rbac.authorization.k8s.io", "rolebindings"),
                GroupResource.of("", "limitranges"),
                GroupResource.of("", "resourcequotas"),
                GroupResource.of("", "serviceaccounts"));

        static final ImmutableSet<GroupResource> NATURED_IN_BOTH = ImmutableSet.of(
                GroupResource.CRDS,
                GroupResource.NAMESPACES);

        static final ImmutableSet<GroupResource> NATURED_IN_CENTER_NO_GO = ImmutableSet.of(
                GroupResource.of("apis.kcp.io", "apibindings"));

        static final ImmutableSet<GroupResource> NOT_SUPPORTED = ImmutableSet.of(
                GroupResource.of("apiregistration.k8s.io", "apiservices"),
                GroupResource.of("apiresource.kcp.io", "apiresourceimports"),
                GroupResource.of("apiresource.kcp.io", "negotiatedapiresources"),
                GroupResource.of("apis.kcp.io", "apiconversions"));

        static final ImmutableSet<String> GROUPS_NOT_FOR_EDGE = ImmutableSet.of(
                "edge.kcp.io",
                "scheduling.kcp.io",
                "tenancy.kcp.io",
                "topology.kcp.io",
                "workload.kcp.io");

        static final ImmutableSet<GroupResource> NOT_FOR_EDGE = ImmutableSet.of(
                GroupResource.of("apis.kcp.io", "apiexports"),
                GroupResource.of("apis.kcp.io", "apiexportendpointslices"),
                GroupResource.of("apis.kcp.io", "apiresourceschemas"),
                GroupResource.of("apps", "controllerrevisions"),
                GroupResource.of("authentication.k8s.io", "tokenreviews"),
                GroupResource.of("authorization.k8s.io", "localsubjectaccessreviews"),
                GroupResource.of("authorization.k8s.io", "selfsubjectaccessreviews"),
                GroupResource.of("authorization.k8s.io", "selfsubjectrulesreviews"),
                GroupResource.of("authorization.k8s.io", "subjectaccessreviews"),
                GroupResource.of("certificates.k8s.io", "certificatesigningrequests"),
                GroupResource.of("core.kcp.io", "logicalclusters"),
                GroupResource.of("core.kcp.io", "shards"),
                GroupResource.of("events.k8s.io", "events"),
                GroupResource.of("", "bindings"),
                GroupResource.of("", "componentstatuses"),
                GroupResource.of("", "events"),
                GroupResource.of("", "nodes"));

        private Defaults() {
        }

        @Nonnull
        static ResourceMode modeOf(@Nonnull GroupResource groupResource) {
            String group = groupResource.getGroup();
            boolean builtin = group.endsWith(".k8s.io") || !group.contains(".");
            if (FORCIBLY_DENATURED.contains(groupResource)) {
                return new ResourceMode(PropagationMode.GOES_TO_EDGE, NatureMode.FORCIBLY_DENATURED, builtin);
            } else if (NATURED_IN_BOTH.contains(groupResource)) {
                return new ResourceMode(PropagationMode.GOES_TO_EDGE, NatureMode.NATURALLY_NATURED, builtin);
            } else if (NATURED_IN_CENTER_NO_GO.contains(groupResource)) {
                return new ResourceMode(PropagationMode.TOLERATE_IN_CENTER, NatureMode.NATURALLY_NATURED, builtin);
            } else if (NOT_SUPPORTED.contains(groupResource)) {
                return new ResourceMode(PropagationMode.ERROR_IN_CENTER, NatureMode.NATURALLY_NATURED, builtin);
            } else if (GROUPS_NOT_FOR_EDGE.contains(group) || NOT_FOR_EDGE.contains(groupResource)) {
                return new ResourceMode(PropagationMode.TOLERATE_IN_CENTER, NatureMode.NATURALLY_NATURED, builtin);
            }
            return new ResourceMode(PropagationMode.GOES_TO_EDGE, NatureMode.NATURALLY_DENATURED, builtin);
        }
    }
}
