/*
 * ChangeRecorder.java
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

package io.kubestellar.placement;

import com.google.common.collect.ImmutableList;
import io.kubestellar.placement.collection.MapChangeReceiver;
import io.kubestellar.placement.collection.MapChangeReceivers;
import io.kubestellar.placement.collection.MappingReceiver;
import io.kubestellar.placement.collection.MappingReceivers;
import io.kubestellar.placement.collection.SetChangeReceiver;
import io.kubestellar.placement.collection.SetChangeReceivers;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.List;

/**
 * Records the changes told to receivers as short strings, in order.
 */
public class ChangeRecorder {
    private final List<String> events = new ArrayList<>();

    @Nonnull
    public <E> SetChangeReceiver<E> setReceiver() {
        return SetChangeReceivers.of(element -> events.add("add " + element), element -> events.add("remove " + element));
    }

    @Nonnull
    public <K, V> MappingReceiver<K, V> mappingReceiver() {
        return MappingReceivers.of((key, value) -> events.add("put " + key + "=" + value), key -> events.add("delete " + key));
    }

    @Nonnull
    public <K, V> MapChangeReceiver<K, V> mapChangeReceiver() {
        return MapChangeReceivers.of((key, value) -> events.add("create " + key + "=" + value),
                (key, oldValue, newValue) -> events.add("update " + key + "=" + oldValue + "->" + newValue),
                (key, finalValue) -> events.add("delete " + key + "=" + finalValue));
    }

    @Nonnull
    public List<String> getEvents() {
        return ImmutableList.copyOf(events);
    }

    /**
     * Get the events recorded so far and forget them.
     * @return the events, oldest first
     */
    @Nonnull
    public List<String> drain() {
        List<String> ans = getEvents();
        events.clear();
        return ans;
    }
}
