/*
 * ReceiversTest.java
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

package io.kubestellar.placement.collection;

import io.kubestellar.placement.ChangeRecorder;
import io.kubestellar.placement.LogAppenderExtension;
import io.kubestellar.tuple.Pair;
import io.kubestellar.tuple.Rotator;
import io.kubestellar.tuple.Triple;
import org.apache.logging.log4j.Level;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.RegisterExtension;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests of the receiver adapters in {@link SetChangeReceivers}, {@link MappingReceivers} and
 * {@link MapChangeReceivers}.
 */
public class ReceiversTest {
    @RegisterExtension
    final LogAppenderExtension logs = new LogAppenderExtension(ReceiversTest.class, Level.DEBUG);

    private final ChangeRecorder recorder = new ChangeRecorder();

    @Test
    void reverseSwapsAddAndRemove() {
        SetChangeReceiver<String> reversed = SetChangeReceivers.reverse(recorder.setReceiver());
        reversed.add("x");
        reversed.remove("y");
        assertThat(recorder.getEvents()).containsExactly("remove x", "add y");
    }

    @Test
    void forkCombinesResults() {
        MapSet<String> first = MapSet.hashed();
        MapSet<String> second = MapSet.of("b");
        SetChangeReceiver<String> all = SetChangeReceivers.fork(true, first, second);
        SetChangeReceiver<String> any = SetChangeReceivers.fork(false, first, second);
        assertThat(all.add("a")).isTrue();
        assertThat(all.add("b")).isFalse();
        assertThat(any.add("a")).isFalse();
        assertThat(any.remove("b")).isTrue();
        assertThat(Visitables.toSet(first)).containsExactly("a");
        assertThat(Visitables.toSet(second)).containsExactly("a");
    }

    @Test
    void tripleSwaps() {
        SetChangeReceiver<Triple<Integer, String, Character>> target = recorder.setReceiver();
        SetChangeReceivers.<Integer, String, Character>swap23(target).add(Triple.of(1, 'c', "s"));
        SetChangeReceivers.<Integer, String, Character>swap13(target).remove(Triple.of('c', "s", 1));
        SetChangeReceivers.<Integer, String>reversePairs(recorder.setReceiver()).add(Pair.of("s", 1));
        assertThat(recorder.getEvents()).containsExactly(
                "add " + Triple.of(1, "s", 'c'),
                "remove " + Triple.of(1, "s", 'c'),
                "add " + Pair.of(1, "s"));
    }

    @Test
    void mappingAdapters() {
        MappingReceiver<String, Integer> transformed = MappingReceivers.transform(String::length, i -> i * 10,
                recorder.<Integer, Integer>mappingReceiver());
        transformed.put("abc", 1);
        transformed.delete("ab");
        MappingReceivers.rotateKeys(Rotator.<String, Integer>of(Integer::valueOf, i -> Integer.toString(i)),
                recorder.<Integer, String>mappingReceiver()).put("42", "v");
        assertThat(recorder.drain()).containsExactly("put 3=10", "delete 2", "put 42=v");

        MapSet<String> keys = MapSet.hashed();
        MappingReceiver<String, Integer> lossy = MappingReceivers.keySetLossy(keys);
        lossy.put("k", 1);
        lossy.put("k", 2);
        assertThat(keys.size()).isEqualTo(1);
        lossy.delete("k");
        assertThat(keys.isEmpty()).isTrue();
    }

    @Test
    void discardsPreviousTurnsUpdatesIntoPuts() {
        MapChangeReceiver<String, Integer> changes = MappingReceivers.discardsPrevious(recorder.<String, Integer>mappingReceiver());
        changes.create("a", 1);
        changes.update("a", 1, 2);
        changes.deleteWithFinal("a", 2);
        assertThat(recorder.getEvents()).containsExactly("put a=1", "put a=2", "delete a");
    }

    @Test
    void mapChangeAdapters() {
        MapChangeReceiver<String, Integer> both = MapChangeReceivers.fork(recorder.<String, Integer>mapChangeReceiver(),
                MapChangeReceivers.<String, Integer>keySet(recorder.<String>setReceiver()));
        both.create("a", 1);
        both.update("a", 1, 2);
        both.deleteWithFinal("a", 2);
        assertThat(recorder.drain()).containsExactly("create a=1", "add a", "update a=1->2", "delete a=2", "remove a");

        MapChangeReceiver<String, Integer> transformed = MapChangeReceivers.transform(String::toUpperCase, i -> -i,
                recorder.<String, Integer>mapChangeReceiver());
        transformed.update("b", 1, 2);
        assertThat(recorder.getEvents()).isEqualTo(Collections.singletonList("update B=-1->-2"));
    }

    @Test
    void loggingReceivers() {
        SetChangeReceiver<String> set = SetChangeReceivers.logging(LoggerFactory.getLogger(ReceiversTest.class), "test set");
        assertThat(set.add("x")).isTrue();
        MappingReceivers.<String, Integer>logging(LoggerFactory.getLogger(ReceiversTest.class), "test map").put("k", 7);
        assertThat(logs.getMessages(Level.DEBUG)).hasSize(2);
        assertThat(logs.getMessages(Level.DEBUG).get(0)).contains("Set add", "test set");
        assertThat(logs.getMessages(Level.DEBUG).get(1)).contains("Map put", "test map");
    }

    @Test
    void ignoringReportsEverythingAsChanged() {
        SetChangeReceiver<Integer> ignoring = SetChangeReceivers.ignoring();
        assertThat(Arrays.asList(ignoring.add(1), ignoring.remove(1), ignoring.remove(2))).containsOnly(true);
    }
}
