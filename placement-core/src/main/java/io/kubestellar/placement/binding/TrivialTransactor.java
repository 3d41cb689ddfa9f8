/*
 * TrivialTransactor.java
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
import io.kubestellar.placement.logging.KeyValueLogMessage;
import io.kubestellar.placement.logging.LogMessageKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * A {@link WorkloadProjector} that applies every transaction directly to fixed sections, one transaction at a time.
 */
@API(API.Status.UNSTABLE)
public class TrivialTransactor implements WorkloadProjector {
    private static final Logger LOGGER = LoggerFactory.getLogger(TrivialTransactor.class);

    @Nonnull
    private final WorkloadProjectionSections target;
    @Nonnull
    private final ReentrantLock lock = new ReentrantLock();
    @Nonnull
    private final AtomicLong transactionCounter = new AtomicLong();

    public TrivialTransactor(@Nonnull WorkloadProjectionSections target) {
        this.target = target;
    }

    @Override
    public void transact(@Nonnull Consumer<? super WorkloadProjectionSections> transaction) {
        long id = transactionCounter.incrementAndGet();
        lock.lock();
        TransactionScope scope = new TransactionScope();
        try {
            if (LOGGER.isTraceEnabled()) {
                LOGGER.trace(KeyValueLogMessage.of("Begin projection transaction", LogMessageKeys.TRANSACTION, id));
            }
            transaction.accept(scope.guard(target));
        } finally {
            scope.close();
            lock.unlock();
        }
        if (LOGGER.isTraceEnabled()) {
            LOGGER.trace(KeyValueLogMessage.of("End projection transaction", LogMessageKeys.TRANSACTION, id));
        }
    }
}
