/*
 * LogAppenderExtension.java
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

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.LogEvent;
import org.apache.logging.log4j.core.Logger;
import org.apache.logging.log4j.core.appender.AbstractAppender;
import org.apache.logging.log4j.core.config.Property;
import org.junit.jupiter.api.extension.AfterEachCallback;
import org.junit.jupiter.api.extension.BeforeEachCallback;
import org.junit.jupiter.api.extension.ExtensionContext;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Captures what one class logs during each test. Register with
 * {@link org.junit.jupiter.api.extension.RegisterExtension}.
 */
public class LogAppenderExtension implements BeforeEachCallback, AfterEachCallback {
    @Nonnull
    private final Class<?> clazz;
    @Nonnull
    private final Level level;
    private CapturingAppender appender;
    private Logger logger;
    private Level levelBefore;

    private static class CapturingAppender extends AbstractAppender {
        private final List<LogEvent> events = new CopyOnWriteArrayList<>();

        protected CapturingAppender(String name) {
            super(name, null, null, false, Property.EMPTY_ARRAY);
        }

        @Override
        public void append(LogEvent event) {
            events.add(event.toImmutable());
        }
    }

    public LogAppenderExtension(@Nonnull Class<?> clazz, @Nonnull Level level) {
        this.clazz = clazz;
        this.level = level;
    }

    @Override
    public void beforeEach(ExtensionContext context) {
        appender = new CapturingAppender("capture-" + clazz.getSimpleName());
        logger = (Logger)LogManager.getLogger(clazz);
        logger.addAppender(appender);
        levelBefore = logger.getLevel();
        logger.setLevel(level);
        appender.start();
    }

    @Override
    public void afterEach(ExtensionContext context) {
        if (appender != null) {
            appender.stop();
        }
        if (logger != null) {
            logger.removeAppender(appender);
            logger.setLevel(levelBefore);
        }
    }

    @Nonnull
    public List<LogEvent> getLogEvents() {
        return appender.events;
    }

    /**
     * Get the formatted messages logged at a level.
     * @param atLevel the level
     * @return the messages, oldest first
     */
    @Nonnull
    public List<String> getMessages(@Nonnull Level atLevel) {
        return appender.events.stream()
                .filter(event -> event.getLevel().equals(atLevel))
                .map(event -> event.getMessage().getFormattedMessage())
                .collect(Collectors.toList());
    }

    public void clear() {
        appender.events.clear();
    }
}
