/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
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

package dev.mars.flowsmith.contract;

import java.util.Locale;

/**
 * How a generated workflow is started.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public enum TriggerKind {
    WEBHOOK("webhook"),
    SCHEDULE("schedule"),
    MANUAL("manual"),
    CUSTOM("custom");

    private final String label;

    TriggerKind(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Maps free trigger text onto a kind. Matching is by containment so that values such as
     * {@code "cron job"} or {@code "webhook POST"} still resolve; anything unknown is manual.
     */
    public static TriggerKind fromText(String text) {
        if (text == null) {
            return MANUAL;
        }
        String value = text.toLowerCase(Locale.ROOT);
        if (value.contains("webhook")) {
            return WEBHOOK;
        }
        if (value.contains("cron") || value.contains("schedule")
                || value.contains("horario") || value.contains("programado")) {
            return SCHEDULE;
        }
        if (value.contains("custom") || value.contains("personalizado")) {
            return CUSTOM;
        }
        return MANUAL;
    }

    /**
     * @return true when {@link #fromText(String)} resolved the text to a kind by keyword rather than by default
     */
    public static boolean isRecognized(String text) {
        if (text == null) {
            return false;
        }
        String value = text.toLowerCase(Locale.ROOT);
        return fromText(text) != MANUAL || value.contains("manual");
    }
}
