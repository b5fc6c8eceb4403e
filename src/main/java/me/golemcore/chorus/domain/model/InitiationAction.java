package me.golemcore.chorus.domain.model;

/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

import java.util.Locale;

/**
 * Outcome kinds of an initiation decision.
 */
public enum InitiationAction {
    CONTINUE, INITIATE, NOTHING, SKIPPED;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public String auditAction() {
        return "agent_initiation_" + wireName();
    }

    /**
     * Unknown or missing actions degrade to {@link #NOTHING}.
     */
    public static InitiationAction fromWire(String value) {
        if (value == null) {
            return NOTHING;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
        case "continue" -> CONTINUE;
        case "initiate" -> INITIATE;
        default -> NOTHING;
        };
    }
}
