package me.golemcore.chorus.domain.initiation;

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

/**
 * Variants of the initiation sweep.
 */
public enum SweepMode {

    /** Runs only inside the daytime hour window. */
    DAYTIME,

    /**
     * Night-time sweep, outside the daytime window. Agents may only continue or
     * start agent-only conversations and no "why I didn't act" notifications
     * are sent.
     */
    BACKGROUND;

    public boolean notifiesNonAction() {
        return this == DAYTIME;
    }

    public boolean agentOnly() {
        return this == BACKGROUND;
    }
}
