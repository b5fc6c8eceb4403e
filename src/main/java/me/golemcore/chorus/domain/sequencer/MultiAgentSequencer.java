package me.golemcore.chorus.domain.sequencer;

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

import me.golemcore.chorus.domain.model.TurnOutcome;
import me.golemcore.chorus.domain.turn.ResponseOrchestrator;
import me.golemcore.chorus.domain.turn.TurnRetryPolicy;
import me.golemcore.chorus.port.outbound.TaskQueuePort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;

/**
 * Runs several agents' turns over one chat in a fixed order.
 *
 * <p>
 * Each step runs the head agent synchronously and only submits the remaining
 * tail after that turn returned. A failing agent is retried as its own task:
 * earlier agents are not re-run and later agents wait until it resolves.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MultiAgentSequencer {

    private final ResponseOrchestrator orchestrator;
    private final TaskQueuePort taskQueue;
    private final TurnRetryPolicy turnRetryPolicy;

    public void start(String chatId, List<String> agentIds) {
        if (agentIds == null || agentIds.isEmpty()) {
            return;
        }
        log.info("[Sequencer] Scheduling {} agent(s) in chat {}", agentIds.size(), chatId);
        submit(chatId, List.copyOf(agentIds));
    }

    /**
     * Runs the head agent and chains the tail. Exceptions from the turn
     * propagate so the queue retries this step only.
     */
    public void runStep(String chatId, List<String> agentIds) {
        if (agentIds.isEmpty()) {
            return;
        }
        String head = agentIds.get(0);
        List<String> tail = agentIds.subList(1, agentIds.size());

        TurnOutcome outcome = orchestrator.runTurn(chatId, head, null);
        log.debug("[Sequencer] Agent {} in chat {} finished: {}", head, chatId, outcome);

        if (!tail.isEmpty()) {
            submit(chatId, List.copyOf(tail));
        } else {
            log.info("[Sequencer] Chain finished in chat {}", chatId);
        }
    }

    private void submit(String chatId, List<String> agentIds) {
        taskQueue.submit(new SequencerStep(chatId, agentIds), Duration.ZERO, turnRetryPolicy.policy());
    }

    private final class SequencerStep implements TaskQueuePort.QueuedTask {

        private final String chatId;
        private final List<String> agentIds;

        private SequencerStep(String chatId, List<String> agentIds) {
            this.chatId = chatId;
            this.agentIds = agentIds;
        }

        @Override
        public String name() {
            return "sequencer-step:" + chatId + ":" + agentIds.get(0) + "+" + (agentIds.size() - 1);
        }

        @Override
        public void run() {
            runStep(chatId, agentIds);
        }
    }
}
