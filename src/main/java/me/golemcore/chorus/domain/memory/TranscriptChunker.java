package me.golemcore.chorus.domain.memory;

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

import me.golemcore.chorus.domain.model.Message;
import me.golemcore.chorus.domain.service.TokenEstimator;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Splits an ordered transcript into token-bounded chunks without reordering.
 * A single message larger than the target becomes its own chunk.
 */
public final class TranscriptChunker {

    private TranscriptChunker() {
    }

    public static List<List<Message>> chunk(List<Message> messages, int targetTokens,
            Function<Message, String> lineFormatter) {
        List<List<Message>> chunks = new ArrayList<>();
        List<Message> current = new ArrayList<>();
        int currentTokens = 0;
        for (Message message : messages) {
            int tokens = TokenEstimator.estimate(lineFormatter.apply(message));
            if (!current.isEmpty() && currentTokens + tokens > targetTokens) {
                chunks.add(current);
                current = new ArrayList<>();
                currentTokens = 0;
            }
            current.add(message);
            currentTokens += tokens;
        }
        if (!current.isEmpty()) {
            chunks.add(current);
        }
        return chunks;
    }
}
