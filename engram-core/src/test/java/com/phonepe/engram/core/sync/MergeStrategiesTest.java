/*
 * Copyright (c) 2025 Original Author(s), PhonePe India Pvt. Ltd.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.phonepe.engram.core.sync;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.phonepe.engram.core.errors.ErrorType;
import com.phonepe.engram.core.errors.UnknownStrategyException;
import com.phonepe.engram.core.sync.strategies.ConflictReportingStrategy;
import com.phonepe.engram.core.sync.strategies.IntelligentMergeStrategy;
import com.phonepe.engram.core.sync.strategies.LatestWinsStrategy;
import com.phonepe.engram.core.sync.strategies.PriorityWinsStrategy;
import com.phonepe.engram.core.utils.JsonUtils;
import com.phonepe.engram.core.utils.TestUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class MergeStrategiesTest {

    private MergeStrategies strategies;

    @BeforeEach
    void setUp() {
        strategies = new MergeStrategies();
    }

    @Test
    void testBuiltInNames() {
        assertInstanceOf(LatestWinsStrategy.class, strategies.resolve("latest_wins"));
        assertInstanceOf(IntelligentMergeStrategy.class, strategies.resolve("intelligent_merge"));
        assertInstanceOf(ConflictReportingStrategy.class, strategies.resolve("merge_with_conflict_resolution"));
    }

    @Test
    void testNamesAreLenient() {
        assertInstanceOf(LatestWinsStrategy.class, strategies.resolve("Latest-Wins"));
        assertInstanceOf(IntelligentMergeStrategy.class, strategies.resolve(" intelligent_merge "));
    }

    @Test
    void testPriorityWins() {
        final var strategy = strategies.resolve("priority_wins:alice");
        assertInstanceOf(PriorityWinsStrategy.class, strategy);
        assertEquals("priority_wins:alice", strategy.name());
        assertThrows(UnknownStrategyException.class, () -> strategies.resolve("priority_wins:"));
        assertThrows(UnknownStrategyException.class, () -> strategies.resolve("latest_wins:alice"));
    }

    @Test
    void testUnknownStrategy() {
        final var error = assertThrows(UnknownStrategyException.class, () -> strategies.resolve("coin_flip"));
        assertEquals(ErrorType.UNKNOWN_STRATEGY, error.getErrorType());
        assertEquals("coin_flip", error.getStrategy());
        assertTrue(error.getMessage().contains("intelligent_merge"));
        assertThrows(UnknownStrategyException.class, () -> strategies.resolve(null));
    }

    @Test
    void testRegisterCustomStrategy() {
        final var custom = mock(MergeStrategy.class);
        when(custom.name()).thenReturn("ours");
        strategies.register(custom);
        assertSame(custom, strategies.resolve("ours"));
        assertTrue(strategies.names().contains("ours"));
    }

    @Test
    void testPriorityFallsBackToLatest() {
        final var context = MergeContext.builder()
                .ref(TestUtils.taskRef("t1"))
                .candidates(List.of(candidate("alice", "alice", "10:00:00"), candidate("bob", "bob", "10:05:00")))
                .build();
        assertEquals("bob", new PriorityWinsStrategy("carol").merge(context).getWinner());
        assertEquals("alice", new PriorityWinsStrategy("alice").merge(context).getWinner());
    }

    private static MergeCandidate candidate(String branch, String owner, String time) {
        final ObjectNode state = JsonUtils.createMapper().createObjectNode();
        state.put("entityType", "task");
        state.put("id", "t1");
        state.put("title", "from " + branch);
        state.put("updatedAt", TestUtils.at(time).toString());
        return MergeCandidate.builder()
                .branch(branch)
                .owner(owner)
                .revisionId(branch + "-rev")
                .contentHash(branch + "-hash")
                .state(state)
                .build();
    }
}
