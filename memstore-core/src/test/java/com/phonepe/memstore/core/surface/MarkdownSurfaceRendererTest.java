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

package com.phonepe.memstore.core.surface;

import com.phonepe.memstore.core.model.MemoryCategory;
import com.phonepe.memstore.core.model.MemoryRecord;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MarkdownSurfaceRendererTest {

    private static ScoredMemory memory(long id, MemoryCategory category, String content) {
        return new ScoredMemory(MemoryRecord.builder()
                                        .id(id)
                                        .category(category)
                                        .content(content)
                                        .build(),
                                0.5);
    }

    @Test
    void testRender() {
        final var view = SurfaceView.builder()
                .byCategory(Map.of(MemoryCategory.PREFERENCES,
                                   List.of(memory(1, MemoryCategory.PREFERENCES, "Prefers tabs")),
                                   MemoryCategory.CORRECTIONS,
                                   List.of(memory(2, MemoryCategory.CORRECTIONS, "Service is not on Java 11"))))
                .project("billing")
                .projectMemories(List.of(memory(3, MemoryCategory.DECISIONS, "Use outbox pattern")))
                .totalActive(3)
                .build();
        final var rendered = new MarkdownSurfaceRenderer().render(view);
        final var expected = String.join("\n",
                                         "# Memory System",
                                         "# Auto-generated at session start. Do not edit manually.",
                                         "",
                                         "## Preferences",
                                         "",
                                         "- Prefers tabs",
                                         "",
                                         "## Corrections (Do Not Repeat)",
                                         "",
                                         "- Service is not on Java 11",
                                         "",
                                         "## Current Project: billing",
                                         "",
                                         "- [decisions] Use outbox pattern",
                                         "",
                                         "---",
                                         "*3 memories stored. Use recall to search the full store.*",
                                         "");
        assertEquals(expected, rendered);
    }

    @Test
    void testEmptyView() {
        final var rendered = new MarkdownSurfaceRenderer().render(SurfaceView.builder()
                                                                          .byCategory(Map.of())
                                                                          .projectMemories(List.of())
                                                                          .build());
        assertFalse(rendered.contains("## "));
        assertTrue(rendered.contains("*0 memories stored."));
    }

    @Test
    void testOutputIsTruncated() {
        final var facts = IntStream.range(0, 50)
                .mapToObj(i -> memory(i, MemoryCategory.FACTS, "fact " + i))
                .toList();
        final var view = SurfaceView.builder()
                .byCategory(Map.of(MemoryCategory.FACTS, facts))
                .projectMemories(List.of())
                .totalActive(50)
                .build();
        final var rendered = new MarkdownSurfaceRenderer(SurfaceSettings.builder().maxLines(10).build()).render(view);
        assertEquals(10, rendered.lines().count());
        assertTrue(rendered.endsWith("\n"));
    }
}
