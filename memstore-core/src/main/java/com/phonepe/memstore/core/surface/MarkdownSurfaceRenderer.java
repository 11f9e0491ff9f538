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
import lombok.NonNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Renders a {@link SurfaceView} into the Markdown rules document loaded at the start of a session.
 * Empty sections are omitted and the output is cut at the configured number of lines.
 */
public class MarkdownSurfaceRenderer {
    static final String HEADER = """
            # Memory System
            # Auto-generated at session start. Do not edit manually.
            """;

    private final SurfaceSettings settings;

    public MarkdownSurfaceRenderer() {
        this(null);
    }

    public MarkdownSurfaceRenderer(SurfaceSettings settings) {
        this.settings = Objects.requireNonNullElse(settings, SurfaceSettings.DEFAULT);
    }

    public String render(@NonNull SurfaceView view) {
        final var lines = new ArrayList<String>();
        HEADER.lines().forEach(lines::add);
        lines.add("");
        section(lines, "Preferences", view.section(MemoryCategory.PREFERENCES));
        section(lines, "Corrections (Do Not Repeat)", view.section(MemoryCategory.CORRECTIONS));
        section(lines, "Key Facts", view.section(MemoryCategory.FACTS));
        if (view.getProject() != null && !view.getProjectMemories().isEmpty()) {
            lines.add("## Current Project: " + view.getProject());
            lines.add("");
            view.getProjectMemories()
                    .forEach(memory -> lines.add("- [%s] %s".formatted(memory.getRecord().getCategory().getValue(),
                                                                       memory.getRecord().getContent())));
            lines.add("");
        }
        section(lines, "Past Decisions", view.section(MemoryCategory.DECISIONS));
        section(lines, "Known Procedures", view.section(MemoryCategory.PROCEDURES));
        section(lines, "Relationships", view.section(MemoryCategory.RELATIONSHIPS));
        lines.add("---");
        lines.add("*%d memories stored. Use recall to search the full store.*".formatted(view.getTotalActive()));
        final var limit = Math.max(0, settings.getMaxLines());
        return String.join("\n", lines.subList(0, Math.min(lines.size(), limit))) + "\n";
    }

    private static void section(final List<String> lines, final String title, final List<ScoredMemory> memories) {
        if (memories.isEmpty()) {
            return;
        }
        lines.add("## " + title);
        lines.add("");
        memories.forEach(memory -> lines.add("- " + memory.getRecord().getContent()));
        lines.add("");
    }
}
