package me.golemcore.chains.tools;

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

import me.golemcore.chains.domain.component.ToolComponent;
import me.golemcore.chains.domain.model.ToolDefinition;
import me.golemcore.chains.domain.model.ToolResult;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;

/**
 * Tool for getting the current date and time.
 *
 * <p>
 * The input is an optional timezone id such as {@code "America/New_York"} or
 * {@code "UTC"}; blank input uses the clock's zone.
 */
public class DateTimeTool implements ToolComponent {

    public static final String NAME = "datetime";

    private static final DateTimeFormatter FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss z, EEEE",
            Locale.ENGLISH);

    private final Clock clock;

    public DateTimeTool() {
        this(Clock.systemDefaultZone());
    }

    /**
     * Visible for testing.
     */
    public DateTimeTool(Clock clock) {
        this.clock = clock;
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.textInput(NAME, "Get the current date and time. "
                + "Input: an optional timezone such as 'America/New_York', 'Europe/London' or 'UTC'.");
    }

    @Override
    public CompletableFuture<ToolResult> execute(String input) {
        String timezone = input != null ? input.trim() : "";
        ZoneId zoneId;
        if (timezone.isEmpty()) {
            zoneId = clock.getZone();
        } else {
            try {
                zoneId = ZoneId.of(timezone);
            } catch (DateTimeException e) {
                return CompletableFuture.completedFuture(ToolResult.failure("Invalid timezone: " + timezone));
            }
        }
        ZonedDateTime now = ZonedDateTime.now(clock.withZone(zoneId));
        return CompletableFuture.completedFuture(ToolResult.success(now.format(FORMATTER)));
    }
}
