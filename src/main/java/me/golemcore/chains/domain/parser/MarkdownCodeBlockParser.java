package me.golemcore.chains.domain.parser;

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

import me.golemcore.chains.domain.exception.UnparsableOutputException;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts the body of the first fenced code block, e.g. a SQL query or JSON
 * document the model was asked to produce.
 */
public final class MarkdownCodeBlockParser implements TextOutputParser {

    private static final Pattern CODE_BLOCK = Pattern.compile("```([\\w+-]*)[ \\t]*\\r?\\n(.*?)```",
            Pattern.DOTALL);

    private final String language;

    public MarkdownCodeBlockParser() {
        this(null);
    }

    /**
     * @param language
     *            only blocks tagged with this language are accepted; {@code null}
     *            accepts any block
     */
    public MarkdownCodeBlockParser(String language) {
        this.language = language;
    }

    @Override
    public String parse(String raw) {
        if (raw == null) {
            throw new UnparsableOutputException(null, "empty output");
        }
        Matcher matcher = CODE_BLOCK.matcher(raw);
        while (matcher.find()) {
            String tag = matcher.group(1);
            if (language == null || language.equalsIgnoreCase(tag)) {
                return matcher.group(2).trim();
            }
        }
        throw new UnparsableOutputException(raw, language == null
                ? "no fenced code block found"
                : "no fenced '" + language + "' code block found");
    }
}
