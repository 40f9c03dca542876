/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.opencircuitsim.result;

import com.powsybl.opencircuitsim.util.NumberParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Read the block tagged result format, whatever simulator produced it.
 *
 * <p>Blocks are {@code <KIND NAME TYPE> ... </KIND>} regions with {@code KIND} being {@code indep} or {@code dep}.
 * Text outside blocks is ignored and so are block tokens that are not numbers.</p>
 *
 * @author Open Circuit Sim developers
 */
public final class ResultDecoder {

    private static final Logger LOGGER = LoggerFactory.getLogger(ResultDecoder.class);

    public static final String NO_OUTPUT_FILE_ERROR = "No output file found";

    private static final Pattern BLOCK_PATTERN = Pattern.compile("<((?:in)?dep)\\s+([^\\s<>]+)\\s+([^\\s<>]+)>(.*?)</\\1>",
            Pattern.DOTALL | Pattern.UNICODE_CHARACTER_CLASS);

    private static final Pattern WHITESPACES = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private ResultDecoder() {
    }

    public static List<ResultBlock> decodeBlocks(String text) {
        Objects.requireNonNull(text);
        List<ResultBlock> blocks = new ArrayList<>();
        Matcher matcher = BLOCK_PATTERN.matcher(text);
        while (matcher.find()) {
            ResultBlockKind kind = ResultBlockKind.fromTag(matcher.group(1)).orElseThrow();
            List<Double> values = new ArrayList<>();
            for (String token : WHITESPACES.split(matcher.group(4).strip())) {
                parseValue(token).ifPresent(values::add);
            }
            blocks.add(new ResultBlock(kind, matcher.group(2), matcher.group(3), values));
        }
        return blocks;
    }

    /**
     * Decode values by block name. A block reusing the name of a previous one replaces it.
     */
    public static Map<String, List<Double>> decode(String text) {
        Map<String, List<Double>> values = new LinkedHashMap<>();
        for (ResultBlock block : decodeBlocks(text)) {
            values.put(block.name(), block.values());
        }
        return values;
    }

    public static DecodeResult decode(Path file) {
        Objects.requireNonNull(file);
        if (!Files.exists(file)) {
            LOGGER.warn("Result file '{}' not found", file);
            return DecodeResult.error(NO_OUTPUT_FILE_ERROR);
        }
        try {
            return DecodeResult.success(decode(Files.readString(file, StandardCharsets.UTF_8)));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    static OptionalDouble parseValue(String token) {
        return NumberParser.parseDouble(token);
    }
}
