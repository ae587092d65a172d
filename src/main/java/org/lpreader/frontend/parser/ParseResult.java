package org.lpreader.frontend.parser;

import org.lpreader.frontend.sections.TokenSlice;

/**
 * A parsed entity together with the tokens that follow it.
 *
 * @param value The parsed entity.
 * @param remaining The unconsumed rest of the input slice.
 * @param <T> The type of the parsed entity.
 */
public record ParseResult<T>(T value, TokenSlice remaining) {
}
