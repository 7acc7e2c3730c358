package com.codeheadsystems.onyx.model;

/**
 * A line that did not parse as a known, well-formed frame. Never sent; logged and dropped.
 *
 * @param type   the {@code type} value if one was readable, else null
 * @param reason why the line was rejected
 */
public record UnknownFrame(String type, String reason) implements Frame {
}
