package org.dxworks.celerrate.cst;

import java.nio.charset.StandardCharsets;

/**
 * Source buffer shared by the engine, the span tracker and the mapper. Offsets are UTF-8 byte
 * offsets, as tree-sitter reports them.
 */
public final class SourceText {
    private final String text;
    private final byte[] bytes;

    public SourceText(String text) {
        this.text = text;
        this.bytes = text.getBytes(StandardCharsets.UTF_8);
    }

    public String getText() {
        return text;
    }

    public byte[] getBytes() {
        return bytes;
    }

    public int length() {
        return bytes.length;
    }

    public String slice(int startByte, int endByte) {
        if (startByte < 0) startByte = 0;
        if (endByte > bytes.length) endByte = bytes.length;
        if (startByte >= endByte) return "";
        return new String(bytes, startByte, endByte - startByte, StandardCharsets.UTF_8);
    }

    public String text(ConcreteNode node) {
        return slice(node.startByte(), node.endByte());
    }
}
