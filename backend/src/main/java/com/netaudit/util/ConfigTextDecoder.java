package com.netaudit.util;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

/**
 * 上传的设备配置/模板文件解码
 * <p>
 * 去掉 BOM，按严格 UTF-8 解码，含非法字节时退回 ISO-8859-1（banner、description 中偶有 Latin-1 字符）。
 * 换行统一为 \n，从 Windows 终端保存的配置与设备上的 running-config 按同样方式匹配。
 */
public final class ConfigTextDecoder {

    private static final List<ByteOrderMark> BOMS = List.of(
            new ByteOrderMark(new byte[]{(byte) 0xEF, (byte) 0xBB, (byte) 0xBF}, StandardCharsets.UTF_8),
            new ByteOrderMark(new byte[]{(byte) 0xFF, (byte) 0xFE}, StandardCharsets.UTF_16LE),
            new ByteOrderMark(new byte[]{(byte) 0xFE, (byte) 0xFF}, StandardCharsets.UTF_16BE));

    private ConfigTextDecoder() {
    }

    public static DecodedConfig decode(byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            return new DecodedConfig("", StandardCharsets.UTF_8, false);
        }
        for (ByteOrderMark bom : BOMS) {
            if (bom.startsWith(bytes)) {
                int skip = bom.marker().length;
                String text = new String(bytes, skip, bytes.length - skip, bom.charset());
                return new DecodedConfig(normalizeLineEndings(text), bom.charset(),
                        bom.charset() != StandardCharsets.UTF_8);
            }
        }
        try {
            String text = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
            return new DecodedConfig(normalizeLineEndings(text), StandardCharsets.UTF_8, false);
        } catch (CharacterCodingException e) {
            return new DecodedConfig(normalizeLineEndings(new String(bytes, StandardCharsets.ISO_8859_1)),
                    StandardCharsets.ISO_8859_1, true);
        }
    }

    static String normalizeLineEndings(String text) {
        return text.replace("\r\n", "\n").replace('\r', '\n');
    }

    private record ByteOrderMark(byte[] marker, Charset charset) {
        boolean startsWith(byte[] bytes) {
            return bytes.length >= marker.length
                    && Arrays.equals(bytes, 0, marker.length, marker, 0, marker.length);
        }
    }

    /**
     * @param converted 是否以 UTF-8 以外的编码解码
     */
    public record DecodedConfig(String text, Charset charset, boolean converted) {

        public String notice(String fileName) {
            return converted
                    ? "检测到 " + fileName + " 不是 UTF-8 编码，已按 " + charset.name() + " 解码"
                    : null;
        }
    }
}
