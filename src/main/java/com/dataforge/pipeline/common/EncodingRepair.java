package com.dataforge.pipeline.common;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

/**
 * Repairs mojibake produced when UTF-8 bytes were decoded as Windows-1252 or Latin-1. A candidate repair is only
 * accepted when the re-encoded bytes form strictly valid UTF-8, so correctly accented text is left alone.
 */
final class EncodingRepair {
    private static final int MAX_PASSES = 2;
    private static final Map<Character, Byte> WINDOWS_1252_SPECIALS = windows1252Specials();

    private EncodingRepair() {
    }

    static String repair(String text) {
        String current = text;
        for (int pass = 0; pass < MAX_PASSES; pass++) {
            String repaired = repairOnce(current);
            if (repaired == null) {
                break;
            }
            current = repaired;
        }
        return current;
    }

    private static String repairOnce(String text) {
        byte[] bytes = new byte[text.length()];
        boolean sawHighByte = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c < 0x80) {
                bytes[i] = (byte) c;
                continue;
            }
            Byte special = WINDOWS_1252_SPECIALS.get(c);
            if (special != null) {
                bytes[i] = special;
            } else if (c <= 0xFF) {
                bytes[i] = (byte) c;
            } else {
                return null;
            }
            sawHighByte = true;
        }
        if (!sawHighByte) {
            return null;
        }
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            CharBuffer decoded = decoder.decode(ByteBuffer.wrap(bytes));
            String repaired = decoded.toString();
            return repaired.length() < text.length() ? repaired : null;
        } catch (CharacterCodingException e) {
            return null;
        }
    }

    private static Map<Character, Byte> windows1252Specials() {
        Map<Character, Byte> specials = new HashMap<>();
        Charset windows1252 = Charset.forName("windows-1252");
        for (int b = 0x80; b <= 0x9F; b++) {
            String decoded = new String(new byte[] { (byte) b }, windows1252);
            char c = decoded.charAt(0);
            if (c != '\uFFFD' && c != (char) b) {
                specials.put(c, (byte) b);
            }
        }
        return specials;
    }
}
