package io.ensightrpc.client.proxy;

import io.ensightrpc.core.Protocol;

import java.util.ArrayList;
import java.util.List;

/**
 * Single left-to-right scan of an evaluated-mode result for object descriptions.
 *
 * <p>For each {@code CvfObjID:} marker the nearest preceding {@code Class: } starts the
 * description, and the {@code , cached:yes} or {@code , cached:no} qualifier after the
 * identity ends it. The scan stops at the first marker that does not fit this shape and
 * returns the rest of the text as a literal.
 */
public final class ReprScanner {
    private ReprScanner() {}

    public static List<ReprToken> scan(String text) {
        List<ReprToken> tokens = new ArrayList<>();
        int pos = 0;
        while (true) {
            int id = text.indexOf(Protocol.M_OBJECT_ID, pos);
            if (id < 0) break;
            int start = text.lastIndexOf(Protocol.M_CLASS, id);
            if (start < pos) break;

            int p = skipSpaces(text, id + Protocol.M_OBJECT_ID.length());
            int digits = p;
            while (p < text.length() && Character.isDigit(text.charAt(p))) p++;
            if (p == digits || p - digits > 18) break;
            long objectId = Long.parseLong(text.substring(digits, p));

            p = skipSpaces(text, p);
            if (!text.startsWith(Protocol.M_CACHED, p)) break;
            p += Protocol.M_CACHED.length();
            boolean cached;
            if (text.startsWith("yes", p)) {
                cached = true;
                p += 3;
            } else if (text.startsWith("no", p)) {
                cached = false;
                p += 2;
            } else {
                break;
            }

            if (start > pos) {
                tokens.add(new ReprToken.Literal(text.substring(pos, start)));
            }
            tokens.add(new ReprToken.ObjectRef(className(text, start, id), objectId, cached, start, p));
            pos = p;
        }
        if (pos < text.length()) {
            tokens.add(new ReprToken.Literal(text.substring(pos)));
        }
        return tokens;
    }

    private static String className(String text, int start, int id) {
        int from = start + Protocol.M_CLASS.length();
        int comma = text.indexOf(',', from);
        int to = (comma < 0 || comma > id) ? id : comma;
        return text.substring(from, to).trim();
    }

    private static int skipSpaces(String text, int p) {
        while (p < text.length() && text.charAt(p) == ' ') p++;
        return p;
    }
}
