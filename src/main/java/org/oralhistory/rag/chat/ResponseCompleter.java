package org.oralhistory.rag.chat;

/**
 * Trims completions that were cut off by the token limit back to the last full
 * sentence.
 */
final class ResponseCompleter {

    private static final String TRAILING_ELLIPSIS = "\\.{3,}\\z";

    private ResponseCompleter() {
    }

    static String ensureComplete(String text) {
        if (text == null) {
            return "";
        }
        String result = text.replaceAll(TRAILING_ELLIPSIS, "");
        if (endsWithSentence(result)) {
            return result;
        }
        int lastTerminator = Math.max(result.lastIndexOf('.'),
                Math.max(result.lastIndexOf('!'), result.lastIndexOf('?')));
        if (lastTerminator >= 0) {
            return result.substring(0, lastTerminator + 1);
        }
        return result.isBlank() ? result : result.trim() + ".";
    }

    private static boolean endsWithSentence(String text) {
        return text.endsWith(".") || text.endsWith("!") || text.endsWith("?");
    }
}
