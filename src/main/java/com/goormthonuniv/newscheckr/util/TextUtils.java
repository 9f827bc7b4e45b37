package com.goormthonuniv.newscheckr.util;

import java.text.BreakIterator;
import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class TextUtils {
    private static final Pattern WORD = Pattern.compile("[A-Za-z]+(?:'[A-Za-z]+)?");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern HAS_ALNUM = Pattern.compile("[\\p{L}\\p{N}]");

    private static final Set<String> STOPWORDS = Set.of(
            "a","about","above","after","again","against","all","also","am","an","and","any","are","as","at",
            "be","because","been","before","being","below","between","both","but","by",
            "can","could","did","do","does","doing","down","during","each",
            "few","for","from","further",
            "had","has","have","having","he","her","here","hers","herself","him","himself","his","how",
            "i","if","in","into","is","it","its","itself","just",
            "may","me","might","more","most","must","my","myself",
            "no","nor","not","now",
            "of","off","on","once","only","or","other","our","ours","ourselves","out","over","own",
            "said","same","says","she","should","so","some","such",
            "than","that","the","their","theirs","them","themselves","then","there","these","they",
            "this","those","through","to","too",
            "under","until","up","us","very",
            "was","we","were","what","when","where","which","while","who","whom","whose","why",
            "will","with","would",
            "you","your","yours","yourself"
    );

    private TextUtils() {}

    public static String normalizeWhitespace(String text) {
        if (text == null) return "";
        return WHITESPACE.matcher(text).replaceAll(" ").strip();
    }

    /** 원문 대소문자를 유지한 단어 토큰 (숫자/기호 제외) */
    public static List<String> words(String text) {
        if (text == null || text.isBlank()) return List.of();
        List<String> out = new ArrayList<>();
        Matcher m = WORD.matcher(text);
        while (m.find()) out.add(m.group());
        return out;
    }

    /** 소문자 + 불용어 제거 + 2글자 이상 */
    public static List<String> contentTokens(String text) {
        return contentTokens(words(text));
    }

    public static List<String> contentTokens(List<String> words) {
        List<String> out = new ArrayList<>(words.size());
        for (String w : words) {
            String t = w.toLowerCase(Locale.ROOT);
            if (t.length() < 2 || STOPWORDS.contains(t)) continue;
            out.add(t);
        }
        return out;
    }

    /**
     * 문장 분리. 글자/숫자가 하나도 없는 조각("!!!", "...")은 문장으로 치지 않는다.
     * 반환되는 문장은 공백 정규화된 원문 조각이다.
     */
    public static List<String> sentences(String text) {
        String normalized = normalizeWhitespace(text);
        if (normalized.isEmpty()) return List.of();
        BreakIterator it = BreakIterator.getSentenceInstance(Locale.US);
        it.setText(normalized);
        List<String> out = new ArrayList<>();
        int start = it.first();
        for (int end = it.next(); end != BreakIterator.DONE; start = end, end = it.next()) {
            String s = normalized.substring(start, end).strip();
            if (HAS_ALNUM.matcher(s).find()) out.add(s);
        }
        return out;
    }
}
