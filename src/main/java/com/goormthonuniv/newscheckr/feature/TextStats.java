package com.goormthonuniv.newscheckr.feature;

import com.goormthonuniv.newscheckr.util.TextUtils;

import java.util.List;
import java.util.Locale;

/**
 * 어휘와 무관한 문체 통계. 트리 모델의 분기 조건과 "선정성" 라벨 휴리스틱에 쓰인다.
 */
public record TextStats(
        int wordCount,
        int sentenceCount,
        double avgWordLength,
        double exclamationDensity,  // '!' 개수 / 단어 수
        double questionDensity,     // '?' 개수 / 단어 수
        double capsRatio,           // 대문자 / 전체 알파벳
        double allCapsRatio         // 3글자 이상 전부 대문자인 단어 / 단어 수
) {

    public enum Stat {
        WORD_COUNT("word_count"),
        SENTENCE_COUNT("sentence_count"),
        AVG_WORD_LENGTH("avg_word_length"),
        EXCLAMATION_DENSITY("exclamation_density"),
        QUESTION_DENSITY("question_density"),
        CAPS_RATIO("caps_ratio"),
        ALL_CAPS_RATIO("all_caps_ratio");

        private final String key;

        Stat(String key) {
            this.key = key;
        }

        public String key() {
            return key;
        }

        public static Stat fromKey(String key) {
            String k = key == null ? "" : key.strip().toLowerCase(Locale.ROOT);
            for (Stat s : values()) {
                if (s.key.equals(k)) return s;
            }
            throw new IllegalArgumentException("unknown text statistic: " + key);
        }
    }

    public static TextStats of(String text) {
        return of(text, TextUtils.words(text));
    }

    static TextStats of(String text, List<String> words) {
        String t = text == null ? "" : text;
        int wordCount = words.size();
        int sentenceCount = TextUtils.sentences(t).size();

        long letters = 0, upper = 0, exclamations = 0, questions = 0;
        for (int i = 0; i < t.length(); i++) {
            char c = t.charAt(i);
            if (Character.isLetter(c)) {
                letters++;
                if (Character.isUpperCase(c)) upper++;
            } else if (c == '!') {
                exclamations++;
            } else if (c == '?') {
                questions++;
            }
        }

        long chars = 0, allCaps = 0;
        for (String w : words) {
            chars += w.length();
            if (w.length() >= 3 && w.equals(w.toUpperCase(Locale.ROOT))) allCaps++;
        }

        return new TextStats(
                wordCount,
                sentenceCount,
                wordCount == 0 ? 0.0 : (double) chars / wordCount,
                wordCount == 0 ? 0.0 : (double) exclamations / wordCount,
                wordCount == 0 ? 0.0 : (double) questions / wordCount,
                letters == 0 ? 0.0 : (double) upper / letters,
                wordCount == 0 ? 0.0 : (double) allCaps / wordCount
        );
    }

    public double value(Stat stat) {
        return switch (stat) {
            case WORD_COUNT -> wordCount;
            case SENTENCE_COUNT -> sentenceCount;
            case AVG_WORD_LENGTH -> avgWordLength;
            case EXCLAMATION_DENSITY -> exclamationDensity;
            case QUESTION_DENSITY -> questionDensity;
            case CAPS_RATIO -> capsRatio;
            case ALL_CAPS_RATIO -> allCapsRatio;
        };
    }
}
