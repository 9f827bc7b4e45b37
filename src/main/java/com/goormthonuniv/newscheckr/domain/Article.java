package com.goormthonuniv.newscheckr.domain;

import java.time.OffsetDateTime;
import java.util.List;

public record Article(
        String url,               // 텍스트 직접 입력이면 null
        String sourceDomain,      // 예: "reuters.com" (정규화 전 값일 수 있음)
        String title,
        String text,
        List<String> authors,
        OffsetDateTime publishedAt
) {
    public Article {
        title = title == null ? "" : title;
        text = text == null ? "" : text;
        authors = authors == null ? List.of() : List.copyOf(authors);
    }

    public static Article ofText(String text, String sourceDomain) {
        return new Article(null, sourceDomain, "", text, List.of(), null);
    }
}
