package com.goormthonuniv.newscheckr.source;

import com.goormthonuniv.newscheckr.domain.Bias;
import com.goormthonuniv.newscheckr.domain.SourceRating;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.*;

/**
 * 언론사 도메인별 평판(reputation prior)과 알려진 정치 성향을 관리하는 정적 레지스트리.
 * - 기동 시 한 번 구성되고 이후 읽기 전용 (요청 간 공유, 락 불필요)
 * - 정규화 규칙: 공백 제거 → 소문자 → URL이면 host만 → 선행 "www." 한 번 제거
 * - 정확 매칭만 지원. 미등록 도메인은 중립값(50, Center)
 *
 * 점수 범위: 0 ~ 100
 * - 85+ : 통신사/공영방송 등 검증 체계가 강한 매체
 * - 60~84: 주요 일간지/방송 (성향 있음)
 * - 40~59: 선정성/당파성이 강한 매체
 * - 40 미만: 풍자/음모론 사이트
 */
public class SourceRegistry {

    private final Map<String, SourceRating> ratings;

    public SourceRegistry(Collection<SourceRating> entries) {
        Map<String, SourceRating> table = new TreeMap<>();
        for (SourceRating r : entries) {
            String domain = normalize(r.domain());
            if (domain.isEmpty()) {
                throw new IllegalArgumentException("source rating without domain");
            }
            if (table.putIfAbsent(domain, SourceRating.known(domain, r.reputationScore(), r.knownBias())) != null) {
                throw new IllegalArgumentException("duplicate source domain: " + domain);
            }
        }
        this.ratings = Collections.unmodifiableMap(table);
    }

    /** 기본 평판 테이블 */
    public static SourceRegistry defaults() {
        List<SourceRating> t = new ArrayList<>();
        // ===== 통신사/공영 (높은 신뢰) =====
        t.add(SourceRating.known("reuters.com", 90, Bias.CENTER));
        t.add(SourceRating.known("apnews.com", 92, Bias.CENTER));
        t.add(SourceRating.known("ap.org", 92, Bias.CENTER));
        t.add(SourceRating.known("bbc.com", 88, Bias.CENTER));
        t.add(SourceRating.known("bbc.co.uk", 88, Bias.CENTER));
        t.add(SourceRating.known("npr.org", 87, Bias.CENTER));
        t.add(SourceRating.known("pbs.org", 86, Bias.CENTER));
        t.add(SourceRating.known("economist.com", 85, Bias.CENTER));
        t.add(SourceRating.known("wsj.com", 84, Bias.CENTER));
        t.add(SourceRating.known("bloomberg.com", 84, Bias.CENTER));

        // ===== 진보 성향 =====
        t.add(SourceRating.known("nytimes.com", 82, Bias.LEFT));
        t.add(SourceRating.known("washingtonpost.com", 81, Bias.LEFT));
        t.add(SourceRating.known("theguardian.com", 79, Bias.LEFT));
        t.add(SourceRating.known("cnn.com", 75, Bias.LEFT));
        t.add(SourceRating.known("msnbc.com", 70, Bias.LEFT));
        t.add(SourceRating.known("huffpost.com", 62, Bias.LEFT));

        // ===== 보수 성향 =====
        t.add(SourceRating.known("foxnews.com", 68, Bias.RIGHT));
        t.add(SourceRating.known("nypost.com", 65, Bias.RIGHT));
        t.add(SourceRating.known("washingtonexaminer.com", 62, Bias.RIGHT));
        t.add(SourceRating.known("dailymail.co.uk", 60, Bias.RIGHT));
        t.add(SourceRating.known("breitbart.com", 45, Bias.RIGHT));

        // ===== 풍자/저신뢰 =====
        t.add(SourceRating.known("theonion.com", 20, Bias.CENTER));
        t.add(SourceRating.known("babylonbee.com", 20, Bias.RIGHT));
        t.add(SourceRating.known("infowars.com", 15, Bias.RIGHT));
        return new SourceRegistry(t);
    }

    /** 절대 실패하지 않는다. 정보 없음 = 중립 평판 */
    public SourceRating lookup(String domainOrUrl) {
        String domain = normalize(domainOrUrl);
        SourceRating hit = ratings.get(domain);
        return hit != null ? hit : SourceRating.neutral(domain);
    }

    /** 도메인 오름차순 */
    public List<SourceRating> listSources() {
        return List.copyOf(ratings.values());
    }

    public int size() {
        return ratings.size();
    }

    /** 입력이 URL이든 호스트든 받아서 정규화된 도메인을 반환 (null/공백 → "") */
    public static String normalize(String domainOrUrl) {
        if (domainOrUrl == null || domainOrUrl.isBlank()) return "";
        String raw = domainOrUrl.strip().toLowerCase(Locale.ROOT);

        String host = raw;
        if (raw.contains("://")) {
            try {
                URI uri = new URI(raw);
                if (uri.getHost() != null) host = uri.getHost();
            } catch (URISyntaxException ignored) {
                // 파싱 불가 입력은 원문 그대로 키로 사용 → 미등록 처리
            }
        }
        if (host.startsWith("www.")) {
            host = host.substring(4);
        }
        return host;
    }
}
