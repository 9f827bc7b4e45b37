package com.goormthonuniv.newscheckr.summarize;

import java.util.List;

/**
 * 추출 요약 전략. 실패 시 RuntimeException을 던지고, 체인은 다음 전략으로 넘어간다.
 */
public interface SummaryStrategy {

    /** 메타데이터에 기록되는 방법 이름 */
    String name();

    /**
     * @return 선택된 문장 인덱스 (오름차순, 최대 maxSentences 개)
     */
    List<Integer> select(List<String> sentences, int maxSentences);
}
