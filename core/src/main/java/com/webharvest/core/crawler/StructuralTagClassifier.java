package com.webharvest.core.crawler;

import org.jsoup.nodes.Element;

/**
 * HTML → Markdown 변환 규칙을 데이터로 분리한 전략.
 * 합성 DOM 픽스처로 규칙만 따로 테스트할 수 있게 한다.
 */
public interface StructuralTagClassifier {

    /** 본문이 아닌 서브트리(script/nav/광고 등)면 true: 통째로 제거된다 */
    boolean isNoise(Element el);

    /** 블록 종류. 블록이 아니면 {@link BlockKind#NONE} */
    BlockKind classify(Element el);
}
