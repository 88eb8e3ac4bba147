/**
 * ContentNormalizer는 기사 본문 HTML을 순수 텍스트로 변환합니다.
 * - 스크립트, 스타일, 임베드, 폼, 관련 기사/공유 블록, figure/캡션을 먼저 제거합니다.
 * - 문단(p), 소제목(h2, h3), 목록(ul, ol) 블록의 텍스트만 문서 순서대로 모아 빈 줄로 연결합니다.
 * - 100자 미만이면서 상용구("Прочитајте", "Read More" 등)를 포함한 블록은 제외합니다.
 *   상용구 비교는 대소문자를 구분합니다.
 * - 잘못된 마크업에도 예외를 던지지 않으며, null 또는 빈 입력은 빈 문자열을 반환합니다.
 */

package com.example.newsharvester.service;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;

import java.util.ArrayList;
import java.util.List;

public class ContentNormalizer {
    static final int BOILERPLATE_MAX_LENGTH = 100;
    static final String BLOCK_SEPARATOR = "\n\n";

    private static final String NOISE = "script, style, iframe, embed, object, noscript, form, figure, figcaption, "
            + ".related-posts, .sharedaddy, .jp-relatedposts";
    private static final String BLOCKS = "p, h2, h3, ul, ol";

    private final List<String> boilerplatePhrases;

    public ContentNormalizer(List<String> boilerplatePhrases) {
        this.boilerplatePhrases = List.copyOf(boilerplatePhrases);
    }

    public String normalize(String rawHtml) {
        if (rawHtml == null || rawHtml.isBlank()) {
            return "";
        }
        Document doc = Jsoup.parseBodyFragment(rawHtml);
        doc.select(NOISE).remove();

        List<String> parts = new ArrayList<>();
        for (Element block : doc.body().select(BLOCKS)) {
            // 바깥 블록의 텍스트에 이미 포함되어 있습니다.
            if (insideBlock(block)) {
                continue;
            }
            String text = block.text().replace('\u00a0', ' ').trim();
            if (text.isEmpty() || isBoilerplate(text)) {
                continue;
            }
            parts.add(text);
        }
        return String.join(BLOCK_SEPARATOR, parts);
    }

    public String normalizeTitle(String rawTitle) {
        if (rawTitle == null) {
            return "";
        }
        return Parser.unescapeEntities(rawTitle, false).trim();
    }

    boolean isBoilerplate(String text) {
        if (text.length() >= BOILERPLATE_MAX_LENGTH) {
            return false;
        }
        for (String phrase : boilerplatePhrases) {
            if (text.contains(phrase)) {
                return true;
            }
        }
        return false;
    }

    private static boolean insideBlock(Element block) {
        for (Element parent = block.parent(); parent != null; parent = parent.parent()) {
            if (parent.is(BLOCKS)) {
                return true;
            }
        }
        return false;
    }
}
