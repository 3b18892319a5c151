package com.webharvest.core.crawler;

import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;

/**
 * 정리된 DOM → Markdown 유사 텍스트.
 * 블록은 문서 순서를 유지하고 빈 줄로 구분한다. 다른 블록 안에 중첩된 블록은 반복 출력하지 않는다
 * (단, li 안의 li는 들여쓰기된 하위 항목으로 출력).
 */
final class MarkdownRenderer {
    private MarkdownRenderer() {}

    static String render(Element root, StructuralTagClassifier classifier) {
        List<String> blocks = new ArrayList<>();
        for (Element el : root.getAllElements()) {
            BlockKind kind = classifier.classify(el);
            if (kind == BlockKind.NONE) continue;
            if (coveredByAncestor(el, kind, root, classifier)) continue;

            String line = switch (kind) {
                case HEADING -> heading(el);
                case PARAGRAPH -> el.text().trim();
                case LIST_ITEM -> listItem(el, root, classifier);
                case QUOTE -> quote(el);
                case CODE -> code(el);
                case NONE -> "";
            };
            if (!line.isBlank()) blocks.add(line);
        }
        return String.join("\n\n", blocks);
    }

    private static boolean coveredByAncestor(Element el, BlockKind kind, Element root, StructuralTagClassifier c) {
        for (Element p = el.parent(); p != null && p != root.parent(); p = p.parent()) {
            BlockKind pk = c.classify(p);
            if (pk == BlockKind.NONE) continue;
            if (kind == BlockKind.LIST_ITEM && pk == BlockKind.LIST_ITEM) continue;
            return true;
        }
        return false;
    }

    private static String heading(Element el) {
        String text = el.text().trim();
        if (text.isEmpty()) return "";
        int level = 1;
        String name = el.normalName();
        if (name.length() == 2 && name.charAt(0) == 'h' && Character.isDigit(name.charAt(1))) {
            level = Math.max(1, Math.min(6, name.charAt(1) - '0'));
        }
        return "#".repeat(level) + " " + text;
    }

    private static String listItem(Element el, Element root, StructuralTagClassifier c) {
        // 하위 목록은 별도 항목으로 나오므로 자기 텍스트에서 제외
        Element copy = el.clone();
        copy.select("ul, ol").remove();
        String text = copy.text().trim();
        if (text.isEmpty()) return "";

        int nesting = 0;
        for (Element p = el.parent(); p != null && p != root; p = p.parent()) {
            if (c.classify(p) == BlockKind.LIST_ITEM) nesting++;
        }
        return "  ".repeat(nesting) + "- " + text;
    }

    private static String quote(Element el) {
        String text = el.text().trim();
        return text.isEmpty() ? "" : "> " + text;
    }

    private static String code(Element el) {
        String text = el.wholeText();
        if (text.isBlank()) return "";
        return "```\n" + text.strip() + "\n```";
    }
}
