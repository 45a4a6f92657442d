package com.webchunker.core.segment;

import com.webchunker.core.model.Chunk;
import com.webchunker.core.model.HierarchyContext;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 표 → 줄 단위 파이프 구분 텍스트.
 * 행마다 th/td 텍스트를 열 순서대로 " | "로 잇고, 행은 "\n"으로 잇는다.
 * 중첩 표의 행은 바깥 표에 포함하지 않는다(중첩 표는 별도 청크).
 * 표 청크에는 최소 길이 기준을 적용하지 않는다. 빈 결과만 건너뜀.
 */
public final class TableFlattener {

    public static final String CELL_SEPARATOR = " | ";
    public static final String ROW_SEPARATOR = "\n";

    private final ChunkIdentifier identifier;

    public TableFlattener(ChunkIdentifier identifier) {
        this.identifier = Objects.requireNonNull(identifier, "identifier");
    }

    /** 문서의 모든 표를 같은 컨텍스트로 청크화 (본문 패스 이후 처리 방식) */
    public List<Chunk> flattenAll(Document doc, HierarchyContext ctx, PageMeta meta) {
        List<Chunk> out = new ArrayList<>();
        for (Element table : doc.select("table")) {
            flatten(table, ctx, meta).ifPresent(out::add);
        }
        return out;
    }

    public Optional<Chunk> flatten(Element table, HierarchyContext ctx, PageMeta meta) {
        String text = flattenText(table);
        if (text.isEmpty()) return Optional.empty();
        return Optional.of(meta.toChunk(ctx, Chunk.TABLE, text, identifier.identify(text)));
    }

    /** 표 1개의 평탄화 텍스트. 셀이 하나도 없으면 "" */
    public static String flattenText(Element table) {
        if (table == null || !"table".equals(table.normalName())) return "";
        List<String> lines = new ArrayList<>();
        for (Element row : table.select("tr")) {
            if (owningTable(row) != table) continue;

            List<String> cells = new ArrayList<>();
            boolean anyText = false;
            for (Element cell : row.children()) {
                String tag = cell.normalName();
                if (!tag.equals("th") && !tag.equals("td")) continue;
                String t = TextNormalizer.normalize(cell.text());
                if (!t.isEmpty()) anyText = true;
                cells.add(t);
            }
            if (anyText) lines.add(String.join(CELL_SEPARATOR, cells));
        }
        return String.join(ROW_SEPARATOR, lines);
    }

    private static Element owningTable(Element row) {
        Element p = row.parent();
        while (p != null && !"table".equals(p.normalName())) p = p.parent();
        return p;
    }
}
