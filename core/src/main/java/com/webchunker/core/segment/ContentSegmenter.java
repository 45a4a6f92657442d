package com.webchunker.core.segment;

import com.webchunker.core.model.Chunk;
import com.webchunker.core.model.CrawlConfig;
import com.webchunker.core.model.CrawlConfig.TableAttribution;
import com.webchunker.core.model.HierarchyContext;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.net.URI;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 노이즈 제거된 문서를 문서 순서대로 훑으며 텍스트 청크를 만든다.
 * <ul>
 *   <li>h1~h4: 계층 컨텍스트만 갱신(청크 생성 안 함, 길이 기준 미적용)</li>
 *   <li>p/li/td/dd(+옵션 div/span): 정규화 텍스트가 최소 길이 이상이면 청크</li>
 *   <li>표: {@link TableAttribution}에 따라 본문 이후 일괄 또는 문서 순서대로</li>
 * </ul>
 * 컨텍스트는 불변 스냅샷을 지역 변수로만 넘기므로 인스턴스는 상태가 없다(스레드 세이프).
 */
public final class ContentSegmenter {

    public static final String BASE_TAGS = "h1, h2, h3, h4, p, li, td, dd";
    public static final String CONTAINER_TAGS = "div, span";

    private final int minChunkLength;
    private final TableAttribution tableAttribution;
    private final String documentType;
    private final String selector;
    private final OrganizationExtractor organization;
    private final ChunkIdentifier identifier;
    private final TableFlattener tables;

    public ContentSegmenter(CrawlConfig config) {
        this(config, OrganizationExtractor.from(config.getOrganization()), ChunkIdentifier.DEFAULT);
    }

    public ContentSegmenter(CrawlConfig config, OrganizationExtractor organization, ChunkIdentifier identifier) {
        Objects.requireNonNull(config, "config");
        CrawlConfig.Segmenter s = config.getSegmenter();
        this.minChunkLength = s.getMinChunkLength();
        this.tableAttribution = s.getTableAttribution();
        this.documentType = config.getDocumentType();
        this.organization = Objects.requireNonNull(organization, "organization");
        this.identifier = Objects.requireNonNull(identifier, "identifier");
        this.tables = new TableFlattener(identifier);

        String sel = BASE_TAGS;
        if (s.isIncludeContainers()) sel += ", " + CONTAINER_TAGS;
        if (tableAttribution == TableAttribution.DOCUMENT_ORDER) sel += ", table";
        this.selector = sel;
    }

    /** 세그먼트 결과: 청크(문서 순서) + 페이지 끝 시점의 컨텍스트 + 길이 미달로 버린 수 */
    public record Segmentation(List<Chunk> chunks, HierarchyContext finalContext, int droppedShort) {}

    public Segmentation segment(Document doc, URI url, Instant extractedAt) {
        Objects.requireNonNull(doc, "doc");
        PageMeta meta = new PageMeta(url, titleOf(doc), organization.extract(doc), documentType, extractedAt);

        List<Chunk> out = new ArrayList<>();
        HierarchyContext ctx = HierarchyContext.EMPTY; // 페이지마다 새로 시작
        int dropped = 0;

        for (Element el : doc.select(selector)) {
            String tag = el.normalName();

            int level = headingLevel(tag);
            if (level > 0) {
                ctx = applyHeading(ctx, level, el);
                continue;
            }

            if (tag.equals("table")) {
                tables.flatten(el, ctx, meta).ifPresent(out::add);
                continue;
            }

            String text = TextNormalizer.normalize(el.text());
            if (text.length() < minChunkLength) {
                if (!text.isEmpty()) dropped++;
                continue;
            }
            out.add(meta.toChunk(ctx, tag, text, identifier.identify(text)));
        }

        if (tableAttribution == TableAttribution.AFTER_CONTENT) {
            // 알려진 한계: 모든 표가 페이지의 마지막 heading 컨텍스트로 귀속된다
            out.addAll(tables.flattenAll(doc, ctx, meta));
        }
        return new Segmentation(out, ctx, dropped);
    }

    static HierarchyContext applyHeading(HierarchyContext ctx, int level, Element heading) {
        String text = TextNormalizer.normalize(heading.text());
        if (text.isEmpty()) return ctx;
        return ctx.withHeading(level, text);
    }

    /** h1~h4 → 1~4, 그 외 0 */
    static int headingLevel(String tag) {
        if (tag.length() != 2 || tag.charAt(0) != 'h') return 0;
        char c = tag.charAt(1);
        return (c >= '1' && c <= '4') ? c - '0' : 0;
    }

    /** 첫 title 요소 텍스트, 없거나 비면 "Unknown" */
    public static String titleOf(Document doc) {
        Element title = doc.selectFirst("title");
        if (title == null) return PageMeta.UNKNOWN_TITLE;
        String t = TextNormalizer.normalize(title.text());
        return t.isEmpty() ? PageMeta.UNKNOWN_TITLE : t;
    }

    public int getMinChunkLength() { return minChunkLength; }
    public TableAttribution getTableAttribution() { return tableAttribution; }
}
