package com.webchunker.core.service.export;

import com.webchunker.core.model.CrawlResult;

import java.io.IOException;
import java.nio.file.Path;

/** 크롤 결과(청크 목록)를 보고서 파일로 내보내는 책임 (확장: txt/json 등) */
public interface ReportExporter {
    /**
     * @param baseDir 출력 루트 (null이면 "out")
     * @param result  크롤 결과. 청크가 0개여도 파일은 만든다
     * @return 생성된 파일의 경로
     */
    Path export(Path baseDir, CrawlResult result) throws IOException;

    /** "txt", "json" */
    String format();
}
