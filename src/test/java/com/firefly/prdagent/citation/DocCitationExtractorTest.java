package com.firefly.prdagent.citation;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DocCitationExtractorTest {

    private final DocCitationExtractor extractor = new DocCitationExtractor();

    private String document;

    @BeforeEach
    void loadFixture() throws IOException {
        try (InputStream in = getClass().getResourceAsStream("/fixtures/sample-prd.md")) {
            assertThat(in).isNotNull();
            document = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    @Test
    void shouldComputeHeadingIdsSkippingFencedLines() {
        assertThat(extractor.headingIds(document))
                .containsExactly("报表导出-prd", "背景", "导出范围", "权限", "权限-1");
    }

    @Test
    void shouldSlugDuplicateEnglishHeadings() {
        String doc = "# Overview\n\nfirst overview paragraph text\n\n# Overview\n\nsecond overview paragraph text\n";

        assertThat(extractor.headingIds(doc)).containsExactly("overview", "overview-1");
    }

    @Test
    void shouldCiteSectionContainingAnswerKeywords() {
        List<DocCitation> citations = extractor.extract(document, "导出上限为 50000 行，超出时需要提示用户缩小日期区间。");

        assertThat(citations).hasSize(1);
        DocCitation top = citations.get(0);
        assertThat(top.getHeadingTitle()).isEqualTo("导出范围");
        assertThat(top.getHeadingId()).isEqualTo("导出范围");
        assertThat(top.getRank()).isEqualTo(1);
        assertThat(top.getScore()).isGreaterThan(0);
        assertThat(top.getExcerpt()).contains("50000").doesNotContain("select");
    }

    @Test
    void shouldUseSuffixedAnchorForDuplicateHeading() {
        List<DocCitation> citations = extractor.extract(document, "审计日志 需要保留 180 天");

        assertThat(citations).extracting(DocCitation::getHeadingId).containsExactly("权限-1");
        assertThat(citations.get(0).getHeadingTitle()).isEqualTo("权限");
    }

    @Test
    void shouldReturnEmptyWhenAnswerHasNoKeywords() {
        assertThat(extractor.extract(document, "!!! ??? ，。")).isEmpty();
        assertThat(extractor.extract(document, "   ")).isEmpty();
    }

    @Test
    void shouldReturnEmptyForBlankDocumentOrZeroLimit() {
        assertThat(extractor.extract("", "导出上限")).isEmpty();
        assertThat(extractor.extract(null, "导出上限")).isEmpty();
        assertThat(extractor.extract(document, "导出上限为 50000 行", 0)).isEmpty();
    }

    @Test
    void shouldRespectMaxCitationsAndRankInOrder() {
        String answer = "导出报表 审计日志 订单数据 订单明细 运营角色";

        List<DocCitation> all = extractor.extract(document, answer);
        List<DocCitation> limited = extractor.extract(document, answer, 1);

        assertThat(all.size()).isGreaterThan(1);
        assertThat(all).extracting(DocCitation::getRank).startsWith(1, 2);
        assertThat(limited).hasSize(1);
        assertThat(limited.get(0).getHeadingId()).isEqualTo(all.get(0).getHeadingId());
    }
}
