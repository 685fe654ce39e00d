package com.nevis.digest.config;

import com.nevis.digest.service.DigesterRegistry;
import com.nevis.digest.service.digester.DocToMarkdownDigester;
import com.nevis.digest.service.digester.ImageCaptioningDigester;
import com.nevis.digest.service.digester.ImageObjectsDigester;
import com.nevis.digest.service.digester.ImageOcrDigester;
import com.nevis.digest.service.digester.SearchKeywordDigester;
import com.nevis.digest.service.digester.SearchSemanticDigester;
import com.nevis.digest.service.digester.SpeechRecognitionDigester;
import com.nevis.digest.service.digester.SpeechRecognitionSummaryDigester;
import com.nevis.digest.service.digester.TagsDigester;
import com.nevis.digest.service.digester.UrlCrawlDigester;
import com.nevis.digest.service.digester.UrlCrawlSummaryDigester;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class DigesterConfig {

    /**
     * Registration order is execution order: producers of text first, then digesters that consume it.
     */
    @Bean
    public DigesterRegistry digesterRegistry(
        UrlCrawlDigester urlCrawl,
        DocToMarkdownDigester docToMarkdown,
        SpeechRecognitionDigester speechRecognition,
        ImageOcrDigester imageOcr,
        ImageCaptioningDigester imageCaptioning,
        ImageObjectsDigester imageObjects,
        UrlCrawlSummaryDigester urlCrawlSummary,
        SpeechRecognitionSummaryDigester speechRecognitionSummary,
        TagsDigester tags,
        SearchKeywordDigester searchKeyword,
        SearchSemanticDigester searchSemantic
    ) {
        DigesterRegistry registry = new DigesterRegistry();
        registry.initialize(List.of(
            urlCrawl,
            docToMarkdown,
            speechRecognition,
            imageOcr,
            imageCaptioning,
            imageObjects,
            urlCrawlSummary,
            speechRecognitionSummary,
            tags,
            searchKeyword,
            searchSemantic
        ));
        return registry;
    }
}
