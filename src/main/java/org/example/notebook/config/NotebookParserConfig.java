package org.example.notebook.config;

import org.example.notebook.kindle.BlockScanner;
import org.example.notebook.kindle.BlockScanner.BlockMarkers;
import org.example.notebook.kindle.KindleNotebookParser;
import org.example.notebook.kindle.TitleAuthorExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the notebook parser.
 * The block class markers can be overridden for export templates that rename them.
 */
@Configuration
public class NotebookParserConfig {

    private static final Logger log = LoggerFactory.getLogger(NotebookParserConfig.class);

    @Value("${notebook.parser.heading-class:noteHeading}")
    private String headingClass;

    @Value("${notebook.parser.body-class:noteText}")
    private String bodyClass;

    @Bean
    public KindleNotebookParser kindleNotebookParser() {
        BlockMarkers markers = resolveMarkers(headingClass, bodyClass);
        log.info("Configuring notebook parser: headingClass={}, bodyClass={}",
                markers.headingClass(), markers.bodyClass());
        return new KindleNotebookParser(new BlockScanner(markers), new TitleAuthorExtractor());
    }

    static BlockMarkers resolveMarkers(String headingClass, String bodyClass) {
        if (headingClass == null || headingClass.isBlank() || bodyClass == null || bodyClass.isBlank()) {
            log.warn("Blank notebook block class configured, falling back to {}", BlockMarkers.DEFAULT);
            return BlockMarkers.DEFAULT;
        }
        return new BlockMarkers(headingClass, bodyClass);
    }
}
