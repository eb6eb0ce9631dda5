package com.williamcallahan.asciimarkdown.service.markdown;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import com.williamcallahan.asciimarkdown.config.AppProperties;
import com.williamcallahan.asciimarkdown.domain.document.Node;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.springframework.stereotype.Service;

import java.util.Objects;

/**
 * Converts markdown text into fixed-width plain text.
 *
 * <p>Each call parses the markdown with flexmark, adapts the result into a {@link Node} tree,
 * runs the reference pass and renders the annotated tree. Results are cached by markdown text;
 * the render settings are fixed for the lifetime of the service so they need not be part of
 * the key.</p>
 */
@Service
public class AsciiMarkdownService {

    private static final Logger logger = LoggerFactory.getLogger(AsciiMarkdownService.class);

    private final FlexmarkDocumentAdapter documentAdapter;
    private final RenderSettings settings;
    private final int maxInputLength;
    private final Cache<String, RenderedDocument> renderCache;

    public AsciiMarkdownService(AppProperties appProperties) {
        Objects.requireNonNull(appProperties, "App properties cannot be null");
        this.documentAdapter = new FlexmarkDocumentAdapter();
        this.settings = appProperties.getRender().toSettings();
        this.maxInputLength = appProperties.getInput().getMaxLength();
        this.renderCache = Caffeine.newBuilder()
            .maximumSize(appProperties.getCache().getMaxSize())
            .expireAfterWrite(appProperties.getCache().getTtl())
            .recordStats()
            .build();

        logger.info("AsciiMarkdownService initialized: {} columns, wrap={}, debug={}",
            settings.maxColumn(), settings.wrap(), settings.debug());
    }

    /**
     * Renders markdown to plain text.
     *
     * @param markdown the markdown text to render
     * @return rendered document; empty for null or blank input
     * @throws MarkdownProcessingException when the pipeline fails
     */
    public RenderedDocument render(String markdown) {
        if (markdown == null || markdown.isBlank()) {
            return RenderedDocument.empty();
        }

        if (markdown.length() > maxInputLength) {
            logger.warn("Markdown input exceeds maximum length: {} > {}",
                markdown.length(), maxInputLength);
            markdown = markdown.substring(0, maxInputLength);
        }

        RenderedDocument cached = renderCache.getIfPresent(markdown);
        if (cached != null) {
            logger.debug("Cache hit for plain-text rendering");
            return cached.asCached();
        }

        long startTime = System.currentTimeMillis();
        try {
            Node root = documentAdapter.parse(markdown);
            RenderedDocument result = renderTree(root, startTime);
            renderCache.put(markdown, result);
            return result;
        } catch (MarkdownProcessingException e) {
            logger.error("Rejected markdown document", e);
            throw e;
        } catch (RuntimeException e) {
            logger.error("Error rendering markdown to plain text", e);
            throw new MarkdownProcessingException("Failed to render markdown to plain text", e);
        }
    }

    /**
     * Renders a document tree built by the caller. The tree is annotated in place and the
     * result is not cached.
     *
     * @param root root of a freshly built tree
     * @return rendered document
     * @throws MalformedDocumentException when a span node contains a block node
     */
    public RenderedDocument render(Node root) {
        Objects.requireNonNull(root, "Document root cannot be null");
        return renderTree(root, System.currentTimeMillis());
    }

    private RenderedDocument renderTree(Node root, long startTime) {
        ReferenceTables tables = new ReferenceVisitor().traverse(root);
        if (settings.debug() && logger.isDebugEnabled()) {
            logger.debug("Document tree:\n{}", DebugTreeDumper.dump(root));
        }

        AsciiRenderer renderer = new AsciiRenderer(tables, settings);
        String text = renderer.render();
        long processingTime = System.currentTimeMillis() - startTime;

        logger.debug("Rendered {} chars in {}ms: {} headers, {} items, {} unresolved references",
            text.length(), processingTime, tables.headers().size(), tables.items().size(),
            renderer.unresolvedReferences());

        return new RenderedDocument(
            text,
            tables.headers().size(),
            tables.items().size(),
            tables.labels().size(),
            renderer.unresolvedReferences(),
            processingTime,
            false
        );
    }

    /**
     * Returns statistics of the render cache.
     *
     * @return Caffeine cache statistics
     */
    public CacheStats getCacheStats() {
        return renderCache.stats();
    }

    /**
     * Returns the approximate number of cached documents.
     *
     * @return estimated cache size
     */
    public long getCacheSize() {
        return renderCache.estimatedSize();
    }

    /**
     * Drops every cached document.
     *
     * @return estimated number of entries removed
     */
    public long clearCache() {
        long removed = renderCache.estimatedSize();
        renderCache.invalidateAll();
        logger.info("Plain-text render cache cleared ({} entries)", removed);
        return removed;
    }
}
