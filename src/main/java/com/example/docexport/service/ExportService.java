package com.example.docexport.service;

import com.example.docexport.aspect.LogExecutionTime;
import com.example.docexport.config.RenderProperties;
import com.example.docexport.core.DocumentCursor;
import com.example.docexport.core.RenderContext;
import com.example.docexport.exception.ExportFailedException;
import com.example.docexport.model.Article;
import com.example.docexport.model.Block;
import com.example.docexport.model.Book;
import com.example.docexport.model.ErrorCategory;
import com.example.docexport.model.ExportReport;
import com.example.docexport.model.ExportRequest;
import com.example.docexport.model.ExportResult;
import com.example.docexport.model.RenderError;
import com.example.docexport.model.Shelf;
import com.example.docexport.model.StoredExport;
import com.example.docexport.renderer.TitleWriter;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.List;

/**
 * Main orchestrator for DOCX export.
 *
 * Writes the shelf title, then for every book its title and for every article
 * its header and blocks. Snippet blocks are expanded first, legacy articles
 * get the cell depth normalization pass, and a terminal empty paragraph is
 * appended so open tables and lists are finished off. Each article ends with
 * a page break. When a template is supplied its fonts are merged into the
 * finished document before it is serialized.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExportService {

    private final BlockDispatcher blockDispatcher;
    private final DepthNormalizer depthNormalizer;
    private final SnippetExpander snippetExpander;
    private final TitleWriter titleWriter;
    private final StyleMergeService styleMergeService;
    private final StyleTemplateLoader templateLoader;
    private final DocxOutputService outputService;
    private final ExportStorageService storageService;
    private final RenderProperties properties;

    /**
     * Render the shelf of the request, using the referenced template if any
     */
    @LogExecutionTime("Total DOCX Export")
    public ExportResult export(ExportRequest request) {
        if (request == null || request.getShelf() == null) {
            throw new IllegalArgumentException("Export request must contain a shelf");
        }
        Shelf shelf = request.getShelf();
        log.info("Exporting shelf '{}' ({} books)", shelf.getShelfName(), shelf.getBooks() == null ? 0 : shelf.getBooks().size());

        byte[] templateBytes = null;
        if (request.getTemplateBase64() != null && !request.getTemplateBase64().isBlank()) {
            templateBytes = templateLoader.decodeInline(request.getTemplateBase64());
        } else if (request.getTemplateId() != null && !request.getTemplateId().isBlank()) {
            templateBytes = templateLoader.getTemplateBytes(request.getTemplateId());
        }
        if (templateBytes == null) {
            return render(shelf, null);
        }
        try (XWPFDocument template = templateLoader.open(templateBytes)) {
            return render(shelf, template);
        } catch (IOException e) {
            throw new ExportFailedException("Failed to release template document", e);
        }
    }

    /**
     * Render and upload; returns the stored location alongside the render report
     */
    public StoredResult exportAndStore(ExportRequest request) {
        ExportResult result = export(request);
        Shelf shelf = request.getShelf();
        String filename = request.getFilename() != null ? request.getFilename() : shelf.getShelfName();
        StoredExport stored = storageService.save(shelf.getId(), shelf.getRequestUserId(), filename, result.getContent());
        return new StoredResult(stored, result.getReport());
    }

    public ExportResult render(Shelf shelf, XWPFDocument template) {
        return render(shelf, template, new ShelfSnippetResolver(shelf));
    }

    public ExportResult render(Shelf shelf, XWPFDocument template, SnippetResolver snippetResolver) {
        ExportReport report = new ExportReport();
        DocumentCursor cursor = DocumentCursor.create(properties);
        XWPFDocument document = cursor.getDocument();
        titleWriter.writeShelfTitle(cursor, shelf.getShelfName());
        for (Book book : nullSafe(shelf.getBooks())) {
            titleWriter.writeBookTitle(cursor, book.getName());
            for (Article article : nullSafe(book.getArticles())) {
                renderArticle(article, cursor, snippetResolver, report);
            }
        }
        if (template != null) {
            styleMergeService.merge(document, template, report);
        }
        byte[] content = outputService.toBytes(document);
        log.info("Export finished: {} blocks dispatched, {} errors, {} bytes",
                report.getBlocksDispatched(), report.getErrors().size(), content.length);
        return new ExportResult(content, report);
    }

    /**
     * Blocks of the article as they will be dispatched: snippets expanded,
     * legacy depths normalized and the terminal block appended
     */
    List<Block> prepareBlocks(Article article, SnippetResolver snippetResolver, ExportReport report) {
        List<Block> blocks = snippetExpander.expand(article.getBlocks(), snippetResolver, report);
        if (article.getDocVersion() <= properties.getLegacyDocVersion()) {
            blocks = depthNormalizer.normalize(blocks);
        }
        blocks.add(Block.terminal());
        return blocks;
    }

    private void renderArticle(Article article, DocumentCursor cursor, SnippetResolver snippetResolver, ExportReport report) {
        try {
            List<Block> blocks = prepareBlocks(article, snippetResolver, report);
            RenderContext context = new RenderContext(cursor, blocks, article.getEntityMap(), article.getDocVersion(), report);
            titleWriter.writeArticleHeader(article, context);
            int dispatched = blockDispatcher.dispatchAll(context);
            report.setBlocksDispatched(report.getBlocksDispatched() + dispatched);
            log.debug("Article '{}' rendered: {} blocks", article.getName(), dispatched);
        } catch (RuntimeException e) {
            log.error("Article '{}' aborted", article.getName(), e);
            report.add(RenderError.builder()
                    .category(ErrorCategory.BLOCK)
                    .message("Article '" + article.getName() + "' aborted: " + e.getMessage())
                    .build());
        }
        cursor.pageBreak();
    }

    private static <T> List<T> nullSafe(List<T> list) {
        return list == null ? List.of() : list;
    }

    @Getter
    @AllArgsConstructor
    public static class StoredResult {
        private final StoredExport stored;
        private final ExportReport report;
    }
}
